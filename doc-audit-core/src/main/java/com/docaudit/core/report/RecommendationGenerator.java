package com.docaudit.core.report;

import com.docaudit.core.model.BrokenReference;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.DocumentRecommendation;
import com.docaudit.core.model.FrontmatterCoverage;
import com.docaudit.core.model.IssueCategory;
import com.docaudit.core.model.QualityLabel;
import com.docaudit.core.model.QualityRecord;
import com.docaudit.core.model.ReadabilityLabel;
import com.docaudit.core.model.ReadabilityRecord;
import com.docaudit.core.model.Recommendation;
import com.docaudit.core.model.RecommendationPriority;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns issue counts into fixed, deterministic recommendation texts.
 */
public class RecommendationGenerator {

    /**
     * Corpus-level recommendations, one per issue category with a nonzero count, in the order
     * broken references, front-matter, low quality, complex readability, orphans, linting.
     */
    public List<Recommendation> corpusRecommendations(DocumentGraph graph,
                                                      FrontmatterCoverage coverage,
                                                      List<QualityRecord> quality,
                                                      List<ReadabilityRecord> readability,
                                                      int lintingIssues) {
        List<Recommendation> recommendations = new ArrayList<>();

        int broken = graph.brokenReferences().size();
        if (broken > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.HIGH, IssueCategory.BROKEN_REFERENCES, broken,
                "Fix " + broken + " broken links (run fix-links for suggestions)"));
        }
        if (coverage.issues() > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.MEDIUM, IssueCategory.FRONTMATTER, coverage.issues(),
                "Fix " + coverage.issues() + " frontmatter issues (" + coverage.absent() + " missing, "
                    + coverage.incomplete() + " incomplete)"));
        }
        long lowQuality = quality.stream().filter(record -> record.label().isLowQuality()).count();
        if (lowQuality > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.MEDIUM, IssueCategory.LOW_QUALITY, (int) lowQuality,
                "Improve " + lowQuality + " documents with poor/very poor quality scores"));
        }
        long complex = readability.stream().filter(record -> record.label() == ReadabilityLabel.COMPLEX).count();
        if (complex > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.LOW, IssueCategory.COMPLEX_READABILITY, (int) complex,
                "Simplify " + complex + " documents with complex readability"));
        }
        int orphans = graph.orphans().size();
        if (orphans > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.LOW, IssueCategory.ORPHANS, orphans,
                "Link " + orphans + " orphaned documents from related documents or an index"));
        }
        if (lintingIssues > 0) {
            recommendations.add(new Recommendation(RecommendationPriority.LOW, IssueCategory.LINTING, lintingIssues,
                "Address " + lintingIssues + " markdown linting issues"));
        }
        return recommendations;
    }

    /**
     * Suggestions for a single document; empty when there is nothing to say.
     *
     * @param analysis the document's analysis
     * @param broken broken references originating in the document
     * @return suggestion lines
     */
    public List<String> documentSuggestions(DocumentAnalysis analysis, List<BrokenReference> broken) {
        List<String> suggestions = new ArrayList<>();
        QualityRecord quality = analysis.quality();
        ReadabilityRecord readability = analysis.readability();

        if (quality.label().isLowQuality()) {
            suggestions.add("Structure needs significant improvement: add a title heading, at least two sections, "
                + "code examples with a language and links to related documents.");
        } else if (quality.label() == QualityLabel.ADEQUATE) {
            suggestions.add("Good basic structure, but needs more detail: add code examples and links to related documents.");
        }

        if (readability.label() == ReadabilityLabel.COMPLEX) {
            suggestions.add(String.format(Locale.ROOT,
                "Simplify content: break long sentences into shorter ones (currently %.1f words per sentence).",
                readability.wordsPerSentence()));
        } else if (readability.label() == ReadabilityLabel.SIMPLE && readability.wordCount() > 0) {
            suggestions.add("Content may be too simplistic: add explanations and context.");
        }

        if (!quality.hasRelatedSection() && (quality.label().isLowQuality() || quality.label() == QualityLabel.ADEQUATE)) {
            suggestions.add("Add a 'Related Documents' section linking to related documentation.");
        }

        for (BrokenReference reference : broken) {
            suggestions.add("Fix broken link to " + reference.reference() + ".");
        }
        return suggestions;
    }

    public List<DocumentRecommendation> documentRecommendations(List<DocumentAnalysis> analyses, DocumentGraph graph) {
        List<DocumentRecommendation> recommendations = new ArrayList<>();
        for (DocumentAnalysis analysis : analyses) {
            List<BrokenReference> broken = graph.brokenReferences().stream()
                .filter(reference -> reference.sourcePath().equals(analysis.path()))
                .toList();
            List<String> suggestions = documentSuggestions(analysis, broken);
            if (!suggestions.isEmpty()) {
                recommendations.add(new DocumentRecommendation(analysis.path(), suggestions));
            }
        }
        return recommendations;
    }
}
