package com.docaudit.core.report;

import com.docaudit.core.analysis.DocumentAnalyzer;
import com.docaudit.core.analysis.FrontmatterValidator;
import com.docaudit.core.analysis.LinkResolver;
import com.docaudit.core.graph.DocumentGraphBuilder;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.DocumentRecommendation;
import com.docaudit.core.model.FrontmatterCoverage;
import com.docaudit.core.model.IssueCategory;
import com.docaudit.core.model.Recommendation;
import com.docaudit.core.model.RecommendationPriority;
import com.docaudit.core.model.SourceDocument;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RecommendationGenerator}.
 */
class RecommendationGeneratorTest {

    private final RecommendationGenerator generator = new RecommendationGenerator();
    private final DocumentAnalyzer analyzer = new DocumentAnalyzer(new FrontmatterValidator(), 1);

    private DocumentAnalysis analyze(String path, String content) {
        return analyzer.analyze(new SourceDocument(path, content.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void corpusRecommendations_noIssues_isEmpty() {
        List<Recommendation> recommendations = generator.corpusRecommendations(DocumentGraph.empty(),
            new FrontmatterCoverage(2, 0, 0), List.of(), List.of(), 0);

        assertThat(recommendations).isEmpty();
    }

    @Test
    void corpusRecommendations_orderedByCategoryWithCounts() {
        DocumentAnalysis poor = analyze("docs/a.md", "[gone](gone.md) " + "word ".repeat(30));
        DocumentGraph graph = new DocumentGraphBuilder(new LinkResolver("docs", Set.of("docs/a.md")::contains))
            .build(List.of(poor));

        List<Recommendation> recommendations = generator.corpusRecommendations(graph, new FrontmatterCoverage(0, 1, 1),
            List.of(poor.quality()), List.of(poor.readability()), 7);

        assertThat(recommendations).extracting(Recommendation::category).containsExactly(
            IssueCategory.BROKEN_REFERENCES, IssueCategory.FRONTMATTER, IssueCategory.LOW_QUALITY,
            IssueCategory.COMPLEX_READABILITY, IssueCategory.ORPHANS, IssueCategory.LINTING);
        assertThat(recommendations).extracting(Recommendation::message).containsExactly(
            "Fix 1 broken links (run fix-links for suggestions)",
            "Fix 2 frontmatter issues (1 missing, 1 incomplete)",
            "Improve 1 documents with poor/very poor quality scores",
            "Simplify 1 documents with complex readability",
            "Link 1 orphaned documents from related documents or an index",
            "Address 7 markdown linting issues");
        assertThat(recommendations.get(0).priority()).isEqualTo(RecommendationPriority.HIGH);
        assertThat(recommendations.get(5).priority()).isEqualTo(RecommendationPriority.LOW);
    }

    @Test
    void documentSuggestions_lowQualityComplexDocument_listsStructureReadabilityAndRelated() {
        DocumentAnalysis analysis = analyze("docs/a.md", "word ".repeat(42));

        List<String> suggestions = generator.documentSuggestions(analysis, List.of());

        assertThat(suggestions).hasSize(3);
        assertThat(suggestions.get(0)).startsWith("Structure needs significant improvement");
        assertThat(suggestions.get(1)).isEqualTo(
            "Simplify content: break long sentences into shorter ones (currently 42.0 words per sentence).");
        assertThat(suggestions.get(2)).isEqualTo("Add a 'Related Documents' section linking to related documentation.");
    }

    @Test
    void documentSuggestions_emptyBody_isNotCalledSimplistic() {
        DocumentAnalysis analysis = analyze("docs/a.md", "");

        assertThat(generator.documentSuggestions(analysis, List.of()))
            .noneMatch(suggestion -> suggestion.startsWith("Content may be too simplistic"));
    }

    @Test
    void documentRecommendations_includeBrokenLinksOfThatDocumentOnly() {
        DocumentAnalysis a = analyze("docs/a.md", "[gone](gone.md)\n");
        DocumentAnalysis b = analyze("docs/b.md", "[a](a.md)\n");
        DocumentGraph graph = new DocumentGraphBuilder(new LinkResolver("docs", Set.of("docs/a.md", "docs/b.md")::contains))
            .build(List.of(a, b));

        List<DocumentRecommendation> recommendations = generator.documentRecommendations(List.of(a, b), graph);

        assertThat(recommendations).filteredOn(r -> r.path().equals("docs/a.md")).singleElement()
            .satisfies(r -> assertThat(r.suggestions()).contains("Fix broken link to gone.md."));
        assertThat(recommendations).filteredOn(r -> r.path().equals("docs/b.md")).singleElement()
            .satisfies(r -> assertThat(r.suggestions()).noneMatch(s -> s.startsWith("Fix broken link")));
    }
}
