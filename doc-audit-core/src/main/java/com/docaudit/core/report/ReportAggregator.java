package com.docaudit.core.report;

import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentCategory;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.DocumentSummary;
import com.docaudit.core.model.FrontmatterCoverage;
import com.docaudit.core.model.FrontmatterFinding;
import com.docaudit.core.model.FrontmatterRecord;
import com.docaudit.core.model.FrontmatterStatus;
import com.docaudit.core.model.HealthRating;
import com.docaudit.core.model.QualityLabel;
import com.docaudit.core.model.QualityRecord;
import com.docaudit.core.model.ReadabilityLabel;
import com.docaudit.core.model.ReadabilityRecord;
import com.docaudit.core.model.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Folds per-document analyses and the reference graph into one immutable {@link Report}.
 */
public class ReportAggregator {

    private static final Logger log = LoggerFactory.getLogger(ReportAggregator.class);

    public static final int TOP_TAGS = 10;

    private final RecommendationGenerator recommendationGenerator;
    private final Clock clock;
    private final boolean includeReadability;

    public ReportAggregator() {
        this(new RecommendationGenerator(), Clock.systemDefaultZone(), true);
    }

    public ReportAggregator(RecommendationGenerator recommendationGenerator, Clock clock, boolean includeReadability) {
        this.recommendationGenerator = Objects.requireNonNull(recommendationGenerator);
        this.clock = Objects.requireNonNull(clock);
        this.includeReadability = includeReadability;
    }

    /**
     * Builds the report.
     *
     * @param scope description of what was audited
     * @param singleFile whether the run covered a single file
     * @param analyses per-document analyses
     * @param graph reference graph over the same documents
     * @param lintingIssues externally supplied lint issue count, 0 when unknown
     * @return immutable report
     */
    public Report aggregate(String scope,
                            boolean singleFile,
                            List<DocumentAnalysis> analyses,
                            DocumentGraph graph,
                            int lintingIssues) {
        List<DocumentAnalysis> sorted = analyses.stream()
            .sorted(Comparator.comparing(DocumentAnalysis::path))
            .toList();

        List<QualityRecord> quality = sorted.stream().map(DocumentAnalysis::quality).toList();
        List<ReadabilityRecord> readability = sorted.stream().map(DocumentAnalysis::readability).toList();
        List<FrontmatterFinding> findings = sorted.stream().map(DocumentAnalysis::frontmatter).toList();

        FrontmatterCoverage coverage = new FrontmatterCoverage(
            count(findings, FrontmatterStatus.COMPLETE),
            count(findings, FrontmatterStatus.INCOMPLETE),
            count(findings, FrontmatterStatus.ABSENT));

        Map<QualityLabel, Integer> qualityCounts = new EnumMap<>(QualityLabel.class);
        quality.forEach(record -> qualityCounts.merge(record.label(), 1, Integer::sum));
        int goodReadability = (int) readability.stream().filter(record -> record.label() == ReadabilityLabel.GOOD).count();

        int healthScore = HealthScoreCalculator.calculate(sorted.size(), lintingIssues, graph.brokenReferences().size(),
            coverage.issues(), qualityCounts, goodReadability, includeReadability);

        Report report = new Report(
            scope,
            singleFile,
            LocalDateTime.now(clock),
            sorted.stream().map(ReportAggregator::summarize).toList(),
            coverage,
            findings.stream().filter(finding -> !finding.isComplete()).toList(),
            categoryDistribution(sorted),
            tagUsage(sorted),
            graph,
            quality,
            readability,
            lintingIssues,
            healthScore,
            HealthRating.fromScore(healthScore),
            recommendationGenerator.corpusRecommendations(graph, coverage, quality, readability, lintingIssues),
            recommendationGenerator.documentRecommendations(sorted, graph)
        );
        log.info("Health score {} ({}) over {} documents", healthScore, report.healthRating().displayName(), sorted.size());
        return report;
    }

    private static int count(List<FrontmatterFinding> findings, FrontmatterStatus status) {
        return (int) findings.stream().filter(finding -> finding.status() == status).count();
    }

    private static DocumentSummary summarize(DocumentAnalysis analysis) {
        FrontmatterRecord frontmatter = analysis.document().frontmatter();
        return new DocumentSummary(
            analysis.path(),
            frontmatter == null ? "" : frontmatter.title(),
            categoryOf(frontmatter),
            frontmatter == null ? List.of() : new ArrayList<>(frontmatter.tags()),
            frontmatter == null ? 0 : frontmatter.related().size(),
            analysis.frontmatter().status(),
            analysis.quality().label(),
            analysis.readability().label(),
            analysis.readability().wordCount()
        );
    }

    private static String categoryOf(FrontmatterRecord frontmatter) {
        if (frontmatter == null || frontmatter.category() == null) {
            return DocumentCategory.UNCATEGORIZED;
        }
        return frontmatter.category().id();
    }

    private static Map<String, Integer> categoryDistribution(List<DocumentAnalysis> analyses) {
        Map<String, Integer> distribution = new TreeMap<>();
        analyses.forEach(analysis -> distribution.merge(categoryOf(analysis.document().frontmatter()), 1, Integer::sum));
        return distribution;
    }

    private static Map<String, Integer> tagUsage(List<DocumentAnalysis> analyses) {
        Map<String, Integer> counts = new HashMap<>();
        for (DocumentAnalysis analysis : analyses) {
            FrontmatterRecord frontmatter = analysis.document().frontmatter();
            if (frontmatter != null) {
                frontmatter.tags().forEach(tag -> counts.merge(tag, 1, Integer::sum));
            }
        }
        Map<String, Integer> top = new LinkedHashMap<>();
        counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .limit(TOP_TAGS)
            .forEach(entry -> top.put(entry.getKey(), entry.getValue()));
        return top;
    }
}
