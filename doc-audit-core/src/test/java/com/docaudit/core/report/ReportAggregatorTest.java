package com.docaudit.core.report;

import com.docaudit.core.analysis.DocumentAnalyzer;
import com.docaudit.core.analysis.FrontmatterValidator;
import com.docaudit.core.analysis.LinkResolver;
import com.docaudit.core.graph.DocumentGraphBuilder;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentCategory;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.DocumentSummary;
import com.docaudit.core.model.FrontmatterStatus;
import com.docaudit.core.model.Report;
import com.docaudit.core.model.SourceDocument;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

/**
 * Tests for {@link ReportAggregator}.
 */
class ReportAggregatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:15:30Z"), ZoneOffset.UTC);

    private final DocumentAnalyzer analyzer = new DocumentAnalyzer(new FrontmatterValidator(), 1);
    private final ReportAggregator aggregator = new ReportAggregator(new RecommendationGenerator(), CLOCK, true);

    private DocumentAnalysis analyze(String path, String content) {
        return analyzer.analyze(new SourceDocument(path, content.getBytes(StandardCharsets.UTF_8)));
    }

    private Report aggregate(List<DocumentAnalysis> analyses) {
        Set<String> paths = analyses.stream().map(DocumentAnalysis::path).collect(Collectors.toSet());
        DocumentGraph graph = new DocumentGraphBuilder(new LinkResolver("docs", paths::contains)).build(analyses);
        return aggregator.aggregate("docs", false, analyses, graph, 0);
    }

    private static String frontmatter(String title, String category, String tags) {
        return "---\ntitle: " + title + "\ndescription: d\ncategory: " + category + "\ntags: [" + tags
            + "]\nrelated: []\nlast_updated: 2024-01-01\n---\n# " + title + "\n";
    }

    @Test
    void aggregate_emptyCorpus_isPerfectWithNoSections() {
        Report report = aggregator.aggregate("docs", false, List.of(), DocumentGraph.empty(), 0);

        assertThat(report.totalDocuments()).isZero();
        assertThat(report.healthScore()).isEqualTo(100);
        assertThat(report.recommendations()).isEmpty();
        assertThat(report.generatedAt()).isEqualTo(LocalDateTime.of(2024, 3, 1, 10, 15, 30));
    }

    @Test
    void aggregate_sortsDocumentsAndCountsCoverage() {
        Report report = aggregate(List.of(
            analyze("docs/z.md", frontmatter("Z", "guide", "java")),
            analyze("docs/a.md", "# No front-matter\n"),
            analyze("docs/m.md", "---\ntitle: M\n---\n")));

        assertThat(report.documents()).extracting(DocumentSummary::path)
            .containsExactly("docs/a.md", "docs/m.md", "docs/z.md");
        assertThat(report.frontmatterCoverage().complete()).isEqualTo(1);
        assertThat(report.frontmatterCoverage().incomplete()).isEqualTo(1);
        assertThat(report.frontmatterCoverage().absent()).isEqualTo(1);
        assertThat(report.frontmatterFindings()).extracting(finding -> finding.status())
            .containsExactly(FrontmatterStatus.ABSENT, FrontmatterStatus.INCOMPLETE);
        assertThat(report.documents().get(0).category()).isEqualTo(DocumentCategory.UNCATEGORIZED);
    }

    @Test
    void aggregate_categoryDistributionIsSortedById() {
        Report report = aggregate(List.of(
            analyze("docs/a.md", frontmatter("A", "reference", "x")),
            analyze("docs/b.md", frontmatter("B", "guide", "x")),
            analyze("docs/c.md", frontmatter("C", "guide", "x"))));

        assertThat(report.categoryDistribution()).containsExactly(
            entry("guide", 2),
            entry("reference", 1));
    }

    @Test
    void aggregate_tagUsage_keepsTopTenByCountThenName() {
        List<DocumentAnalysis> analyses = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            String tags = "common, tag" + (char) ('a' + i) + (i < 2 ? ", pair" : "");
            analyses.add(analyze("docs/d" + i + ".md", frontmatter("D" + i, "guide", tags)));
        }

        Report report = aggregate(analyses);

        assertThat(report.tagUsage()).hasSize(ReportAggregator.TOP_TAGS);
        assertThat(new ArrayList<>(report.tagUsage().keySet()).subList(0, 4))
            .containsExactly("common", "pair", "taga", "tagb");
        assertThat(report.tagUsage().get("common")).isEqualTo(12);
    }

    @Test
    void aggregate_brokenLinksLowerHealthScore() {
        Report clean = aggregate(List.of(analyze("docs/a.md", frontmatter("A", "guide", "x"))));
        Report broken = aggregate(List.of(analyze("docs/a.md", frontmatter("A", "guide", "x") + "[x](missing.md)\n")));

        assertThat(broken.brokenReferenceCount()).isEqualTo(1);
        assertThat(broken.healthScore()).isLessThan(clean.healthScore());
        assertThat(broken.healthScore()).isBetween(0, 100);
    }
}
