package com.docaudit.core.generator.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.generator.GeneratorConfig;
import com.docaudit.core.generator.ReportFormat;
import com.docaudit.core.generator.ReportGenerator;
import com.docaudit.core.model.BrokenReference;
import com.docaudit.core.model.DocumentRecommendation;
import com.docaudit.core.model.FrontmatterCoverage;
import com.docaudit.core.model.FrontmatterFinding;
import com.docaudit.core.model.QualityLabel;
import com.docaudit.core.model.QualityRecord;
import com.docaudit.core.model.ReadabilityLabel;
import com.docaudit.core.model.ReadabilityRecord;
import com.docaudit.core.model.Recommendation;
import com.docaudit.core.model.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Generates the full Markdown quality report.
 *
 * <p>Sections always appear in this order, each rendered even when empty:</p>
 * <ol>
 *   <li>Inventory</li>
 *   <li>Category Distribution</li>
 *   <li>Tag Usage</li>
 *   <li>Relationships (Orphans, Broken References)</li>
 *   <li>Content Quality</li>
 *   <li>Readability</li>
 *   <li>Recommendations</li>
 *   <li>Summary</li>
 * </ol>
 */
public class MarkdownReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(MarkdownReportGenerator.class);

    private static final String H1 = "# ";
    private static final String H2 = "## ";
    private static final String H3 = "### ";
    private static final String PIPE = "|";
    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final String BULLET = "- ";

    static final String INVENTORY = "Inventory";
    static final String CATEGORY_DISTRIBUTION = "Category Distribution";
    static final String TAG_USAGE = "Tag Usage";
    static final String RELATIONSHIPS = "Relationships";
    static final String ORPHANS = "Orphans";
    static final String BROKEN_REFERENCES = "Broken References";
    static final String CONTENT_QUALITY = "Content Quality";
    static final String READABILITY = "Readability";
    static final String RECOMMENDATIONS = "Recommendations";
    static final String SUMMARY = "Summary";

    private static final String NONE_FOUND = "_None found._";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Override
    public String getId() {
        return ReportFormat.MARKDOWN.id();
    }

    @Override
    public String getDisplayName() {
        return "Markdown Quality Report";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.MARKDOWN;
    }

    @Override
    public GeneratedReport generate(Report report, GeneratorConfig config) {
        Objects.requireNonNull(report, "report must not be null");
        Objects.requireNonNull(config, "config must not be null");
        log.debug("Generating Markdown report for {} documents", report.totalDocuments());

        StringBuilder sb = new StringBuilder();
        sb.append(H1).append(config.title()).append(DOUBLE_NEWLINE);
        sb.append("**Generated:** ").append(report.generatedAt().format(TIMESTAMP)).append("  ").append(NEWLINE);
        sb.append("**Scope:** ").append(escape(report.scope())).append(DOUBLE_NEWLINE);

        appendInventory(sb, report);
        appendCategories(sb, report);
        appendTags(sb, report);
        appendRelationships(sb, report);
        appendQuality(sb, report);
        appendReadability(sb, report, config);
        appendRecommendations(sb, report);
        appendSummary(sb, report, config);

        return new GeneratedReport(fileNameFor(report), sb.toString(), ReportFormat.MARKDOWN);
    }

    private void appendInventory(StringBuilder sb, Report report) {
        FrontmatterCoverage coverage = report.frontmatterCoverage();
        sb.append(H2).append(INVENTORY).append(DOUBLE_NEWLINE);
        tableHeader(sb, "Metric", "Count");
        row(sb, "Total documents", String.valueOf(report.totalDocuments()));
        row(sb, "Complete frontmatter", String.valueOf(coverage.complete()));
        row(sb, "Incomplete frontmatter", String.valueOf(coverage.incomplete()));
        row(sb, "Missing frontmatter", String.valueOf(coverage.absent()));
        row(sb, "Frontmatter coverage", coverage.completePercentage() + "%");
        sb.append(NEWLINE);

        sb.append(H3).append("Frontmatter Issues").append(DOUBLE_NEWLINE);
        if (report.frontmatterFindings().isEmpty()) {
            sb.append(NONE_FOUND).append(DOUBLE_NEWLINE);
            return;
        }
        tableHeader(sb, "Document", "Status", "Missing Fields", "Malformed Fields");
        for (FrontmatterFinding finding : report.frontmatterFindings()) {
            row(sb, code(finding.path()), finding.status().name(),
                joinOrDash(String.join(", ", finding.missingFields())),
                joinOrDash(String.join(", ", finding.malformedFields())));
        }
        sb.append(NEWLINE);
    }

    private void appendCategories(StringBuilder sb, Report report) {
        sb.append(H2).append(CATEGORY_DISTRIBUTION).append(DOUBLE_NEWLINE);
        appendCountTable(sb, "Category", report.categoryDistribution());
    }

    private void appendTags(StringBuilder sb, Report report) {
        sb.append(H2).append(TAG_USAGE).append(DOUBLE_NEWLINE);
        appendCountTable(sb, "Tag", report.tagUsage());
    }

    private void appendCountTable(StringBuilder sb, String label, Map<String, Integer> counts) {
        if (counts.isEmpty()) {
            sb.append(NONE_FOUND).append(DOUBLE_NEWLINE);
            return;
        }
        tableHeader(sb, label, "Documents");
        counts.forEach((key, count) -> row(sb, escape(key), String.valueOf(count)));
        sb.append(NEWLINE);
    }

    private void appendRelationships(StringBuilder sb, Report report) {
        sb.append(H2).append(RELATIONSHIPS).append(DOUBLE_NEWLINE);
        sb.append("Internal references: ").append(report.graph().edges().size()).append(DOUBLE_NEWLINE);

        sb.append(H3).append(ORPHANS).append(DOUBLE_NEWLINE);
        if (report.graph().orphans().isEmpty()) {
            sb.append(NONE_FOUND).append(DOUBLE_NEWLINE);
        } else {
            report.graph().orphans().forEach(orphan -> sb.append(BULLET).append(code(orphan)).append(NEWLINE));
            sb.append(NEWLINE);
        }

        sb.append(H3).append(BROKEN_REFERENCES).append(DOUBLE_NEWLINE);
        if (report.graph().brokenReferences().isEmpty()) {
            sb.append(NONE_FOUND).append(DOUBLE_NEWLINE);
            return;
        }
        tableHeader(sb, "Document", "Reference", "Classification", "Reason");
        for (BrokenReference broken : report.graph().brokenReferences()) {
            row(sb, code(broken.sourcePath()), code(broken.reference()),
                broken.edge().classification().name(), broken.reason().name());
        }
        sb.append(NEWLINE);
    }

    private void appendQuality(StringBuilder sb, Report report) {
        sb.append(H2).append(CONTENT_QUALITY).append(DOUBLE_NEWLINE);
        tableHeader(sb, "Rating", "Documents");
        for (QualityLabel label : QualityLabel.values()) {
            row(sb, label.displayName(), String.valueOf(report.countQuality(label)));
        }
        sb.append(NEWLINE);

        if (report.quality().isEmpty()) {
            return;
        }
        tableHeader(sb, "Document", "Score", "Rating");
        for (QualityRecord record : report.quality()) {
            row(sb, code(record.path()), record.score() + "/" + QualityRecord.MAX_SCORE, record.label().displayName());
        }
        sb.append(NEWLINE);
    }

    private void appendReadability(StringBuilder sb, Report report, GeneratorConfig config) {
        sb.append(H2).append(READABILITY).append(DOUBLE_NEWLINE);
        if (!config.includeReadability()) {
            sb.append("_Readability analysis disabled._").append(DOUBLE_NEWLINE);
            return;
        }
        tableHeader(sb, "Rating", "Documents");
        for (ReadabilityLabel label : ReadabilityLabel.values()) {
            row(sb, label.displayName(), String.valueOf(report.countReadability(label)));
        }
        sb.append(NEWLINE);
        sb.append("Average words per sentence: ").append(format(report.averageWordsPerSentence())).append(DOUBLE_NEWLINE);

        if (report.readability().isEmpty()) {
            return;
        }
        tableHeader(sb, "Document", "Words", "Sentences", "Words/Sentence", "Rating");
        for (ReadabilityRecord record : report.readability()) {
            row(sb, code(record.path()), String.valueOf(record.wordCount()), String.valueOf(record.sentenceCount()),
                format(record.wordsPerSentence()), record.label().displayName());
        }
        sb.append(NEWLINE);
    }

    private void appendRecommendations(StringBuilder sb, Report report) {
        sb.append(H2).append(RECOMMENDATIONS).append(DOUBLE_NEWLINE);
        if (report.recommendations().isEmpty()) {
            sb.append("No issues found.").append(DOUBLE_NEWLINE);
        } else {
            for (Recommendation recommendation : report.recommendations()) {
                sb.append(BULLET).append("**").append(recommendation.priority().displayName()).append(" Priority:** ")
                    .append(recommendation.message()).append(NEWLINE);
            }
            sb.append(NEWLINE);
        }

        if (report.documentRecommendations().isEmpty()) {
            return;
        }
        sb.append(H3).append("Document Recommendations").append(DOUBLE_NEWLINE);
        for (DocumentRecommendation recommendation : report.documentRecommendations()) {
            sb.append("**").append(escape(recommendation.path())).append("**").append(DOUBLE_NEWLINE);
            recommendation.suggestions().forEach(suggestion -> sb.append(BULLET).append(suggestion).append(NEWLINE));
            sb.append(NEWLINE);
        }
    }

    private void appendSummary(StringBuilder sb, Report report, GeneratorConfig config) {
        sb.append(H2).append(SUMMARY).append(DOUBLE_NEWLINE);
        tableHeader(sb, "Metric", "Value");
        row(sb, "Health score", report.healthScore() + "/100");
        row(sb, "Rating", report.healthRating().displayName());
        row(sb, "Documents", String.valueOf(report.totalDocuments()));
        row(sb, "Broken references", String.valueOf(report.brokenReferenceCount()));
        row(sb, "Orphaned documents", String.valueOf(report.graph().orphans().size()));
        row(sb, "Frontmatter issues", String.valueOf(report.frontmatterCoverage().issues()));
        row(sb, "Linting issues", String.valueOf(report.lintingIssues()));
        row(sb, "CI threshold", config.ciThreshold() + (report.meetsThreshold(config.ciThreshold()) ? " (passed)" : " (failed)"));
        sb.append(NEWLINE);
    }

    private static void tableHeader(StringBuilder sb, String... columns) {
        row(sb, columns);
        String[] separators = new String[columns.length];
        Arrays.fill(separators, "---");
        row(sb, separators);
    }

    private static void row(StringBuilder sb, String... cells) {
        sb.append(PIPE);
        for (String cell : cells) {
            sb.append(' ').append(cell).append(' ').append(PIPE);
        }
        sb.append(NEWLINE);
    }

    private static String code(String value) {
        return "`" + escape(value) + "`";
    }

    private static String joinOrDash(String value) {
        return value.isEmpty() ? "-" : escape(value);
    }

    private static String escape(String value) {
        return value.replace("|", "\\|").replace("\n", " ");
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
