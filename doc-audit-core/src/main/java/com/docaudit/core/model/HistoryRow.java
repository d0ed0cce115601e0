package com.docaudit.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One line of the metrics history file.
 *
 * @param date audit date
 * @param totalDocuments documents audited
 * @param healthScore overall score
 * @param brokenLinks broken internal references
 * @param frontmatterIssues documents with absent or incomplete front-matter
 * @param excellent documents rated excellent
 * @param good documents rated good
 * @param adequate documents rated adequate
 * @param poor documents rated poor
 * @param veryPoor documents rated very poor
 */
public record HistoryRow(
    LocalDate date,
    int totalDocuments,
    int healthScore,
    int brokenLinks,
    int frontmatterIssues,
    int excellent,
    int good,
    int adequate,
    int poor,
    int veryPoor
) {
    public HistoryRow {
        Objects.requireNonNull(date, "date must not be null");
    }

    public static HistoryRow from(Report report) {
        return new HistoryRow(
            report.generatedAt().toLocalDate(),
            report.totalDocuments(),
            report.healthScore(),
            report.brokenReferenceCount(),
            report.frontmatterCoverage().issues(),
            (int) report.countQuality(QualityLabel.EXCELLENT),
            (int) report.countQuality(QualityLabel.GOOD),
            (int) report.countQuality(QualityLabel.ADEQUATE),
            (int) report.countQuality(QualityLabel.POOR),
            (int) report.countQuality(QualityLabel.VERY_POOR)
        );
    }
}
