package com.docaudit.core.history;

import com.docaudit.core.model.HistoryRow;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDate;

/**
 * Column layout of the history file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"date", "total_docs", "health_score", "broken_links", "frontmatter_issues",
    "excellent", "good", "adequate", "poor", "very_poor"})
record HistoryCsvRow(
    @JsonProperty("date") String date,
    @JsonProperty("total_docs") int totalDocs,
    @JsonProperty("health_score") int healthScore,
    @JsonProperty("broken_links") int brokenLinks,
    @JsonProperty("frontmatter_issues") int frontmatterIssues,
    @JsonProperty("excellent") int excellent,
    @JsonProperty("good") int good,
    @JsonProperty("adequate") int adequate,
    @JsonProperty("poor") int poor,
    @JsonProperty("very_poor") int veryPoor
) {
    static HistoryCsvRow of(HistoryRow row) {
        return new HistoryCsvRow(row.date().toString(), row.totalDocuments(), row.healthScore(), row.brokenLinks(),
            row.frontmatterIssues(), row.excellent(), row.good(), row.adequate(), row.poor(), row.veryPoor());
    }

    HistoryRow toHistoryRow() {
        return new HistoryRow(LocalDate.parse(date), totalDocs, healthScore, brokenLinks, frontmatterIssues,
            excellent, good, adequate, poor, veryPoor);
    }
}
