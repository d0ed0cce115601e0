package com.docaudit.core.generator.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.generator.GeneratorConfig;
import com.docaudit.core.generator.ReportFormat;
import com.docaudit.core.generator.ReportGenerator;
import com.docaudit.core.model.DocumentSummary;
import com.docaudit.core.model.Report;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.util.List;

/**
 * Generates the document inventory as CSV, one row per document.
 * Tags are joined with {@code ;} inside their cell.
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(InventoryRow.class).withHeader();

    @JsonPropertyOrder({"path", "title", "category", "tags", "quality", "readability", "word_count", "related_count"})
    record InventoryRow(
        @JsonProperty("path") String path,
        @JsonProperty("title") String title,
        @JsonProperty("category") String category,
        @JsonProperty("tags") String tags,
        @JsonProperty("quality") String quality,
        @JsonProperty("readability") String readability,
        @JsonProperty("word_count") int wordCount,
        @JsonProperty("related_count") int relatedCount
    ) {
        static InventoryRow of(DocumentSummary summary) {
            return new InventoryRow(summary.path(), summary.title(), summary.category(),
                String.join(";", summary.tags()), summary.quality().displayName(),
                summary.readability().displayName(), summary.wordCount(), summary.relatedCount());
        }
    }

    @Override
    public String getId() {
        return ReportFormat.CSV.id();
    }

    @Override
    public String getDisplayName() {
        return "CSV Document Inventory";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.CSV;
    }

    @Override
    public GeneratedReport generate(Report report, GeneratorConfig config) {
        List<InventoryRow> rows = report.documents().stream().map(InventoryRow::of).toList();
        try {
            String content = CSV_MAPPER.writer(SCHEMA).writeValueAsString(rows);
            if (rows.isEmpty()) {
                content = String.join(",", SCHEMA.getColumnNames()) + "\n";
            }
            return new GeneratedReport(fileNameFor(report), content, ReportFormat.CSV);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write CSV inventory: " + e.getOriginalMessage(), e);
        }
    }
}
