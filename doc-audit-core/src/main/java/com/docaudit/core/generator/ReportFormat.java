package com.docaudit.core.generator;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats a report can be generated in.
 */
public enum ReportFormat {
    /** Full Markdown quality report */
    MARKDOWN("markdown", "documentation_quality_report", "md", "text/markdown"),

    /** One CSV row per document */
    CSV("csv", "documentation_inventory", "csv", "text/csv"),

    /** Graphviz digraph of the reference graph */
    DOT("dot", "document_graph", "dot", "text/vnd.graphviz");

    private final String id;
    private final String filePrefix;
    private final String fileExtension;
    private final String contentType;

    ReportFormat(String id, String filePrefix, String fileExtension, String contentType) {
        this.id = id;
        this.filePrefix = filePrefix;
        this.fileExtension = fileExtension;
        this.contentType = contentType;
    }

    public String id() {
        return id;
    }

    public String filePrefix() {
        return filePrefix;
    }

    public String fileExtension() {
        return fileExtension;
    }

    public String contentType() {
        return contentType;
    }

    public static Optional<ReportFormat> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
