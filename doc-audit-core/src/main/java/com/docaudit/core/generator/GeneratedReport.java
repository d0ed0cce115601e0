package com.docaudit.core.generator;

import java.util.Objects;

/**
 * A rendered report file.
 *
 * @param fileName date-stamped file name, e.g. {@code documentation_quality_report_2024-05-01.md}
 * @param content file content
 * @param format format the content is in
 */
public record GeneratedReport(
    String fileName,
    String content,
    ReportFormat format
) {
    public GeneratedReport {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
        if (fileName.isBlank()) {
            throw new IllegalArgumentException("fileName must not be blank");
        }
    }
}
