package com.docaudit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Inventory row for one document.
 *
 * @param path document path
 * @param title front-matter title, empty when missing
 * @param category category identifier or {@code uncategorized}
 * @param tags declared tags
 * @param relatedCount number of related entries
 * @param frontmatterStatus front-matter completeness
 * @param quality quality label
 * @param readability readability label
 * @param wordCount prose word count
 */
public record DocumentSummary(
    String path,
    String title,
    String category,
    List<String> tags,
    int relatedCount,
    FrontmatterStatus frontmatterStatus,
    QualityLabel quality,
    ReadabilityLabel readability,
    int wordCount
) {
    public DocumentSummary {
        Objects.requireNonNull(path, "path must not be null");
        title = title == null ? "" : title;
        category = category == null ? DocumentCategory.UNCATEGORIZED : category;
        tags = tags == null ? List.of() : List.copyOf(tags);
        Objects.requireNonNull(frontmatterStatus, "frontmatterStatus must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        Objects.requireNonNull(readability, "readability must not be null");
    }
}
