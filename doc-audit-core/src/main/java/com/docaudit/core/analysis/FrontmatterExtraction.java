package com.docaudit.core.analysis;

import com.docaudit.core.model.FrontmatterRecord;

import java.util.Objects;

/**
 * Front-matter and body of a document.
 *
 * @param frontmatter parsed block, {@code null} when the document has none
 * @param body content after the closing delimiter, or the whole content without a block
 * @param bodyStartLine 1-based file line at which the body starts
 */
public record FrontmatterExtraction(FrontmatterRecord frontmatter, String body, int bodyStartLine) {
    public FrontmatterExtraction {
        Objects.requireNonNull(body, "body must not be null");
    }

    public boolean isAbsent() {
        return frontmatter == null;
    }
}
