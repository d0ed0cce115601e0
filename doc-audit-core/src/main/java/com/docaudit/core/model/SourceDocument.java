package com.docaudit.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw file handed over by a document source before any analysis.
 *
 * @param path path relative to the base directory, always with {@code /} separators
 * @param content raw bytes as read from disk
 */
public record SourceDocument(String path, byte[] content) {
    public SourceDocument {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public String text() {
        return new String(content, StandardCharsets.UTF_8);
    }
}
