package com.docaudit.core.model;

import java.util.Objects;

/**
 * Reference string as written in a document, before resolution.
 *
 * @param target link target exactly as written
 * @param origin body link or front-matter related entry
 * @param line 1-based line in the file, 0 for front-matter entries
 */
public record ExtractedReference(String target, ReferenceOrigin origin, int line) {
    public ExtractedReference {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
        if (line < 0) {
            throw new IllegalArgumentException("line must be >= 0");
        }
    }

    public static ExtractedReference body(String target, int line) {
        return new ExtractedReference(target, ReferenceOrigin.BODY, line);
    }

    public static ExtractedReference related(String target) {
        return new ExtractedReference(target, ReferenceOrigin.RELATED, 0);
    }
}
