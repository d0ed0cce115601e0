package com.docaudit.core.model;

import java.util.Objects;

/**
 * Outcome of resolving one reference string against the corpus.
 *
 * @param reference reference as written
 * @param classification how the reference was interpreted
 * @param canonicalPath normalized path relative to the base directory, {@code null} for
 *                      external and anchor-only references or when the path climbs above the base directory
 * @param exists whether a file exists at {@code canonicalPath}
 * @param unresolvable true when an internal reference could not be turned into a path at all
 */
public record ResolvedReference(
    String reference,
    LinkClassification classification,
    String canonicalPath,
    boolean exists,
    boolean unresolvable
) {
    public ResolvedReference {
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        if (exists && canonicalPath == null) {
            throw new IllegalArgumentException("an existing target needs a canonical path");
        }
    }

    public static ResolvedReference external(String reference, LinkClassification classification) {
        return new ResolvedReference(reference, classification, null, false, false);
    }

    public static ResolvedReference unresolvable(String reference, LinkClassification classification) {
        return new ResolvedReference(reference, classification, null, false, true);
    }

    public boolean isInternal() {
        return classification.isInternal();
    }
}
