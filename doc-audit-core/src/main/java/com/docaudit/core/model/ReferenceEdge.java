package com.docaudit.core.model;

import java.util.Objects;

/**
 * Directed reference from one document to a target path.
 *
 * @param sourcePath path of the referring document
 * @param reference reference string as written
 * @param resolvedPath canonical target path, {@code null} when unresolved
 * @param classification how the reference was interpreted
 * @param origin body link or related entry
 * @param targetExists whether the target is a scanned document or an existing file
 */
public record ReferenceEdge(
    String sourcePath,
    String reference,
    String resolvedPath,
    LinkClassification classification,
    ReferenceOrigin origin,
    boolean targetExists
) {
    public ReferenceEdge {
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
        Objects.requireNonNull(origin, "origin must not be null");
    }

    public boolean isResolved() {
        return resolvedPath != null;
    }

    public boolean isSelfReference() {
        return sourcePath.equals(resolvedPath);
    }
}
