package com.docaudit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating one document's front-matter against the required field list.
 *
 * @param path corpus-relative document path
 * @param status completeness status
 * @param missingFields required fields that are absent, blank or malformed
 * @param malformedFields fields whose value could not be interpreted
 */
public record FrontmatterFinding(
    String path,
    FrontmatterStatus status,
    List<String> missingFields,
    List<String> malformedFields
) {
    public FrontmatterFinding {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
        missingFields = missingFields == null ? List.of() : List.copyOf(missingFields);
        malformedFields = malformedFields == null ? List.of() : List.copyOf(malformedFields);
    }

    public boolean isComplete() {
        return status == FrontmatterStatus.COMPLETE;
    }
}
