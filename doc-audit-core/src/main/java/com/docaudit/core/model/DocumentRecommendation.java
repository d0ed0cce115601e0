package com.docaudit.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Suggestions targeted at one document.
 *
 * @param path document path
 * @param suggestions advice lines, never empty
 */
public record DocumentRecommendation(String path, List<String> suggestions) {
    public DocumentRecommendation {
        Objects.requireNonNull(path, "path must not be null");
        suggestions = List.copyOf(Objects.requireNonNull(suggestions, "suggestions must not be null"));
        if (suggestions.isEmpty()) {
            throw new IllegalArgumentException("suggestions must not be empty");
        }
    }
}
