package com.docaudit.core.model;

import java.util.Objects;

/**
 * Actionable corpus-level recommendation.
 *
 * @param priority how urgent the issue is
 * @param category issue kind
 * @param count number of occurrences that triggered it
 * @param message human-readable advice
 */
public record Recommendation(
    RecommendationPriority priority,
    IssueCategory category,
    int count,
    String message
) {
    public Recommendation {
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(message, "message must not be null");
        if (count <= 0) {
            throw new IllegalArgumentException("a recommendation needs at least one occurrence");
        }
    }
}
