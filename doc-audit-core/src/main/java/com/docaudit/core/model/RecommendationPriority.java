package com.docaudit.core.model;

/**
 * Priority of a corpus-level recommendation.
 */
public enum RecommendationPriority {
    HIGH("High"),
    MEDIUM("Medium"),
    LOW("Low");

    private final String displayName;

    RecommendationPriority(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
