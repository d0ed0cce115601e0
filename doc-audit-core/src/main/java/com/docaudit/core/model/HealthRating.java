package com.docaudit.core.model;

/**
 * Rating band for the overall health score.
 */
public enum HealthRating {
    EXCELLENT("Excellent", 90),
    GOOD("Good", 70),
    FAIR("Fair", 50),
    POOR("Poor", 0);

    private final String displayName;
    private final int minimumScore;

    HealthRating(String displayName, int minimumScore) {
        this.displayName = displayName;
        this.minimumScore = minimumScore;
    }

    public String displayName() {
        return displayName;
    }

    public static HealthRating fromScore(int score) {
        for (HealthRating rating : values()) {
            if (score >= rating.minimumScore) {
                return rating;
            }
        }
        return POOR;
    }
}
