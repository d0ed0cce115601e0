package com.docaudit.core.model;

/**
 * Structural quality buckets derived from the 0..10 rubric score.
 */
public enum QualityLabel {
    EXCELLENT("Excellent", 9, 5),
    GOOD("Good", 7, 3),
    ADEQUATE("Adequate", 5, 1),
    POOR("Poor", 3, 0),
    VERY_POOR("Very Poor", 0, 0);

    private final String displayName;
    private final int minimumScore;
    private final int healthWeight;

    QualityLabel(String displayName, int minimumScore, int healthWeight) {
        this.displayName = displayName;
        this.minimumScore = minimumScore;
        this.healthWeight = healthWeight;
    }

    public String displayName() {
        return displayName;
    }

    public int minimumScore() {
        return minimumScore;
    }

    /**
     * Weight of this label in the health score quality term.
     *
     * @return 5, 3, 1 for excellent, good, adequate and 0 otherwise
     */
    public int healthWeight() {
        return healthWeight;
    }

    public boolean isLowQuality() {
        return this == POOR || this == VERY_POOR;
    }

    /**
     * Maps a rubric score to its label.
     *
     * @param score rubric score, 0..10
     * @return label for the score
     */
    public static QualityLabel fromScore(int score) {
        for (QualityLabel label : values()) {
            if (score >= label.minimumScore) {
                return label;
            }
        }
        return VERY_POOR;
    }
}
