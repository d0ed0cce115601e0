package com.docaudit.core.model;

/**
 * Readability buckets based on average words per sentence.
 */
public enum ReadabilityLabel {
    SIMPLE("Simple"),
    GOOD("Good"),
    COMPLEX("Complex");

    public static final double SIMPLE_BELOW = 10.0;
    public static final double COMPLEX_ABOVE = 20.0;

    private final String displayName;

    ReadabilityLabel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static ReadabilityLabel fromRatio(double wordsPerSentence) {
        if (wordsPerSentence > COMPLEX_ABOVE) {
            return COMPLEX;
        }
        if (wordsPerSentence < SIMPLE_BELOW) {
            return SIMPLE;
        }
        return GOOD;
    }
}
