package com.docaudit.core.model;

import java.util.Objects;

/**
 * Readability estimate of one document's prose.
 *
 * @param path document path
 * @param wordCount whitespace-separated tokens outside code blocks
 * @param sentenceCount sentence terminators found, never less than 1
 * @param wordsPerSentence average sentence length
 * @param label bucket for the average
 */
public record ReadabilityRecord(
    String path,
    int wordCount,
    int sentenceCount,
    double wordsPerSentence,
    ReadabilityLabel label
) {
    public ReadabilityRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (wordCount < 0) {
            throw new IllegalArgumentException("wordCount must be >= 0");
        }
        if (sentenceCount < 1) {
            throw new IllegalArgumentException("sentenceCount must be >= 1");
        }
    }
}
