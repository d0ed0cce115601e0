package com.docaudit.core.model;

import java.util.Objects;

/**
 * Structural quality assessment of one document.
 *
 * @param path document path
 * @param hasTitle front-matter title present
 * @param hasDescription front-matter description present
 * @param hasTopLevelHeading body contains a {@code # } heading
 * @param subsectionCount number of {@code ## } headings
 * @param hasCodeBlock body contains a fenced code block
 * @param hasCodeLanguage a fenced code block declares its language
 * @param hasInternalLink body links to another Markdown document
 * @param hasRelatedSection body has a {@code ## Related Documents} heading
 * @param hasRelatedLinks that section contains a Markdown link
 * @param score rubric score, 0..10
 * @param label bucket for the score
 */
public record QualityRecord(
    String path,
    boolean hasTitle,
    boolean hasDescription,
    boolean hasTopLevelHeading,
    int subsectionCount,
    boolean hasCodeBlock,
    boolean hasCodeLanguage,
    boolean hasInternalLink,
    boolean hasRelatedSection,
    boolean hasRelatedLinks,
    int score,
    QualityLabel label
) {
    public static final int MAX_SCORE = 10;

    public QualityRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (score < 0 || score > MAX_SCORE) {
            throw new IllegalArgumentException("score must be between 0 and " + MAX_SCORE + ": " + score);
        }
        if (subsectionCount < 0) {
            throw new IllegalArgumentException("subsectionCount must be >= 0");
        }
    }
}
