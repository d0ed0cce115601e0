package com.docaudit.core.analysis;

import com.docaudit.core.model.Document;
import com.docaudit.core.model.ReadabilityLabel;
import com.docaudit.core.model.ReadabilityRecord;
import com.docaudit.core.util.MarkdownPatterns;
import com.docaudit.core.util.MarkdownPatterns.BodyLine;

/**
 * Words-per-sentence estimate over the prose of a document.
 *
 * <p>Front-matter and fenced code are excluded. Words are whitespace-separated tokens and every
 * {@code .}, {@code !} or {@code ?} ends a sentence. A text without terminators counts as one
 * sentence.</p>
 */
public class ReadabilityAnalyzer {

    public ReadabilityRecord analyze(Document document) {
        return analyze(document.path(), document.body());
    }

    public ReadabilityRecord analyze(String path, String body) {
        int words = 0;
        int sentences = 0;
        for (BodyLine line : MarkdownPatterns.lines(body)) {
            if (line.code()) {
                continue;
            }
            words += countWords(line.text());
            sentences += countTerminators(line.text());
        }
        sentences = Math.max(1, sentences);
        double ratio = (double) words / sentences;
        return new ReadabilityRecord(path, words, sentences, ratio, ReadabilityLabel.fromRatio(ratio));
    }

    private static int countWords(String text) {
        String trimmed = text.strip();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static int countTerminators(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.' || c == '!' || c == '?') {
                count++;
            }
        }
        return count;
    }
}
