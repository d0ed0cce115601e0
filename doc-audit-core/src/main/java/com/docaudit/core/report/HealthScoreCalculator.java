package com.docaudit.core.report;

import com.docaudit.core.model.QualityLabel;

import java.util.Map;

/**
 * Computes the 0..100 corpus health score with integer arithmetic.
 *
 * <p>Starting at 100 it subtracts half the lint issue count, 5 per broken reference, 3 per
 * front-matter issue, a fifth of the gap between the weighted quality percentage and 100, and a
 * tenth of the gap between the share of well-readable documents and 100. The result is clamped
 * to [0, 100]. With no documents the quality and readability terms are skipped.</p>
 */
public final class HealthScoreCalculator {

    public static final int MAX_SCORE = 100;

    private HealthScoreCalculator() {
        // Utility class
    }

    /**
     * @param totalDocuments number of documents audited
     * @param lintingIssues externally supplied lint issue count
     * @param brokenReferences broken internal references
     * @param frontmatterIssues documents with absent or incomplete front-matter
     * @param qualityCounts documents per quality label
     * @param goodReadability documents labelled Good for readability
     * @param includeReadability whether the readability term applies
     * @return clamped health score
     */
    public static int calculate(int totalDocuments,
                                int lintingIssues,
                                int brokenReferences,
                                int frontmatterIssues,
                                Map<QualityLabel, Integer> qualityCounts,
                                int goodReadability,
                                boolean includeReadability) {
        long score = MAX_SCORE;
        score -= lintingIssues / 2;
        score -= (long) brokenReferences * 5;
        score -= (long) frontmatterIssues * 3;

        if (totalDocuments > 0) {
            score -= (MAX_SCORE - weightedQualityPercent(totalDocuments, qualityCounts)) / 5;
            if (includeReadability) {
                score -= (MAX_SCORE - goodReadability * 100L / totalDocuments) / 10;
            }
        }
        return (int) Math.max(0, Math.min(MAX_SCORE, score));
    }

    /**
     * Weighted quality: Excellent counts 5, Good 3, Adequate 1, as a percentage of 5 per document.
     *
     * @param totalDocuments number of documents, positive
     * @param qualityCounts documents per label
     * @return percentage, 0..100
     */
    public static long weightedQualityPercent(int totalDocuments, Map<QualityLabel, Integer> qualityCounts) {
        long weighted = 0;
        for (QualityLabel label : QualityLabel.values()) {
            weighted += (long) label.healthWeight() * qualityCounts.getOrDefault(label, 0);
        }
        return weighted * 100 / (totalDocuments * 5L);
    }
}
