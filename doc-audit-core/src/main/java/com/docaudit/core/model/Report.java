package com.docaudit.core.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated outcome of one audit run. Immutable once built.
 *
 * @param scope human-readable description of what was audited
 * @param singleFile whether the run covered exactly one file
 * @param generatedAt when the report was produced
 * @param documents inventory rows, sorted by path
 * @param frontmatterCoverage complete/incomplete/absent counts
 * @param frontmatterFindings documents whose front-matter is not complete
 * @param categoryDistribution documents per category, sorted by name
 * @param tagUsage most used tags, most frequent first
 * @param graph reference graph
 * @param quality per-document quality records
 * @param readability per-document readability records
 * @param lintingIssues lint issue count supplied by the caller
 * @param healthScore overall score, 0..100
 * @param healthRating band of the score
 * @param recommendations corpus-level recommendations
 * @param documentRecommendations per-document suggestions
 */
public record Report(
    String scope,
    boolean singleFile,
    LocalDateTime generatedAt,
    List<DocumentSummary> documents,
    FrontmatterCoverage frontmatterCoverage,
    List<FrontmatterFinding> frontmatterFindings,
    Map<String, Integer> categoryDistribution,
    Map<String, Integer> tagUsage,
    DocumentGraph graph,
    List<QualityRecord> quality,
    List<ReadabilityRecord> readability,
    int lintingIssues,
    int healthScore,
    HealthRating healthRating,
    List<Recommendation> recommendations,
    List<DocumentRecommendation> documentRecommendations
) {
    public Report {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        Objects.requireNonNull(frontmatterCoverage, "frontmatterCoverage must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(healthRating, "healthRating must not be null");
        documents = List.copyOf(documents);
        frontmatterFindings = List.copyOf(frontmatterFindings);
        categoryDistribution = Collections.unmodifiableMap(new LinkedHashMap<>(categoryDistribution));
        tagUsage = Collections.unmodifiableMap(new LinkedHashMap<>(tagUsage));
        quality = List.copyOf(quality);
        readability = List.copyOf(readability);
        recommendations = List.copyOf(recommendations);
        documentRecommendations = List.copyOf(documentRecommendations);
        if (healthScore < 0 || healthScore > 100) {
            throw new IllegalArgumentException("healthScore must be between 0 and 100: " + healthScore);
        }
        if (lintingIssues < 0) {
            throw new IllegalArgumentException("lintingIssues must be >= 0");
        }
    }

    public int totalDocuments() {
        return documents.size();
    }

    public int brokenReferenceCount() {
        return graph.brokenReferences().size();
    }

    public long countQuality(QualityLabel label) {
        return quality.stream().filter(record -> record.label() == label).count();
    }

    public long countReadability(ReadabilityLabel label) {
        return readability.stream().filter(record -> record.label() == label).count();
    }

    public double averageWordsPerSentence() {
        return readability.stream().mapToDouble(ReadabilityRecord::wordsPerSentence).average().orElse(0.0);
    }

    public boolean meetsThreshold(int threshold) {
        return healthScore >= threshold;
    }
}
