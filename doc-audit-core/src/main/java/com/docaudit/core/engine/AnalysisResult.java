package com.docaudit.core.engine;

import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentGraph;

import java.util.List;
import java.util.Objects;

/**
 * Per-document analyses and the graph built from them, before aggregation.
 *
 * @param analyses analyses sorted by path
 * @param graph reference graph
 */
public record AnalysisResult(List<DocumentAnalysis> analyses, DocumentGraph graph) {
    public AnalysisResult {
        analyses = List.copyOf(Objects.requireNonNull(analyses, "analyses must not be null"));
        Objects.requireNonNull(graph, "graph must not be null");
    }
}
