package com.docaudit.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Reference graph over the scanned documents.
 *
 * @param nodes document paths, sorted
 * @param edges every internal edge in document order, including broken ones
 * @param outgoing adjacency: document path to the existing targets it references
 * @param incoming reverse index: target path to the documents referencing it, self-references excluded
 * @param orphans documents with no incoming edge, README files excepted, sorted
 * @param brokenReferences internal edges whose target is missing or unresolvable
 */
public record DocumentGraph(
    List<String> nodes,
    List<ReferenceEdge> edges,
    Map<String, Set<String>> outgoing,
    Map<String, Set<String>> incoming,
    List<String> orphans,
    List<BrokenReference> brokenReferences
) {
    public DocumentGraph {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes must not be null"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges must not be null"));
        outgoing = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(outgoing, "outgoing must not be null")));
        incoming = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(incoming, "incoming must not be null")));
        orphans = List.copyOf(Objects.requireNonNull(orphans, "orphans must not be null"));
        brokenReferences = List.copyOf(Objects.requireNonNull(brokenReferences, "brokenReferences must not be null"));
    }

    public static DocumentGraph empty() {
        return new DocumentGraph(List.of(), List.of(), Map.of(), Map.of(), List.of(), List.of());
    }

    public Set<String> outgoing(String path) {
        return outgoing.getOrDefault(path, Set.of());
    }

    public Set<String> incoming(String path) {
        return incoming.getOrDefault(path, Set.of());
    }

    public List<ReferenceEdge> edgesFrom(String path) {
        return edges.stream().filter(edge -> edge.sourcePath().equals(path)).toList();
    }
}
