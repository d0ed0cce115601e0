package com.docaudit.core.graph;

import com.docaudit.core.analysis.LinkResolver;
import com.docaudit.core.model.BrokenReason;
import com.docaudit.core.model.BrokenReference;
import com.docaudit.core.model.Document;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.ExtractedReference;
import com.docaudit.core.model.ReferenceEdge;
import com.docaudit.core.model.ResolvedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Builds the reference graph from analyzed documents in a single pass.
 *
 * <p>Only internal references become edges. A target exists when it is one of the scanned
 * documents or an existing file under the base directory. Self-references are kept as edges but
 * never count as incoming references.</p>
 */
public class DocumentGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DocumentGraphBuilder.class);

    private final LinkResolver linkResolver;

    public DocumentGraphBuilder(LinkResolver linkResolver) {
        this.linkResolver = Objects.requireNonNull(linkResolver, "linkResolver must not be null");
    }

    public DocumentGraph build(List<DocumentAnalysis> analyses) {
        Map<String, List<ExtractedReference>> references = new TreeMap<>();
        List<Document> documents = new ArrayList<>(analyses.size());
        for (DocumentAnalysis analysis : analyses) {
            documents.add(analysis.document());
            references.put(analysis.path(), analysis.references());
        }
        return build(documents, references);
    }

    /**
     * Builds the graph.
     *
     * @param documents every scanned document
     * @param referencesByPath extracted references per document path
     * @return graph with adjacency, reverse index, orphans and broken references
     */
    public DocumentGraph build(List<Document> documents, Map<String, List<ExtractedReference>> referencesByPath) {
        Map<String, Document> byPath = new TreeMap<>();
        documents.forEach(document -> byPath.put(document.path(), document));

        Map<String, Set<String>> outgoing = new TreeMap<>();
        Map<String, Set<String>> incoming = new TreeMap<>();
        byPath.keySet().forEach(path -> {
            outgoing.put(path, new LinkedHashSet<>());
            incoming.put(path, new LinkedHashSet<>());
        });

        List<ReferenceEdge> edges = new ArrayList<>();
        List<BrokenReference> broken = new ArrayList<>();

        for (String source : byPath.keySet()) {
            for (ExtractedReference reference : referencesByPath.getOrDefault(source, List.of())) {
                ResolvedReference resolved = linkResolver.resolve(reference.target(), source);
                if (!resolved.isInternal()) {
                    continue;
                }
                String target = resolved.canonicalPath();
                boolean exists = target != null && (byPath.containsKey(target) || resolved.exists());
                ReferenceEdge edge = new ReferenceEdge(source, reference.target(), target,
                    resolved.classification(), reference.origin(), exists);
                edges.add(edge);

                if (resolved.unresolvable()) {
                    log.debug("Unresolvable reference '{}' in {}", reference.target(), source);
                    broken.add(new BrokenReference(edge, BrokenReason.UNRESOLVABLE));
                } else if (!exists) {
                    broken.add(new BrokenReference(edge, BrokenReason.MISSING_TARGET));
                } else {
                    outgoing.get(source).add(target);
                    if (!edge.isSelfReference()) {
                        incoming.computeIfAbsent(target, key -> new LinkedHashSet<>()).add(source);
                    }
                }
            }
        }

        List<String> orphans = byPath.values().stream()
            .filter(document -> !document.isReadme())
            .map(Document::path)
            .filter(path -> incoming.get(path).isEmpty())
            .toList();

        log.debug("Graph: {} nodes, {} edges, {} orphans, {} broken", byPath.size(), edges.size(),
            orphans.size(), broken.size());
        return new DocumentGraph(List.copyOf(byPath.keySet()), edges, outgoing, incoming, orphans, broken);
    }
}
