package com.docaudit.core.generator.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.generator.GeneratorConfig;
import com.docaudit.core.generator.ReportFormat;
import com.docaudit.core.generator.ReportGenerator;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.Report;
import com.docaudit.core.util.FileUtils;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Generates a Graphviz digraph of the document reference graph.
 *
 * <p>One node per document, labelled with its file name; one edge per internal reference to an
 * existing document. Broken references and links to non-document files are left out.</p>
 */
public class DotGraphGenerator implements ReportGenerator {

    static final String GRAPH_NAME = "DocumentRelationships";

    @Override
    public String getId() {
        return ReportFormat.DOT.id();
    }

    @Override
    public String getDisplayName() {
        return "Graphviz Reference Graph";
    }

    @Override
    public ReportFormat getFormat() {
        return ReportFormat.DOT;
    }

    @Override
    public GeneratedReport generate(Report report, GeneratorConfig config) {
        DocumentGraph graph = report.graph();
        Set<String> nodes = new LinkedHashSet<>(graph.nodes());

        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(GRAPH_NAME).append(" {\n");
        sb.append("  node [shape=box, style=filled, fillcolor=lightblue];\n");
        sb.append("  graph [rankdir=LR];\n\n");

        for (String node : nodes) {
            sb.append("  ").append(nodeId(node))
                .append(" [label=\"").append(escape(FileUtils.fileNameOf(node))).append("\"];\n");
        }
        if (!nodes.isEmpty()) {
            sb.append('\n');
        }

        for (String source : nodes) {
            for (String target : graph.outgoing(source)) {
                if (nodes.contains(target)) {
                    sb.append("  ").append(nodeId(source)).append(" -> ").append(nodeId(target)).append(";\n");
                }
            }
        }
        sb.append("}\n");
        return new GeneratedReport(fileNameFor(report), sb.toString(), ReportFormat.DOT);
    }

    /**
     * Quoted node id derived from the document path.
     *
     * @param path document path
     * @return DOT identifier
     */
    static String nodeId(String path) {
        return "\"" + escape(path) + "\"";
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
