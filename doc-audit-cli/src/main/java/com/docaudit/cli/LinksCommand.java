package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.engine.AnalysisResult;
import com.docaudit.core.engine.AuditEngine;
import com.docaudit.core.model.BrokenReference;
import com.docaudit.core.model.DocumentGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Checks internal references and lists the broken ones.
 * Exits with code 1 when any reference is broken.
 */
@Command(
    name = "links",
    description = "Check internal references and report broken ones",
    mixinStandardHelpOptions = true
)
public class LinksCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(LinksCommand.class);

    @Mixin
    private ScopeOptions scopeOptions;

    @Override
    public Integer call() {
        try {
            AuditConfig config = scopeOptions.loadConfig();
            AuditEngine engine = new AuditEngine(scopeOptions.getBaseDirectory(), config);
            AnalysisResult result = engine.analyze(scopeOptions.toScope(config), engine.defaultTimeout());
            DocumentGraph graph = result.graph();

            System.out.println("Checked " + graph.edges().size() + " internal references in "
                + graph.nodes().size() + " documents");

            if (!graph.orphans().isEmpty()) {
                System.out.println();
                System.out.println("Orphaned documents (" + graph.orphans().size() + "):");
                graph.orphans().forEach(orphan -> System.out.println("  " + orphan));
            }

            if (graph.brokenReferences().isEmpty()) {
                System.out.println("✓ No broken references found");
                return ExitCodes.OK;
            }

            System.out.println();
            System.out.println("Broken references (" + graph.brokenReferences().size() + "):");
            for (BrokenReference broken : graph.brokenReferences()) {
                System.out.println("  " + broken.sourcePath() + ": " + broken.reference()
                    + " [" + broken.edge().classification().name().toLowerCase(Locale.ROOT).replace('_', '-') + ", "
                    + broken.reason().name() + "]");
            }
            System.err.println("✗ Found " + graph.brokenReferences().size() + " broken references");
            return ExitCodes.GATE_FAILED;

        } catch (Exception e) {
            return ExitCodes.fail(log, "Link check", e);
        }
    }
}
