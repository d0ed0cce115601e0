package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.engine.AnalysisResult;
import com.docaudit.core.engine.AuditEngine;
import com.docaudit.core.fix.FrontmatterFixResult;
import com.docaudit.core.fix.FrontmatterFixSuggestion;
import com.docaudit.core.fix.FrontmatterFixer;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.FrontmatterFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Validates front-matter. Exits with code 1 when any document is not complete.
 *
 * <p>With {@code --fix} it instead lists the fields that can be filled in from the documents
 * themselves, and writes them with {@code --apply}.</p>
 */
@Command(
    name = "frontmatter",
    description = "Validate document front-matter against the required fields (--fix to fill in derivable fields)",
    mixinStandardHelpOptions = true
)
public class FrontmatterCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FrontmatterCommand.class);

    @Mixin
    private ScopeOptions scopeOptions;

    @Option(
        names = {"--fix"},
        description = "List missing title, description and last_updated values that can be derived"
    )
    private boolean fix;

    @Option(
        names = {"--apply"},
        description = "With --fix, write the derived values into the documents"
    )
    private boolean apply;

    @Override
    public Integer call() {
        if (apply && !fix) {
            System.err.println("✗ --apply requires --fix");
            return ExitCodes.INPUT_ERROR;
        }
        try {
            AuditConfig config = scopeOptions.loadConfig();
            AuditEngine engine = new AuditEngine(scopeOptions.getBaseDirectory(), config);
            AnalysisResult result = engine.analyze(scopeOptions.toScope(config), engine.defaultTimeout());
            if (fix) {
                return fix(engine, result);
            }

            List<FrontmatterFinding> issues = result.analyses().stream()
                .map(DocumentAnalysis::frontmatter)
                .filter(finding -> !finding.isComplete())
                .toList();

            System.out.println("Validated front-matter of " + result.analyses().size() + " documents");
            if (issues.isEmpty()) {
                System.out.println("✓ All documents have complete front-matter");
                return ExitCodes.OK;
            }

            System.out.println();
            for (FrontmatterFinding finding : issues) {
                StringBuilder line = new StringBuilder("  ").append(finding.path()).append(": ").append(finding.status());
                if (!finding.missingFields().isEmpty()) {
                    line.append(" missing [").append(String.join(", ", finding.missingFields())).append(']');
                }
                if (!finding.malformedFields().isEmpty()) {
                    line.append(" malformed [").append(String.join(", ", finding.malformedFields())).append(']');
                }
                System.out.println(line);
            }
            System.err.println("✗ " + issues.size() + " documents have front-matter issues");
            return ExitCodes.GATE_FAILED;

        } catch (Exception e) {
            return ExitCodes.fail(log, "Front-matter validation", e);
        }
    }

    private int fix(AuditEngine engine, AnalysisResult result) throws IOException {
        FrontmatterFixer fixer = new FrontmatterFixer();
        List<FrontmatterFixSuggestion> suggestions = fixer.suggest(result.analyses());
        if (suggestions.isEmpty()) {
            System.out.println("✓ All documents have complete front-matter");
            return ExitCodes.OK;
        }

        System.out.println("Incomplete front-matter (" + suggestions.size() + " documents):");
        for (FrontmatterFixSuggestion suggestion : suggestions) {
            System.out.println("  " + suggestion.path() + (suggestion.createsBlock() ? " (new block)" : ""));
            suggestion.additions().forEach((field, value) -> System.out.println("    + " + field + ": " + value));
            if (!suggestion.manualFields().isEmpty()) {
                System.out.println("    needs manual fix: " + String.join(", ", suggestion.manualFields()));
            }
        }
        long fixable = suggestions.stream().filter(FrontmatterFixSuggestion::hasAdditions).count();

        if (!apply) {
            System.out.println();
            System.out.println("Dry run: " + fixable + " fixable. Re-run with --fix --apply to rewrite the documents.");
            return ExitCodes.OK;
        }

        FrontmatterFixResult fixResult = fixer.apply(engine.getBaseDirectory(), suggestions);
        System.out.println();
        System.out.println("✓ Added front-matter fields to " + fixResult.modifiedFiles().size() + " documents");
        return ExitCodes.OK;
    }
}
