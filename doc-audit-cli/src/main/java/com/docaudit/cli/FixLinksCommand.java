package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.engine.AnalysisResult;
import com.docaudit.core.engine.AuditEngine;
import com.docaudit.core.fix.LinkFixResult;
import com.docaudit.core.fix.LinkFixSuggestion;
import com.docaudit.core.fix.LinkFixer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Suggests replacements for broken references and optionally writes them.
 */
@Command(
    name = "fix-links",
    description = "Suggest fixes for broken references (dry run unless --apply)",
    mixinStandardHelpOptions = true
)
public class FixLinksCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(FixLinksCommand.class);

    @Mixin
    private ScopeOptions scopeOptions;

    @Option(
        names = {"--apply"},
        description = "Rewrite the documents instead of only listing suggestions"
    )
    private boolean apply;

    @Override
    public Integer call() {
        try {
            AuditConfig config = scopeOptions.loadConfig();
            AuditEngine engine = new AuditEngine(scopeOptions.getBaseDirectory(), config);
            AnalysisResult result = engine.analyze(scopeOptions.toScope(config), engine.defaultTimeout());

            LinkFixer fixer = new LinkFixer(config.corpus().root());
            List<LinkFixSuggestion> suggestions = fixer.suggest(result.graph());
            if (suggestions.isEmpty()) {
                System.out.println("✓ No broken references found");
                return ExitCodes.OK;
            }

            System.out.println("Broken references (" + suggestions.size() + "):");
            for (LinkFixSuggestion suggestion : suggestions) {
                System.out.println("  " + suggestion.sourcePath() + ": " + suggestion.reference() + " -> "
                    + suggestion.suggestion().orElse("(no suggestion)"));
            }
            long fixable = suggestions.stream().filter(LinkFixSuggestion::hasSuggestion).count();

            if (!apply) {
                System.out.println();
                System.out.println("Dry run: " + fixable + " fixable. Re-run with --apply to rewrite the documents.");
                return ExitCodes.OK;
            }

            LinkFixResult fixResult = fixer.apply(engine.getBaseDirectory(), suggestions);
            System.out.println();
            System.out.println("✓ Fixed " + fixResult.applied().size() + " references in "
                + fixResult.modifiedFiles().size() + " documents");
            if (!fixResult.unmatched().isEmpty()) {
                System.out.println("  " + fixResult.unmatched().size() + " references could not be located in their files");
            }
            return ExitCodes.OK;

        } catch (Exception e) {
            return ExitCodes.fail(log, "Link fix", e);
        }
    }
}
