package com.docaudit;

import ch.qos.logback.classic.Level;
import com.docaudit.cli.AuditCommand;
import com.docaudit.cli.FixLinksCommand;
import com.docaudit.cli.FrontmatterCommand;
import com.docaudit.cli.HistoryCommand;
import com.docaudit.cli.LinksCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for DocAudit.
 *
 * <p>DocAudit checks a Markdown documentation corpus for front-matter completeness, broken and
 * orphaned references, structural quality and readability, and reports an overall health score.</p>
 *
 * <p><b>Commands:</b></p>
 * <ul>
 *   <li>{@code audit} - Full audit with report files and history</li>
 *   <li>{@code links} - Report broken references</li>
 *   <li>{@code fix-links} - Suggest or apply fixes for broken references</li>
 *   <li>{@code frontmatter} - Validate front-matter, or fill in derivable fields with {@code --fix}</li>
 *   <li>{@code history} - Show the health score trend</li>
 * </ul>
 *
 * <p><b>Example Usage:</b></p>
 * <pre>{@code
 * docaudit audit --format markdown,csv
 * docaudit audit --file docs/guides/setup.md --format text
 * docaudit -v links
 * docaudit fix-links --apply
 * docaudit frontmatter --fix --apply
 * }</pre>
 */
@Command(
    name = "docaudit",
    mixinStandardHelpOptions = true,
    version = "DocAudit 1.0.0-SNAPSHOT",
    description = "Documentation consistency and quality auditing for Markdown corpora",
    subcommands = {
        AuditCommand.class,
        LinksCommand.class,
        FixLinksCommand.class,
        FrontmatterCommand.class,
        HistoryCommand.class
    }
)
public class DocAuditCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(DocAuditCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("DocAudit - Documentation Quality Auditing");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'docaudit --help' to see available commands");
        System.out.println("Use 'docaudit <command> --help' for command-specific help");
    }

    /**
     * Configures the Logback root level from the global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line. Global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        DocAuditCLI cli = new DocAuditCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
