package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.config.ConfigLoader;
import com.docaudit.core.engine.AuditEngine;
import com.docaudit.core.history.HistoryTracker;
import com.docaudit.core.model.HistoryRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Prints the most recent rows of the metrics history with the score change per run.
 */
@Command(
    name = "history",
    description = "Show the documentation health trend",
    mixinStandardHelpOptions = true
)
public class HistoryCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(HistoryCommand.class);

    @Parameters(
        index = "0",
        description = "Base directory (default: current directory)",
        defaultValue = "."
    )
    private Path baseDirectory;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: docaudit.yaml in the base directory)"
    )
    private Path configPath = Paths.get(AuditConfig.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Report directory holding the history file (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-n", "--limit"},
        description = "Number of runs to show (default: 10)",
        defaultValue = "10"
    )
    private int limit;

    @Override
    public Integer call() {
        try {
            Path base = baseDirectory.toAbsolutePath().normalize();
            AuditConfig config = ConfigLoader.load(configPath.isAbsolute() ? configPath : base.resolve(configPath));
            AuditEngine engine = new AuditEngine(base, config);
            Path reportDir = outputDir != null ? outputDir.toAbsolutePath() : engine.reportDirectory();

            HistoryTracker tracker = new HistoryTracker(engine.historyFile(reportDir));
            List<HistoryRow> rows = tracker.readAll();
            if (rows.isEmpty()) {
                System.out.println("No history recorded yet at " + tracker.getHistoryFile());
                return ExitCodes.OK;
            }

            int from = Math.max(0, rows.size() - Math.max(1, limit));
            System.out.println(String.format("%-12s %6s %7s %8s %7s %12s", "Date", "Docs", "Score", "Change", "Broken", "Frontmatter"));
            for (int i = from; i < rows.size(); i++) {
                HistoryRow row = rows.get(i);
                String change = i == 0 ? "-" : String.format("%+d", row.healthScore() - rows.get(i - 1).healthScore());
                System.out.println(String.format("%-12s %6d %7d %8s %7d %12d", row.date(), row.totalDocuments(),
                    row.healthScore(), change, row.brokenLinks(), row.frontmatterIssues()));
            }
            return ExitCodes.OK;

        } catch (Exception e) {
            return ExitCodes.fail(log, "History", e);
        }
    }
}
