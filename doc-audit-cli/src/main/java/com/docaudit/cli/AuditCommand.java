package com.docaudit.cli;

import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.engine.AuditEngine;
import com.docaudit.core.engine.AuditRequest;
import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.generator.GeneratorConfig;
import com.docaudit.core.generator.ReportFormat;
import com.docaudit.core.generator.ReportGenerator;
import com.docaudit.core.model.Recommendation;
import com.docaudit.core.model.Report;
import com.docaudit.core.renderer.GeneratedOutput;
import com.docaudit.core.renderer.OutputRenderer;
import com.docaudit.core.renderer.RenderContext;
import com.docaudit.core.source.SourceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Runs a full audit and writes the reports.
 *
 * <p>Pipeline:</p>
 * <ol>
 *   <li>Load configuration</li>
 *   <li>Scan, analyze and aggregate via {@link AuditEngine}</li>
 *   <li>Generate the requested formats via SPI</li>
 *   <li>Render files to the report directory, or to the console for {@code text}</li>
 *   <li>Apply the CI gate when requested</li>
 * </ol>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * docaudit audit
 * docaudit audit /path/to/repo --format markdown,csv,dot -o build/doc-reports
 * docaudit audit --dir docs/guides --no-recursive --format text
 * docaudit audit --ci --lint-issues 12
 * }</pre>
 */
@Command(
    name = "audit",
    description = "Audit the documentation corpus and write quality reports",
    mixinStandardHelpOptions = true
)
public class AuditCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AuditCommand.class);

    static final String TEXT_FORMAT = "text";

    @Mixin
    private ScopeOptions scopeOptions;

    @Option(
        names = {"-f", "--format"},
        split = ",",
        description = "Output formats: markdown, csv, dot, text (default: from config)"
    )
    private List<String> formats;

    @Option(
        names = {"-o", "--output"},
        description = "Report directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"--lint-issues"},
        description = "Markdown lint issue count from an external linter (default: 0)",
        defaultValue = "0"
    )
    private int lintingIssues;

    @Option(
        names = {"--no-history"},
        description = "Do not append this run to the metrics history"
    )
    private boolean noHistory;

    @Option(
        names = {"--timeout"},
        description = "Analysis deadline in seconds (overrides config)"
    )
    private Integer timeoutSeconds;

    @Option(
        names = {"--ci"},
        description = "Exit with code 1 when the health score is below the configured threshold"
    )
    private boolean ci;

    @Override
    public Integer call() {
        try {
            AuditConfig config = scopeOptions.loadConfig();
            AuditEngine engine = new AuditEngine(scopeOptions.getBaseDirectory(), config);

            Set<String> requested = requestedFormats(config);
            List<String> unknown = requested.stream()
                .filter(format -> !TEXT_FORMAT.equals(format) && ReportFormat.fromId(format).isEmpty())
                .toList();
            if (!unknown.isEmpty()) {
                System.err.println("✗ Unknown format(s): " + String.join(", ", unknown));
                return ExitCodes.INPUT_ERROR;
            }
            if (lintingIssues < 0) {
                System.err.println("✗ --lint-issues must not be negative");
                return ExitCodes.INPUT_ERROR;
            }

            SourceScope scope = scopeOptions.toScope(config);
            Path reportDir = getReportDirectory(engine);
            boolean recordHistory = !noHistory && config.history().enabled();
            Duration timeout = timeoutSeconds != null && timeoutSeconds > 0
                ? Duration.ofSeconds(timeoutSeconds)
                : engine.defaultTimeout();

            System.out.println("Auditing " + scope.describe() + " in " + engine.getBaseDirectory());
            System.out.println();

            Report report = engine.audit(new AuditRequest(scope, lintingIssues, timeout,
                recordHistory ? engine.historyFile(reportDir) : null));
            System.out.println("✓ Analyzed " + report.totalDocuments() + " documents");
            if (recordHistory && !scope.isSingleFile()) {
                System.out.println("✓ Recorded metrics history");
            }

            GeneratorConfig generatorConfig = new GeneratorConfig(GeneratorConfig.DEFAULT_TITLE,
                config.analysis().includeReadability(), config.report().ciThreshold(), Map.of());
            List<GeneratedReport> files = new ArrayList<>();
            List<GeneratedReport> console = new ArrayList<>();
            for (ReportGenerator generator : discoverGenerators()) {
                if (requested.contains(generator.getId())) {
                    files.add(generator.generate(report, generatorConfig));
                }
                if (requested.contains(TEXT_FORMAT) && generator.getFormat() == ReportFormat.MARKDOWN) {
                    console.add(generator.generate(report, generatorConfig));
                }
            }

            if (!files.isEmpty()) {
                renderer("filesystem").render(new GeneratedOutput(files), new RenderContext(reportDir, Map.of()));
                files.forEach(file -> System.out.println("✓ Wrote " + reportDir.resolve(file.fileName())));
            }
            if (!console.isEmpty()) {
                System.out.println();
                renderer("console").render(new GeneratedOutput(console), new RenderContext(reportDir, Map.of()));
            }

            printSummary(report);

            if (ci && !report.meetsThreshold(config.report().ciThreshold())) {
                System.err.println("✗ Documentation health score (" + report.healthScore()
                    + ") is below threshold (" + config.report().ciThreshold() + ")");
                return ExitCodes.GATE_FAILED;
            }
            return ExitCodes.OK;

        } catch (Exception e) {
            return ExitCodes.fail(log, "Audit", e);
        }
    }

    private Set<String> requestedFormats(AuditConfig config) {
        List<String> source = formats != null && !formats.isEmpty() ? formats : config.report().formats();
        Set<String> normalized = new LinkedHashSet<>();
        source.forEach(format -> normalized.add(format.trim().toLowerCase(Locale.ROOT)));
        return normalized;
    }

    private Path getReportDirectory(AuditEngine engine) {
        if (outputDir != null) {
            return outputDir.toAbsolutePath();
        }
        return engine.reportDirectory();
    }

    private List<ReportGenerator> discoverGenerators() {
        log.debug("Discovering report generators via ServiceLoader");
        List<ReportGenerator> generators = new ArrayList<>();
        ServiceLoader.load(ReportGenerator.class).forEach(generators::add);
        log.debug("Discovered {} report generators", generators.size());
        return generators;
    }

    private OutputRenderer renderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (id.equals(renderer.getId())) {
                return renderer;
            }
        }
        throw new IllegalStateException("Output renderer not found: " + id);
    }

    private void printSummary(Report report) {
        System.out.println();
        System.out.println("Audit Summary:");
        System.out.println("  Documents:          " + report.totalDocuments());
        System.out.println("  Broken references:  " + report.brokenReferenceCount());
        System.out.println("  Orphaned documents: " + report.graph().orphans().size());
        System.out.println("  Frontmatter issues: " + report.frontmatterCoverage().issues());
        System.out.println("  Health score:       " + report.healthScore() + "/100 ("
            + report.healthRating().displayName() + ")");
        if (!report.recommendations().isEmpty()) {
            System.out.println();
            System.out.println("Recommended Actions:");
            for (Recommendation recommendation : report.recommendations()) {
                System.out.println("  - " + recommendation.priority().displayName() + ": " + recommendation.message());
            }
        }
        System.out.println();
    }
}
