package com.docaudit.core.engine;

import com.docaudit.core.analysis.DocumentAnalyzer;
import com.docaudit.core.analysis.FrontmatterValidator;
import com.docaudit.core.analysis.LinkResolver;
import com.docaudit.core.config.AuditConfig;
import com.docaudit.core.graph.DocumentGraphBuilder;
import com.docaudit.core.history.HistoryTracker;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.DocumentGraph;
import com.docaudit.core.model.HistoryRow;
import com.docaudit.core.model.Report;
import com.docaudit.core.model.SourceDocument;
import com.docaudit.core.report.RecommendationGenerator;
import com.docaudit.core.report.ReportAggregator;
import com.docaudit.core.source.DocumentSource;
import com.docaudit.core.source.FileSystemDocumentSource;
import com.docaudit.core.source.SourceScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs an audit end to end: load, analyze in parallel, build the graph, aggregate, record history.
 *
 * <p>History is appended only once the report is complete and never for single-file scopes, so
 * a failed or aborted run leaves the store untouched.</p>
 */
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    private final Path baseDirectory;
    private final AuditConfig config;
    private final DocumentSource documentSource;
    private final LinkResolver linkResolver;
    private final DocumentAnalyzer documentAnalyzer;
    private final DocumentGraphBuilder graphBuilder;
    private final ReportAggregator reportAggregator;

    public AuditEngine(Path baseDirectory, AuditConfig config) {
        this(baseDirectory, config, new FileSystemDocumentSource(baseDirectory), Clock.systemDefaultZone());
    }

    public AuditEngine(Path baseDirectory, AuditConfig config, DocumentSource documentSource, Clock clock) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null").toAbsolutePath().normalize();
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.documentSource = Objects.requireNonNull(documentSource, "documentSource must not be null");
        this.linkResolver = new LinkResolver(config.corpus().root(), documentSource::exists);
        this.documentAnalyzer = new DocumentAnalyzer(
            new FrontmatterValidator(config.analysis().requiredFrontmatter()), config.analysis().workers());
        this.graphBuilder = new DocumentGraphBuilder(linkResolver);
        this.reportAggregator = new ReportAggregator(new RecommendationGenerator(), clock,
            config.analysis().includeReadability());
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    public AuditConfig getConfig() {
        return config;
    }

    /**
     * Scope covering the configured corpus root.
     *
     * @return corpus scope
     */
    public SourceScope corpusScope() {
        return SourceScope.corpus(config.corpus().root(), config.corpus().recursive());
    }

    public Duration defaultTimeout() {
        return Duration.ofSeconds(config.analysis().timeoutSeconds());
    }

    /**
     * Report directory from configuration, resolved against the base directory.
     *
     * @return report directory
     */
    public Path reportDirectory() {
        return baseDirectory.resolve(config.report().directory());
    }

    public Path historyFile(Path reportDirectory) {
        return reportDirectory.resolve(config.history().file());
    }

    /**
     * Loads and analyzes documents and builds their graph.
     *
     * @param scope what to analyze
     * @param timeout deadline for the parallel stage
     * @return analyses and graph
     * @throws com.docaudit.core.source.DocumentSourceException if the scope target is missing
     * @throws com.docaudit.core.analysis.AuditTimeoutException if the deadline expires
     */
    public AnalysisResult analyze(SourceScope scope, Duration timeout) {
        log.info("Scanning {}", scope.describe());
        List<SourceDocument> sources = documentSource.load(scope);
        List<DocumentAnalysis> analyses = documentAnalyzer.analyzeAll(sources, timeout).stream()
            .sorted(Comparator.comparing(DocumentAnalysis::path))
            .toList();
        DocumentGraph graph = graphBuilder.build(analyses);
        log.info("Found {} documents, {} internal references, {} broken", analyses.size(),
            graph.edges().size(), graph.brokenReferences().size());
        return new AnalysisResult(analyses, graph);
    }

    /**
     * Runs a full audit.
     *
     * @param request scope, lint count, deadline and history destination
     * @return the immutable report
     */
    public Report audit(AuditRequest request) {
        AnalysisResult result = analyze(request.scope(), request.timeout());
        Report report = reportAggregator.aggregate(request.scope().describe(), request.scope().isSingleFile(),
            result.analyses(), result.graph(), request.lintingIssues());

        if (request.historyFile() != null && !report.singleFile()) {
            HistoryTracker tracker = new HistoryTracker(request.historyFile());
            try {
                tracker.append(HistoryRow.from(report));
                log.info("Recorded metrics in {}", request.historyFile());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append history to " + request.historyFile(), e);
            }
        }
        return report;
    }
}
