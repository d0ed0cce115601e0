package com.docaudit.core.analysis;

import com.docaudit.core.model.Document;
import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.SourceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs the per-document stages (front-matter, references, quality, readability) across a
 * bounded worker pool and collects the results in input order.
 *
 * <p>Each task touches only its own document, so no state is shared between workers.</p>
 */
public class DocumentAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DocumentAnalyzer.class);

    private final FrontmatterExtractor frontmatterExtractor;
    private final FrontmatterValidator frontmatterValidator;
    private final ReferenceExtractor referenceExtractor;
    private final QualityScorer qualityScorer;
    private final ReadabilityAnalyzer readabilityAnalyzer;
    private final int workers;

    public DocumentAnalyzer(FrontmatterValidator frontmatterValidator, int workers) {
        this(new FrontmatterExtractor(), frontmatterValidator, new ReferenceExtractor(), new QualityScorer(),
            new ReadabilityAnalyzer(), workers);
    }

    public DocumentAnalyzer(FrontmatterExtractor frontmatterExtractor,
                            FrontmatterValidator frontmatterValidator,
                            ReferenceExtractor referenceExtractor,
                            QualityScorer qualityScorer,
                            ReadabilityAnalyzer readabilityAnalyzer,
                            int workers) {
        this.frontmatterExtractor = Objects.requireNonNull(frontmatterExtractor);
        this.frontmatterValidator = Objects.requireNonNull(frontmatterValidator);
        this.referenceExtractor = Objects.requireNonNull(referenceExtractor);
        this.qualityScorer = Objects.requireNonNull(qualityScorer);
        this.readabilityAnalyzer = Objects.requireNonNull(readabilityAnalyzer);
        this.workers = workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Analyzes one document on the calling thread.
     *
     * @param source raw document
     * @return complete per-document analysis
     */
    public DocumentAnalysis analyze(SourceDocument source) {
        log.debug("Analyzing {}", source.path());
        String content = source.text();
        FrontmatterExtraction extraction = frontmatterExtractor.extract(content);
        Document document = new Document(source.path(), content, extraction.frontmatter(), extraction.body());
        return new DocumentAnalysis(
            document,
            referenceExtractor.extract(extraction.frontmatter(), extraction.body(), extraction.bodyStartLine()),
            frontmatterValidator.validate(document.path(), extraction.frontmatter()),
            qualityScorer.score(document),
            readabilityAnalyzer.analyze(document)
        );
    }

    /**
     * Analyzes all documents in parallel.
     *
     * @param sources raw documents
     * @param timeout deadline for the whole stage
     * @return analyses in the same order as {@code sources}
     * @throws AuditTimeoutException if the deadline expires first
     */
    public List<DocumentAnalysis> analyzeAll(List<SourceDocument> sources, Duration timeout) {
        if (sources.isEmpty()) {
            return List.of();
        }
        int poolSize = Math.min(workers, sources.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize);
        try {
            List<Callable<DocumentAnalysis>> tasks = new ArrayList<>(sources.size());
            for (SourceDocument source : sources) {
                tasks.add(() -> analyze(source));
            }
            List<Future<DocumentAnalysis>> futures = executor.invokeAll(tasks, timeout.toMillis(), TimeUnit.MILLISECONDS);

            long cancelled = futures.stream().filter(Future::isCancelled).count();
            if (cancelled > 0) {
                throw new AuditTimeoutException(timeout, (int) cancelled);
            }

            List<DocumentAnalysis> results = new ArrayList<>(futures.size());
            for (Future<DocumentAnalysis> future : futures) {
                results.add(future.get());
            }
            log.info("Analyzed {} documents with {} workers", results.size(), poolSize);
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuditTimeoutException(timeout, sources.size());
        } catch (CancellationException e) {
            throw new AuditTimeoutException(timeout, sources.size());
        } catch (ExecutionException e) {
            throw new IllegalStateException("Document analysis failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }
}
