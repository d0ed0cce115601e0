package com.docaudit.core.analysis;

import com.docaudit.core.model.DocumentAnalysis;
import com.docaudit.core.model.FrontmatterStatus;
import com.docaudit.core.model.SourceDocument;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentAnalyzer}.
 */
class DocumentAnalyzerTest {

    private final DocumentAnalyzer analyzer =
        new DocumentAnalyzer(new FrontmatterValidator(FrontmatterValidator.DEFAULT_REQUIRED_FIELDS), 4);

    private static SourceDocument source(String path, String content) {
        return new SourceDocument(path, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void analyze_combinesAllStages() {
        DocumentAnalysis analysis = analyzer.analyze(source("docs/a.md", """
            ---
            title: A
            ---
            # A

            See [B](./b.md).
            """));

        assertThat(analysis.path()).isEqualTo("docs/a.md");
        assertThat(analysis.document().hasFrontmatter()).isTrue();
        assertThat(analysis.references()).hasSize(1);
        assertThat(analysis.frontmatter().status()).isEqualTo(FrontmatterStatus.INCOMPLETE);
        assertThat(analysis.quality().hasTopLevelHeading()).isTrue();
        assertThat(analysis.readability().wordCount()).isEqualTo(4);
    }

    @Test
    void analyzeAll_preservesInputOrder() {
        List<SourceDocument> sources = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            sources.add(source(String.format("docs/doc-%02d.md", i), "# Doc " + i + "\n"));
        }

        List<DocumentAnalysis> analyses = analyzer.analyzeAll(sources, Duration.ofSeconds(30));

        assertThat(analyses).extracting(DocumentAnalysis::path)
            .containsExactlyElementsOf(sources.stream().map(SourceDocument::path).toList());
    }

    @Test
    void analyzeAll_emptyInput_returnsEmpty() {
        assertThat(analyzer.analyzeAll(List.of(), Duration.ofSeconds(1))).isEmpty();
    }

    @Test
    void constructor_nonPositiveWorkers_usesAvailableProcessors() {
        DocumentAnalyzer defaults = new DocumentAnalyzer(new FrontmatterValidator(FrontmatterValidator.DEFAULT_REQUIRED_FIELDS), 0);

        assertThat(defaults.getWorkers()).isEqualTo(Runtime.getRuntime().availableProcessors());
    }

    @Test
    void analyzeAll_stageOutlivesDeadline_throwsTimeoutAndCancels() {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        FrontmatterExtractor blocking = new FrontmatterExtractor() {
            @Override
            public FrontmatterExtraction extract(String content) {
                started.countDown();
                try {
                    new CountDownLatch(1).await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                }
                return super.extract(content);
            }
        };
        DocumentAnalyzer slow = new DocumentAnalyzer(blocking,
            new FrontmatterValidator(FrontmatterValidator.DEFAULT_REQUIRED_FIELDS), new ReferenceExtractor(),
            new QualityScorer(), new ReadabilityAnalyzer(), 1);

        assertThatThrownBy(() -> slow.analyzeAll(List.of(source("docs/a.md", "# A\n")), Duration.ofMillis(200)))
            .isInstanceOf(AuditTimeoutException.class);
        assertThat(started.getCount()).isZero();
        assertThat(awaitQuietly(interrupted)).isTrue();
    }

    private static boolean awaitQuietly(CountDownLatch latch) {
        try {
            return latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
