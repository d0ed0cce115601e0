package com.docaudit.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AuditCommand}.
 */
class AuditCommandTest extends CommandTestBase {

    private List<String> reportFiles() throws IOException {
        Path reportDir = baseDir.resolve("target/reports/docs_validation");
        if (!Files.isDirectory(reportDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(reportDir)) {
            return files.map(file -> file.getFileName().toString()).sorted().toList();
        }
    }

    @Test
    void audit_healthyCorpus_writesReportAndHistory() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--ci");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("✓ Analyzed 3 documents");
        assertThat(stdout()).contains("✓ Recorded metrics history");
        assertThat(stdout()).contains("Audit Summary:");
        assertThat(stdout()).contains("  Broken references:  0");
        assertThat(reportFiles()).hasSize(2)
            .anyMatch(name -> name.startsWith("documentation_quality_report_") && name.endsWith(".md"))
            .contains("documentation_metrics_history.csv");
    }

    @Test
    void audit_allFormats_writesOneFilePerFormat() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--format", "markdown,csv,dot", "--no-history");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(reportFiles()).hasSize(3)
            .anyMatch(name -> name.startsWith("documentation_inventory_") && name.endsWith(".csv"))
            .anyMatch(name -> name.startsWith("document_graph_") && name.endsWith(".dot"))
            .noneMatch(name -> name.endsWith("history.csv"));
    }

    @Test
    void audit_textFormat_printsReportWithoutWritingFiles() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--format", "text", "--no-history");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("## Inventory").contains("## Summary");
        assertThat(reportFiles()).isEmpty();
    }

    @Test
    void audit_ciBelowThreshold_returnsGateFailed() throws IOException {
        write("docs/a.md", "[x](x.md) [y](y.md) [z](z.md)\n");
        write("docs/b.md", "[x](x.md) [y](y.md) [z](z.md)\n");

        int exitCode = run("audit", "--ci", "--no-history");

        assertThat(exitCode).isEqualTo(ExitCodes.GATE_FAILED);
        assertThat(stderr()).contains("below threshold (70)");
        assertThat(stdout()).contains("Recommended Actions:").contains("High: Fix 6 broken links");
    }

    @Test
    void audit_withoutCi_succeedsDespiteLowScore() throws IOException {
        write("docs/a.md", "[x](x.md)\n");

        assertThat(run("audit", "--no-history")).isEqualTo(ExitCodes.OK);
    }

    @Test
    void audit_singleFile_skipsHistory() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--file", "docs/guides/setup.md");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("✓ Analyzed 1 documents").doesNotContain("Recorded metrics history");
        assertThat(reportFiles()).noneMatch(name -> name.endsWith("history.csv"));
    }

    @Test
    void audit_missingFile_returnsInputError() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--file", "docs/missing.md");

        assertThat(exitCode).isEqualTo(ExitCodes.INPUT_ERROR);
        assertThat(stderr()).contains("docs/missing.md");
        assertThat(reportFiles()).isEmpty();
    }

    @Test
    void audit_missingCorpus_returnsInputError() {
        assertThat(run("audit")).isEqualTo(ExitCodes.INPUT_ERROR);
    }

    @Test
    void audit_unknownFormat_returnsInputError() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--format", "pdf");

        assertThat(exitCode).isEqualTo(ExitCodes.INPUT_ERROR);
        assertThat(stderr()).contains("Unknown format(s): pdf");
    }

    @Test
    void audit_configuredThreshold_isUsedByGate() throws IOException {
        writeHealthyCorpus();
        write("docaudit.yaml", "report:\n  ciThreshold: 100\n");

        assertThat(run("audit", "--ci", "--no-history")).isEqualTo(ExitCodes.GATE_FAILED);
    }

    @Test
    void audit_fileAndDirTogether_isRejected() throws IOException {
        writeHealthyCorpus();

        int exitCode = run("audit", "--file", "docs/README.md", "--dir", "docs");

        assertThat(exitCode).isEqualTo(ExitCodes.INPUT_ERROR);
    }

    @Test
    void audit_unwritableReportDirectory_returnsInternalError() throws IOException {
        writeHealthyCorpus();
        Path blocker = write("not-a-directory", "plain file");

        int exitCode = run("audit", "--ci", "-o", blocker.toString());

        assertThat(exitCode).isEqualTo(ExitCodes.INTERNAL_ERROR);
        assertThat(stderr()).contains("✗ Audit failed");
        assertThat(Files.readString(blocker)).isEqualTo("plain file");
    }
}
