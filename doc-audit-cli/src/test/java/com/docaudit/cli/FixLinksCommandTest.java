package com.docaudit.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FixLinksCommand}.
 */
class FixLinksCommandTest extends CommandTestBase {

    @Test
    void fixLinks_dryRun_listsSuggestionsWithoutWriting() throws IOException {
        write("docs/guides/setup.md", "# Setup\n");
        write("docs/a.md", "[setup](setup.md)\n");

        int exitCode = run("fix-links");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("docs/a.md: setup.md -> /docs/guides/setup.md");
        assertThat(stdout()).contains("Dry run: 1 fixable");
        assertThat(Files.readString(baseDir.resolve("docs/a.md"))).isEqualTo("[setup](setup.md)\n");
    }

    @Test
    void fixLinks_apply_rewritesAndLinksCheckPasses() throws IOException {
        write("docs/guides/setup.md", "# Setup\n");
        write("docs/a.md", "[setup](setup.md)\n");

        int exitCode = run("fix-links", "--apply");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("✓ Fixed 1 references in 1 documents");
        assertThat(Files.readString(baseDir.resolve("docs/a.md"))).isEqualTo("[setup](/docs/guides/setup.md)\n");
        assertThat(run("links")).isEqualTo(ExitCodes.OK);
    }

    @Test
    void fixLinks_noMatch_reportsNoSuggestion() throws IOException {
        write("docs/a.md", "[gone](nowhere.md)\n");

        assertThat(run("fix-links")).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("docs/a.md: nowhere.md -> (no suggestion)");
    }
}
