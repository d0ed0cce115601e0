package com.docaudit.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FrontmatterCommand}.
 */
class FrontmatterCommandTest extends CommandTestBase {

    @Test
    void frontmatter_allComplete_returnsOk() throws IOException {
        writeHealthyCorpus();

        assertThat(run("frontmatter")).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("Validated front-matter of 3 documents")
            .contains("✓ All documents have complete front-matter");
    }

    @Test
    void frontmatter_issues_listedAndFail() throws IOException {
        write("docs/none.md", "# No front-matter\n");
        write("docs/partial.md", "---\ntitle: Partial\ncategory: nonsense\n---\n");

        int exitCode = run("frontmatter");

        assertThat(exitCode).isEqualTo(ExitCodes.GATE_FAILED);
        assertThat(stdout()).contains("docs/none.md: ABSENT");
        assertThat(stdout()).contains("docs/partial.md: INCOMPLETE missing [description, category, tags, last_updated]")
            .contains("malformed [category]");
        assertThat(stderr()).contains("2 documents have front-matter issues");
    }

    @Test
    void frontmatter_customRequiredFields_fromConfig() throws IOException {
        write("docs/a.md", "---\ntitle: A\n---\n");
        write("docaudit.yaml", "analysis:\n  requiredFrontmatter: [title]\n");

        assertThat(run("frontmatter")).isEqualTo(ExitCodes.OK);
    }

    @Test
    void frontmatterFix_dryRun_listsDerivedValuesWithoutWriting() throws IOException {
        String content = "# Quick Start\n\nGet going in five minutes.\n";
        write("docs/quick-start.md", content);

        int exitCode = run("frontmatter", "--fix");

        assertThat(exitCode).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("docs/quick-start.md (new block)")
            .contains("    + title: Quick Start")
            .contains("    + description: Get going in five minutes.")
            .contains("    + last_updated: ")
            .contains("    needs manual fix: category, tags")
            .contains("Dry run: 1 fixable");
        assertThat(Files.readString(baseDir.resolve("docs/quick-start.md"))).isEqualTo(content);
    }

    @Test
    void frontmatterFix_apply_writesFieldsThenOnlyManualFieldsRemain() throws IOException {
        write("docs/quick-start.md", "---\ncategory: guide\ntags: [start]\n---\n# Quick Start\n\nGet going.\n");

        assertThat(run("frontmatter", "--fix", "--apply")).isEqualTo(ExitCodes.OK);
        assertThat(stdout()).contains("✓ Added front-matter fields to 1 documents");
        assertThat(Files.readString(baseDir.resolve("docs/quick-start.md")))
            .startsWith("---\ncategory: guide\ntags: [start]\ntitle: Quick Start\ndescription: Get going.\nlast_updated: ");

        assertThat(run("frontmatter")).isEqualTo(ExitCodes.OK);
    }

    @Test
    void frontmatterApply_withoutFix_isRejected() throws IOException {
        write("docs/a.md", "# A\n");

        assertThat(run("frontmatter", "--apply")).isEqualTo(ExitCodes.INPUT_ERROR);
        assertThat(stderr()).contains("--apply requires --fix");
    }
}
