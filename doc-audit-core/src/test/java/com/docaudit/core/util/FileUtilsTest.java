package com.docaudit.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @ParameterizedTest
    @CsvSource({
        "docs/./a.md, docs/a.md",
        "docs/guides/../a.md, docs/a.md",
        "docs//a.md, docs/a.md",
        "a/b/c/../../d.md, a/d.md"
    })
    void normalize_collapsesDotSegments(String input, String expected) {
        assertThat(FileUtils.normalize(input)).isEqualTo(expected);
    }

    @Test
    void normalize_climbingAboveStart_returnsNull() {
        assertThat(FileUtils.normalize("docs/../../a.md")).isNull();
        assertThat(FileUtils.normalize("../a.md")).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"guide.md", "README.MD", "a.b.md"})
    void isDocumentFile_acceptsMarkdown(String name) {
        assertThat(FileUtils.isDocumentFile(Path.of(name))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {".hidden.md", "guide.md~", "#guide.md#", "notes.txt", "md"})
    void isDocumentFile_rejectsOthers(String name) {
        assertThat(FileUtils.isDocumentFile(Path.of(name))).isFalse();
    }

    @Test
    void parentOfAndFileNameOf_splitOnLastSlash() {
        assertThat(FileUtils.parentOf("docs/guides/setup.md")).isEqualTo("docs/guides");
        assertThat(FileUtils.parentOf("setup.md")).isEmpty();
        assertThat(FileUtils.fileNameOf("docs/guides/setup.md")).isEqualTo("setup.md");
    }

    @Test
    void toSlashPath_joinsWithForwardSlashes() {
        assertThat(FileUtils.toSlashPath(Path.of("docs", "guides", "setup.md"))).isEqualTo("docs/guides/setup.md");
    }

    @Test
    void stripFragment_removesAnchorAndQuery() {
        assertThat(MarkdownPatterns.stripFragment("a.md#top")).isEqualTo("a.md");
        assertThat(MarkdownPatterns.stripFragment("a.md?x=1#top")).isEqualTo("a.md");
        assertThat(MarkdownPatterns.isMarkdownTarget("guide.MD#intro")).isTrue();
        assertThat(MarkdownPatterns.isMarkdownTarget("diagram.png")).isFalse();
    }
}
