package com.docaudit.core.source;

import com.docaudit.core.model.SourceDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FileSystemDocumentSource}.
 */
class FileSystemDocumentSourceTest {

    @TempDir
    Path baseDir;

    private FileSystemDocumentSource source;

    @BeforeEach
    void setUp() throws IOException {
        write("docs/index.md", "# Index\n");
        write("docs/guides/setup.md", "# Setup\n");
        write("docs/guides/setup.md~", "backup");
        write("docs/.hidden.md", "hidden");
        write("docs/.drafts/draft.md", "draft");
        write("docs/#index.md#", "autosave");
        write("docs/notes.txt", "not markdown");
        source = new FileSystemDocumentSource(baseDir);
    }

    private void write(String path, String content) throws IOException {
        Path file = baseDir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    void load_corpus_findsMarkdownSortedAndSkipsHiddenAndBackups() {
        List<SourceDocument> documents = source.load(SourceScope.corpus("docs", true));

        assertThat(documents).extracting(SourceDocument::path)
            .containsExactly("docs/guides/setup.md", "docs/index.md");
        assertThat(documents.get(1).text()).isEqualTo("# Index\n");
    }

    @Test
    void load_nonRecursive_staysAtTopLevel() {
        List<SourceDocument> documents = source.load(SourceScope.directory("docs", false));

        assertThat(documents).extracting(SourceDocument::path).containsExactly("docs/index.md");
    }

    @Test
    void load_singleFile_returnsThatFile() {
        assertThat(source.load(SourceScope.singleFile("docs/guides/setup.md")))
            .extracting(SourceDocument::path).containsExactly("docs/guides/setup.md");
    }

    @Test
    void load_missingFile_throws() {
        assertThatThrownBy(() -> source.load(SourceScope.singleFile("docs/missing.md")))
            .isInstanceOf(DocumentSourceException.class)
            .hasMessageContaining("docs/missing.md");
    }

    @Test
    void load_nonMarkdownFile_throws() {
        assertThatThrownBy(() -> source.load(SourceScope.singleFile("docs/notes.txt")))
            .isInstanceOf(DocumentSourceException.class)
            .hasMessageContaining("Not a Markdown document");
    }

    @Test
    void load_missingDirectory_throws() {
        assertThatThrownBy(() -> source.load(SourceScope.directory("nope", true)))
            .isInstanceOf(DocumentSourceException.class);
    }

    @Test
    void load_targetOutsideBase_throws() {
        assertThatThrownBy(() -> source.load(SourceScope.directory("../elsewhere", true)))
            .isInstanceOf(DocumentSourceException.class)
            .hasMessageContaining("outside");
    }

    @Test
    void exists_checksFilesUnderBaseOnly() {
        assertThat(source.exists("docs/notes.txt")).isTrue();
        assertThat(source.exists("docs/guides")).isFalse();
        assertThat(source.exists("../outside.md")).isFalse();
    }
}
