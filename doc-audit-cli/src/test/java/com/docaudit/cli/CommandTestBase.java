package com.docaudit.cli;

import com.docaudit.DocAuditCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Base class for command tests.
 *
 * <p>Provides a temporary base directory, helpers to lay out a corpus in it, and captures
 * {@code System.out} and {@code System.err} while a command runs.</p>
 */
abstract class CommandTestBase {

    protected static final String COMPLETE_FRONTMATTER = """
        ---
        title: %s
        description: About %s
        category: guide
        tags: [docs]
        last_updated: 2024-05-01
        ---
        """;

    @TempDir
    protected Path baseDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    /**
     * Runs the CLI with the base directory appended as positional argument.
     *
     * @param args command and options
     * @return exit code
     */
    protected int run(String... args) {
        List<String> all = new ArrayList<>(List.of(args));
        all.add(baseDir.toString());
        return DocAuditCLI.createCommandLine().execute(all.toArray(String[]::new));
    }

    protected String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    protected String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    protected Path write(String relativePath, String content) throws IOException {
        Path file = baseDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content);
    }

    protected String complete(String title) {
        return String.format(COMPLETE_FRONTMATTER, title, title);
    }

    /**
     * A small healthy corpus: an index linking to two complete guides that link back.
     */
    protected void writeHealthyCorpus() throws IOException {
        write("docs/README.md", complete("Docs") + "# Docs\n\nStart with [setup](guides/setup.md) and [usage](guides/usage.md).\n");
        write("docs/guides/setup.md", complete("Setup") + """
            # Setup

            ## Install

            Run the installer once. It prepares the workspace and checks the environment for you.

            ```bash
            ./install.sh
            ```

            ## Verify

            Open the dashboard and confirm the status page lists every service as healthy.

            ## Related Documents

            - [Usage](./usage.md)
            """);
        write("docs/guides/usage.md", complete("Usage") + """
            # Usage

            ## Commands

            Call the tool from the project root so that it finds the configuration file.

            ```bash
            tool run
            ```

            ## Options

            Every option has a sensible default, so most projects never need to change them.

            ## Related Documents

            - [Setup](./setup.md)
            """);
    }
}
