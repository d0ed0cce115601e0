package com.docaudit.core.renderer.impl;

import com.docaudit.core.generator.GeneratedReport;
import com.docaudit.core.renderer.GeneratedOutput;
import com.docaudit.core.renderer.OutputRenderer;
import com.docaudit.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes report files into the report directory, creating it when needed.
 * Existing files with the same name (same day) are overwritten.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    public static final String ID = "filesystem";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        log.info("Writing {} report files to {}", output.reports().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create report directory: " + outputDir, e);
        }

        for (GeneratedReport report : output.reports()) {
            Path target = outputDir.resolve(report.fileName());
            try {
                Files.writeString(target, report.content(), StandardCharsets.UTF_8);
                log.debug("Wrote {} ({} chars)", target, report.content().length());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write report file: " + target, e);
            }
        }
    }
}
