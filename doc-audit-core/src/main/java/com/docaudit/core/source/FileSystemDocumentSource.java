package com.docaudit.core.source;

import com.docaudit.core.model.SourceDocument;
import com.docaudit.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads Markdown documents from the local file system.
 */
public class FileSystemDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemDocumentSource.class);

    private final Path baseDirectory;

    public FileSystemDocumentSource(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "baseDirectory must not be null")
            .toAbsolutePath().normalize();
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }

    @Override
    public List<SourceDocument> load(SourceScope scope) {
        Objects.requireNonNull(scope, "scope must not be null");
        Path target = locate(scope.target());

        if (scope.isSingleFile()) {
            if (!Files.isRegularFile(target)) {
                throw new DocumentSourceException("File not found: " + scope.target());
            }
            if (!FileUtils.isDocumentFile(target)) {
                throw new DocumentSourceException("Not a Markdown document: " + scope.target());
            }
            return List.of(read(target));
        }

        if (!Files.isDirectory(target)) {
            throw new DocumentSourceException("Directory not found: " + scope.target());
        }

        List<Path> files;
        try {
            files = FileUtils.findMarkdownFiles(target, scope.recursive());
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot enumerate " + scope.target() + ": " + e.getMessage(), e);
        }

        List<SourceDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(read(file));
        }
        log.debug("Loaded {} documents from {}", documents.size(), scope.describe());
        return documents;
    }

    @Override
    public boolean exists(String relativePath) {
        Path candidate = baseDirectory.resolve(relativePath).normalize();
        return candidate.startsWith(baseDirectory) && Files.isRegularFile(candidate);
    }

    private Path locate(String target) {
        Path path = baseDirectory.resolve(target).normalize();
        if (!path.startsWith(baseDirectory)) {
            throw new DocumentSourceException("Target lies outside the base directory: " + target);
        }
        return path;
    }

    private SourceDocument read(Path file) {
        String relative = FileUtils.toSlashPath(baseDirectory.relativize(file));
        try {
            return new SourceDocument(relative, Files.readAllBytes(file));
        } catch (IOException e) {
            throw new DocumentSourceException("Cannot read " + relative + ": " + e.getMessage(), e);
        }
    }
}
