package com.docaudit.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A Markdown file inside the audited corpus, split into front-matter and body.
 *
 * <p>Identity is the path: two documents with the same path are the same document.</p>
 *
 * @param path path relative to the base directory with {@code /} separators, e.g. {@code docs/guides/setup.md}
 * @param content full decoded file content
 * @param frontmatter parsed front-matter, {@code null} when the file has none
 * @param body content after the front-matter block
 */
public record Document(
    String path,
    String content,
    FrontmatterRecord frontmatter,
    String body
) {
    public Document {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (path.isBlank() || path.contains("\\")) {
            throw new IllegalArgumentException("path must be a non-blank '/'-separated path: " + path);
        }
    }

    public Optional<FrontmatterRecord> frontmatterRecord() {
        return Optional.ofNullable(frontmatter);
    }

    public boolean hasFrontmatter() {
        return frontmatter != null;
    }

    /**
     * File name without directories, e.g. {@code setup.md}.
     *
     * @return base name of the path
     */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * Directory part of the path, empty for documents at the base directory.
     *
     * @return parent directory with {@code /} separators
     */
    public String directory() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    public boolean isReadme() {
        return fileName().equalsIgnoreCase("README.md");
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof Document document && path.equals(document.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }
}
