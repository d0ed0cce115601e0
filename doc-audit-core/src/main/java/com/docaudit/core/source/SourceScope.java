package com.docaudit.core.source;

import java.util.Objects;

/**
 * What part of the tree an audit covers.
 *
 * @param mode corpus, directory or single file
 * @param target path relative to the base directory
 * @param recursive whether subdirectories are scanned, ignored for single files
 */
public record SourceScope(Mode mode, String target, boolean recursive) {

    public enum Mode {
        CORPUS,
        DIRECTORY,
        SINGLE_FILE
    }

    public SourceScope {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(target, "target must not be null");
        if (target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
    }

    public static SourceScope corpus(String corpusRoot, boolean recursive) {
        return new SourceScope(Mode.CORPUS, corpusRoot, recursive);
    }

    public static SourceScope directory(String directory, boolean recursive) {
        return new SourceScope(Mode.DIRECTORY, directory, recursive);
    }

    public static SourceScope singleFile(String file) {
        return new SourceScope(Mode.SINGLE_FILE, file, false);
    }

    public boolean isSingleFile() {
        return mode == Mode.SINGLE_FILE;
    }

    public String describe() {
        return switch (mode) {
            case CORPUS -> "corpus " + target + (recursive ? "" : " (top level only)");
            case DIRECTORY -> "directory " + target + (recursive ? "" : " (top level only)");
            case SINGLE_FILE -> "file " + target;
        };
    }
}
