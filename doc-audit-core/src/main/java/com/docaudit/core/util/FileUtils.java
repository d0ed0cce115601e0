package com.docaudit.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Utility class for file and path operations.
 */
public final class FileUtils {

    /** Extension of the documents the audit looks at. */
    public static final String MARKDOWN_EXTENSION = ".md";

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds Markdown documents under a directory, skipping hidden and backup files.
     *
     * @param directory directory to search
     * @param recursive whether to descend into subdirectories
     * @return matching regular files, sorted by path
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findMarkdownFiles(Path directory, boolean recursive) throws IOException {
        int depth = recursive ? Integer.MAX_VALUE : 1;
        try (Stream<Path> paths = Files.walk(directory, depth)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !isHiddenBelow(directory, path))
                .filter(FileUtils::isDocumentFile)
                .sorted(Comparator.comparing(path -> toSlashPath(directory.relativize(path))))
                .toList();
        }
    }

    /**
     * Checks whether a file name denotes an auditable document.
     *
     * <p>Hidden files, editor backups ({@code *~}, {@code #*#}) and non-Markdown files are rejected.</p>
     *
     * @param path file path
     * @return true if the file should be audited
     */
    public static boolean isDocumentFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString();
        if (name.startsWith(".") || name.endsWith("~") || (name.startsWith("#") && name.endsWith("#"))) {
            return false;
        }
        return name.toLowerCase(Locale.ROOT).endsWith(MARKDOWN_EXTENSION);
    }

    /**
     * Renders a relative path with {@code /} separators regardless of platform.
     *
     * @param path relative path
     * @return slash-separated form
     */
    public static String toSlashPath(Path path) {
        StringBuilder builder = new StringBuilder();
        for (Path part : path) {
            if (builder.length() > 0) {
                builder.append('/');
            }
            builder.append(part);
        }
        return builder.toString();
    }

    /**
     * Collapses {@code .} and {@code ..} segments of a slash-separated relative path.
     *
     * @param path slash-separated path
     * @return normalized path, or {@code null} when {@code ..} climbs above the starting point
     */
    public static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    /**
     * Gets the directory part of a slash-separated path.
     *
     * @param path slash-separated path
     * @return parent directory, empty string at the top level
     */
    public static String parentOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "" : path.substring(0, slash);
    }

    /**
     * Gets the file name of a slash-separated path.
     *
     * @param path slash-separated path
     * @return last segment
     */
    public static String fileNameOf(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    private static boolean isHiddenBelow(Path root, Path path) {
        for (Path part : root.relativize(path)) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
