package com.docaudit.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Shared line patterns for the Markdown heuristics.
 */
public final class MarkdownPatterns {

    public static final Pattern TOP_LEVEL_HEADING = Pattern.compile("^# \\S.*");
    public static final Pattern SUBSECTION_HEADING = Pattern.compile("^## \\S.*");
    public static final Pattern RELATED_DOCUMENTS_HEADING = Pattern.compile("^## Related Documents\\s*$");
    public static final Pattern FENCE = Pattern.compile("^\\s{0,3}(```|~~~)(.*)$");

    /**
     * Inline link {@code [text](target "title")}; group 1 is the text, group 2 the target.
     * Images are filtered by the caller.
     */
    public static final Pattern INLINE_LINK =
        Pattern.compile("\\[([^\\]]*)\\]\\(\\s*<?([^)\\s>]+)>?(?:\\s+\"[^\"]*\")?\\s*\\)");

    private static final Pattern INLINE_CODE = Pattern.compile("`[^`]*`");

    private MarkdownPatterns() {
        // Utility class
    }

    /**
     * A body line tagged with whether it lies inside a fenced code block.
     *
     * @param number 1-based line number within the body
     * @param text line content
     * @param code true for fence lines and lines between fences
     */
    public record BodyLine(int number, String text, boolean code) {
    }

    /**
     * Splits a body into lines and marks fenced code. An unclosed fence runs to the end.
     *
     * @param body Markdown body
     * @return tagged lines
     */
    public static List<BodyLine> lines(String body) {
        List<BodyLine> lines = new ArrayList<>();
        boolean inFence = false;
        String[] raw = body.split("\\r?\\n", -1);
        for (int i = 0; i < raw.length; i++) {
            boolean fence = FENCE.matcher(raw[i]).matches();
            if (fence) {
                lines.add(new BodyLine(i + 1, raw[i], true));
                inFence = !inFence;
            } else {
                lines.add(new BodyLine(i + 1, raw[i], inFence));
            }
        }
        return lines;
    }

    /**
     * Removes inline code spans so their content is not mistaken for links.
     *
     * @param line a prose line
     * @return line without code spans
     */
    public static String stripInlineCode(String line) {
        return INLINE_CODE.matcher(line).replaceAll("");
    }

    /**
     * Strips a {@code #fragment} and {@code ?query} suffix from a reference.
     *
     * @param reference raw reference
     * @return path part only
     */
    public static String stripFragment(String reference) {
        int cut = reference.length();
        int hash = reference.indexOf('#');
        if (hash >= 0) {
            cut = hash;
        }
        int query = reference.indexOf('?');
        if (query >= 0 && query < cut) {
            cut = query;
        }
        return reference.substring(0, cut);
    }

    /**
     * Whether a reference points at a Markdown file once fragment and query are stripped.
     *
     * @param reference raw reference
     * @return true for {@code .md} targets
     */
    public static boolean isMarkdownTarget(String reference) {
        return stripFragment(reference).toLowerCase(Locale.ROOT).endsWith(FileUtils.MARKDOWN_EXTENSION);
    }
}
