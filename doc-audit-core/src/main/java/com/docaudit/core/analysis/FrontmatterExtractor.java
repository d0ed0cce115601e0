package com.docaudit.core.analysis;

import com.docaudit.core.model.DocumentCategory;
import com.docaudit.core.model.FrontmatterRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a document into its front-matter block and body and types the well-known fields.
 *
 * <p>A block is recognized only when the very first line is {@code ---} and a later line is
 * {@code ---} again. Fields are read line by line as {@code key: value}; lists may be written
 * inline ({@code [a, b]}) or as indented {@code - item} lines. A field that cannot be
 * interpreted is recorded as malformed and left out of the typed view; the rest of the block
 * is still used.</p>
 */
public class FrontmatterExtractor {

    private static final Logger log = LoggerFactory.getLogger(FrontmatterExtractor.class);

    public static final String DELIMITER = "---";

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String CATEGORY = "category";
    public static final String TAGS = "tags";
    public static final String RELATED = "related";
    public static final String LAST_UPDATED = "last_updated";

    private static final Pattern FIELD = Pattern.compile("^([A-Za-z_][\\w-]*)\\s*:\\s*(.*?)\\s*$");
    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*-\\s*(.*?)\\s*$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH)
    );

    public FrontmatterExtraction extract(byte[] content) {
        return extract(new String(content, StandardCharsets.UTF_8));
    }

    /**
     * Extracts the front-matter block of a document.
     *
     * @param content full document text
     * @return block and body; the block is absent when delimiters are missing
     */
    public FrontmatterExtraction extract(String content) {
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        String[] lines = text.split("\\r?\\n", -1);

        if (lines.length == 0 || !lines[0].stripTrailing().equals(DELIMITER)) {
            return new FrontmatterExtraction(null, text, 1);
        }
        int closing = -1;
        for (int i = 1; i < lines.length; i++) {
            if (lines[i].stripTrailing().equals(DELIMITER)) {
                closing = i;
                break;
            }
        }
        if (closing < 0) {
            log.debug("Front-matter opened but never closed, treating document as having none");
            return new FrontmatterExtraction(null, text, 1);
        }

        List<String> blockLines = List.of(lines).subList(1, closing);
        String body = String.join("\n", List.of(lines).subList(closing + 1, lines.length));
        return new FrontmatterExtraction(parse(blockLines), body, closing + 2);
    }

    private FrontmatterRecord parse(List<String> blockLines) {
        Map<String, Object> fields = new LinkedHashMap<>();
        List<String> malformed = new ArrayList<>();

        String listKey = null;
        for (String line : blockLines) {
            if (line.isBlank() || line.stripLeading().startsWith("#")) {
                continue;
            }
            Matcher item = LIST_ITEM.matcher(line);
            if (listKey != null && item.matches()) {
                appendItem(fields, listKey, unquote(item.group(1)));
                continue;
            }
            Matcher field = FIELD.matcher(line);
            if (!field.matches()) {
                log.debug("Ignoring unrecognized front-matter line: {}", line);
                listKey = null;
                continue;
            }
            String key = field.group(1);
            String value = field.group(2);
            if (value.isEmpty()) {
                fields.put(key, new ArrayList<String>());
                listKey = key;
            } else if (value.startsWith("[")) {
                listKey = null;
                if (!value.endsWith("]")) {
                    malformed.add(key);
                    fields.put(key, value);
                } else {
                    fields.put(key, splitInline(value.substring(1, value.length() - 1)));
                }
            } else {
                listKey = null;
                fields.put(key, unquote(value));
            }
        }

        // A key with nothing after it and no items is an empty scalar.
        fields.replaceAll((key, value) -> value instanceof List<?> list && list.isEmpty() && !isListField(key) ? "" : value);

        String title = scalar(fields, TITLE, malformed);
        String description = scalar(fields, DESCRIPTION, malformed);
        DocumentCategory category = category(fields, malformed);
        List<String> tags = list(fields, TAGS, malformed);
        List<String> related = list(fields, RELATED, malformed);
        LocalDate lastUpdated = date(fields, malformed);

        return new FrontmatterRecord(title, description, category, new LinkedHashSet<>(tags), related,
            lastUpdated, fields, malformed);
    }

    private static boolean isListField(String key) {
        return TAGS.equals(key) || RELATED.equals(key);
    }

    @SuppressWarnings("unchecked")
    private static void appendItem(Map<String, Object> fields, String key, String item) {
        Object current = fields.get(key);
        if (current instanceof List<?> list && !item.isEmpty()) {
            ((List<String>) list).add(item);
        }
    }

    private static List<String> splitInline(String inner) {
        List<String> items = new ArrayList<>();
        for (String part : inner.split(",")) {
            String item = unquote(part.trim());
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return items;
    }

    private static String unquote(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2) {
            char first = trimmed.charAt(0);
            char last = trimmed.charAt(trimmed.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return trimmed.substring(1, trimmed.length() - 1);
            }
        }
        return trimmed;
    }

    private static String scalar(Map<String, Object> fields, String key, List<String> malformed) {
        Object value = fields.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text.isBlank() ? null : text;
        }
        markMalformed(malformed, key);
        return null;
    }

    private static DocumentCategory category(Map<String, Object> fields, List<String> malformed) {
        String value = scalar(fields, CATEGORY, malformed);
        if (value == null) {
            return null;
        }
        return DocumentCategory.fromId(value).orElseGet(() -> {
            log.debug("Unknown category '{}'", value);
            markMalformed(malformed, CATEGORY);
            return null;
        });
    }

    private static List<String> list(Map<String, Object> fields, String key, List<String> malformed) {
        Object value = fields.get(key);
        if (value == null || malformed.contains(key)) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        markMalformed(malformed, key);
        return List.of();
    }

    private static LocalDate date(Map<String, Object> fields, List<String> malformed) {
        String value = scalar(fields, LAST_UPDATED, malformed);
        if (value == null) {
            return null;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", value, format);
            }
        }
        markMalformed(malformed, LAST_UPDATED);
        return null;
    }

    private static void markMalformed(List<String> malformed, String key) {
        if (!malformed.contains(key)) {
            malformed.add(key);
        }
    }
}
