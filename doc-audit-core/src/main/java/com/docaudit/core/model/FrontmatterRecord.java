package com.docaudit.core.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Typed view of a document's front-matter block.
 *
 * <p>Typed fields are {@code null} (or empty for collections) when the field is missing or
 * malformed. Malformed fields are listed in {@link #malformedFields()} so they can be reported
 * without being trusted.</p>
 *
 * @param title document title, nullable
 * @param description one-line summary, nullable
 * @param category declared category, nullable when missing or not a known identifier
 * @param tags tags in declaration order, duplicates removed
 * @param related referenced document paths as written
 * @param lastUpdated date of last update, nullable
 * @param fields every declared key with its raw value ({@code String} or an unmodifiable {@code List<String>})
 * @param malformedFields keys whose value was present but could not be interpreted
 */
public record FrontmatterRecord(
    String title,
    String description,
    DocumentCategory category,
    Set<String> tags,
    List<String> related,
    LocalDate lastUpdated,
    Map<String, Object> fields,
    List<String> malformedFields
) {
    public FrontmatterRecord {
        tags = tags == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(tags));
        related = related == null ? List.of() : List.copyOf(related);
        fields = fields == null ? Map.of() : copyFields(fields);
        malformedFields = malformedFields == null ? List.of() : List.copyOf(malformedFields);
    }

    private static Map<String, Object> copyFields(Map<String, Object> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((key, value) -> copy.put(key, value instanceof List<?> list ? List.copyOf(list) : value));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Whether a field is declared with a non-blank, well-formed value.
     *
     * @param name front-matter key
     * @return true when the field can be relied upon
     */
    public boolean declares(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (malformedFields.contains(name) || !fields.containsKey(name)) {
            return false;
        }
        Object value = fields.get(name);
        if (value instanceof String text) {
            return !text.isBlank();
        }
        if (value instanceof List<?> list) {
            return !list.isEmpty();
        }
        return value != null;
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }

    public boolean hasDescription() {
        return description != null && !description.isBlank();
    }
}
