package com.docaudit.core.fix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Front-matter fields that can be filled in for one document.
 *
 * @param path document path relative to the base directory
 * @param createsBlock true when the document has no front-matter block yet
 * @param additions field name to derived value, in required-field order
 * @param manualFields missing fields that cannot be derived and are left to the author
 */
public record FrontmatterFixSuggestion(
    String path,
    boolean createsBlock,
    Map<String, String> additions,
    List<String> manualFields
) {
    public FrontmatterFixSuggestion {
        Objects.requireNonNull(path, "path must not be null");
        additions = additions == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(additions));
        manualFields = manualFields == null ? List.of() : List.copyOf(manualFields);
    }

    public boolean hasAdditions() {
        return !additions.isEmpty();
    }
}
