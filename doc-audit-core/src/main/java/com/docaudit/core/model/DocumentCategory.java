package com.docaudit.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of documentation categories accepted in front-matter.
 */
public enum DocumentCategory {
    GETTING_STARTED("getting-started"),
    GUIDE("guide"),
    REFERENCE("reference"),
    CONTRIBUTING("contributing"),
    ROADMAP("roadmap"),
    ARCHITECTURE("architecture"),
    EXAMPLE("example"),
    MISC("misc"),
    DOCUMENTATION("documentation");

    /** Bucket name used in distributions for documents without a usable category. */
    public static final String UNCATEGORIZED = "uncategorized";

    private final String id;

    DocumentCategory(String id) {
        this.id = id;
    }

    /**
     * Identifier as written in front-matter, e.g. {@code getting-started}.
     *
     * @return category identifier
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a category by its front-matter identifier, ignoring case and surrounding whitespace.
     *
     * @param value raw front-matter value
     * @return matching category, or empty when the value is not one of the known identifiers
     */
    public static Optional<DocumentCategory> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (DocumentCategory category : values()) {
            if (category.id.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
