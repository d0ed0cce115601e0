package com.docaudit.core.fix;

import com.docaudit.core.model.BrokenReference;

import java.util.Objects;
import java.util.Optional;

/**
 * Proposed replacement for a broken reference.
 *
 * @param broken the broken reference
 * @param replacement new reference, {@code null} when no document matches
 */
public record LinkFixSuggestion(BrokenReference broken, String replacement) {
    public LinkFixSuggestion {
        Objects.requireNonNull(broken, "broken must not be null");
    }

    public Optional<String> suggestion() {
        return Optional.ofNullable(replacement);
    }

    public boolean hasSuggestion() {
        return replacement != null;
    }

    public String sourcePath() {
        return broken.sourcePath();
    }

    public String reference() {
        return broken.reference();
    }
}
