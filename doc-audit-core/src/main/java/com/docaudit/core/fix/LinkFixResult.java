package com.docaudit.core.fix;

import java.util.List;

/**
 * Outcome of applying link fixes.
 *
 * @param applied suggestions written to disk
 * @param unmatched suggestions whose reference text could not be found in the file
 * @param modifiedFiles documents rewritten, one write each
 */
public record LinkFixResult(List<LinkFixSuggestion> applied, List<LinkFixSuggestion> unmatched, List<String> modifiedFiles) {
    public LinkFixResult {
        applied = List.copyOf(applied);
        unmatched = List.copyOf(unmatched);
        modifiedFiles = List.copyOf(modifiedFiles);
    }
}
