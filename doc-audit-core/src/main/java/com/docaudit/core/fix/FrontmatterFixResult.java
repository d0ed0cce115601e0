package com.docaudit.core.fix;

import java.util.List;

/**
 * Outcome of applying front-matter fixes.
 *
 * @param applied suggestions written to disk
 * @param modifiedFiles documents rewritten, one write each
 */
public record FrontmatterFixResult(List<FrontmatterFixSuggestion> applied, List<String> modifiedFiles) {
    public FrontmatterFixResult {
        applied = List.copyOf(applied);
        modifiedFiles = List.copyOf(modifiedFiles);
    }
}
