package com.docaudit.core.source;

import com.docaudit.core.model.SourceDocument;

import java.util.List;

/**
 * Supplies the raw documents of an audit.
 *
 * <p>Implementations must return documents sorted by path and every path relative to the
 * base directory with {@code /} separators.</p>
 */
public interface DocumentSource {

    /**
     * Loads every document covered by the scope.
     *
     * @param scope corpus, directory or single file
     * @return documents sorted by path, possibly empty
     * @throws DocumentSourceException if the scope target is missing or unreadable
     */
    List<SourceDocument> load(SourceScope scope);

    /**
     * Whether a file exists at a path relative to the base directory.
     * Used to accept references to non-Markdown assets.
     *
     * @param relativePath slash-separated path
     * @return true if a regular file exists there
     */
    boolean exists(String relativePath);
}
