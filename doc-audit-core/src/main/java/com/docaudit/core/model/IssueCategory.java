package com.docaudit.core.model;

/**
 * Kinds of issues that can trigger a corpus-level recommendation, in reporting order.
 */
public enum IssueCategory {
    BROKEN_REFERENCES,
    FRONTMATTER,
    LOW_QUALITY,
    COMPLEX_READABILITY,
    ORPHANS,
    LINTING
}
