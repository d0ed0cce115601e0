package com.docaudit.core.model;

/**
 * Front-matter completeness of a single document.
 */
public enum FrontmatterStatus {
    /** No front-matter block at all */
    ABSENT,

    /** Block present, at least one required field missing or malformed */
    INCOMPLETE,

    /** Block present with every required field */
    COMPLETE
}
