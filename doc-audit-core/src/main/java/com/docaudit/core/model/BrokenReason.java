package com.docaudit.core.model;

/**
 * Why an internal reference is broken.
 */
public enum BrokenReason {
    /** The reference resolved to a path, but nothing exists there */
    MISSING_TARGET,

    /** The reference could not be resolved, e.g. it climbs above the base directory */
    UNRESOLVABLE
}
