package com.docaudit.core.model;

/**
 * Where in a document a reference was found.
 */
public enum ReferenceOrigin {
    /** Inline Markdown link in the body */
    BODY,

    /** Entry of the front-matter {@code related} list */
    RELATED
}
