package com.docaudit.core.model;

/**
 * How a reference string is interpreted before it is resolved to a path.
 */
public enum LinkClassification {
    /** Plain relative path, e.g. {@code guides/setup.md} or {@code ../reference/api.md} */
    RELATIVE,

    /** Path starting with {@code ./}; {@code ../} paths are {@link #RELATIVE} */
    DOT_RELATIVE,

    /** Path starting with {@code /}, anchored at the corpus root */
    ROOTED,

    /** URL with a scheme such as {@code https:} or {@code mailto:} */
    EXTERNAL,

    /** In-page anchor such as {@code #installation} */
    ANCHOR_ONLY;

    /**
     * Whether references of this kind point at a file inside the corpus.
     *
     * @return true for relative, dot-relative and rooted references
     */
    public boolean isInternal() {
        return this == RELATIVE || this == DOT_RELATIVE || this == ROOTED;
    }
}
