package com.docaudit.core.model;

import java.util.Objects;

/**
 * An internal reference whose target does not exist.
 *
 * @param edge the offending edge
 * @param reason missing target or unresolvable path
 */
public record BrokenReference(ReferenceEdge edge, BrokenReason reason) {
    public BrokenReference {
        Objects.requireNonNull(edge, "edge must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }

    public String sourcePath() {
        return edge.sourcePath();
    }

    public String reference() {
        return edge.reference();
    }
}
