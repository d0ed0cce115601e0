package com.docaudit.core.analysis;

import java.time.Duration;

/**
 * Thrown when per-document analysis does not finish before the deadline.
 * Nothing has been written when this is raised.
 */
public class AuditTimeoutException extends RuntimeException {

    private final Duration timeout;

    public AuditTimeoutException(Duration timeout, int unfinished) {
        super("Analysis did not finish within " + timeout.toSeconds() + "s (" + unfinished + " documents pending)");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
