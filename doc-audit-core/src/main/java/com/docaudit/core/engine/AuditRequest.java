package com.docaudit.core.engine;

import com.docaudit.core.source.SourceScope;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Parameters of one audit run.
 *
 * @param scope what to audit
 * @param lintingIssues externally supplied lint issue count
 * @param timeout deadline for the analysis stage
 * @param historyFile history store to append to, {@code null} to skip recording
 */
public record AuditRequest(SourceScope scope, int lintingIssues, Duration timeout, Path historyFile) {
    public AuditRequest {
        Objects.requireNonNull(scope, "scope must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (lintingIssues < 0) {
            throw new IllegalArgumentException("lintingIssues must be >= 0");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }
}
