package com.docaudit.cli;

import com.docaudit.core.analysis.AuditTimeoutException;
import com.docaudit.core.source.DocumentSourceException;
import org.slf4j.Logger;

/**
 * Process exit codes shared by all commands.
 */
public final class ExitCodes {

    /** Run completed, no gate failed */
    public static final int OK = 0;

    /** Run completed, but a gate failed (broken links, incomplete front-matter, CI threshold) */
    public static final int GATE_FAILED = 1;

    /** Invalid input: missing file or directory, bad flag value */
    public static final int INPUT_ERROR = 2;

    /** Analysis deadline expired */
    public static final int TIMEOUT = 3;

    /** Unexpected failure, e.g. a report or history file could not be written */
    public static final int INTERNAL_ERROR = 4;

    private ExitCodes() {
        // Utility class
    }

    /**
     * Reports a failed command and maps the failure to an exit code.
     *
     * @param log logger of the failing command
     * @param action what was being done, e.g. "Audit"
     * @param e the failure
     * @return exit code for the failure
     */
    public static int fail(Logger log, String action, Exception e) {
        int code;
        if (e instanceof DocumentSourceException) {
            log.error("{} failed: {}", action, e.getMessage());
            code = INPUT_ERROR;
        } else if (e instanceof AuditTimeoutException) {
            log.error("{} timed out: {}", action, e.getMessage());
            code = TIMEOUT;
        } else {
            log.error("{} failed", action, e);
            code = INTERNAL_ERROR;
        }
        System.err.println("✗ " + action + " failed: " + e.getMessage());
        return code;
    }
}
