package com.docaudit.core.renderer;

import com.docaudit.core.generator.GeneratedReport;

import java.util.List;
import java.util.Objects;

/**
 * Everything produced by one run, ready to be rendered.
 *
 * @param reports generated report files
 */
public record GeneratedOutput(List<GeneratedReport> reports) {
    public GeneratedOutput {
        reports = List.copyOf(Objects.requireNonNull(reports, "reports must not be null"));
    }

    public boolean isEmpty() {
        return reports.isEmpty();
    }
}
