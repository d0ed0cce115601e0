package com.docaudit.core.config;

import com.docaudit.core.analysis.FrontmatterValidator;
import com.docaudit.core.analysis.LinkResolver;
import com.docaudit.core.history.HistoryTracker;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration, loaded from {@code docaudit.yaml} in the base directory.
 *
 * <p>Every section and value is optional; missing ones take their defaults.</p>
 *
 * <p><b>Example YAML:</b></p>
 * <pre>{@code
 * corpus:
 *   root: docs
 *   recursive: true
 *
 * analysis:
 *   workers: 4
 *   timeoutSeconds: 120
 *   requiredFrontmatter: [title, description, category]
 *   includeReadability: true
 *
 * report:
 *   directory: target/reports/docs_validation
 *   formats: [markdown, csv, dot]
 *   ciThreshold: 70
 *
 * history:
 *   enabled: true
 *   file: documentation_metrics_history.csv
 * }</pre>
 *
 * @param corpus where the documents live
 * @param analysis analysis tuning
 * @param report report output
 * @param history metrics history
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuditConfig(
    @JsonProperty("corpus") CorpusSettings corpus,
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("report") ReportSettings report,
    @JsonProperty("history") HistorySettings history
) {
    public static final String DEFAULT_FILE_NAME = "docaudit.yaml";

    public AuditConfig {
        corpus = corpus == null ? CorpusSettings.defaults() : corpus;
        analysis = analysis == null ? AnalysisSettings.defaults() : analysis;
        report = report == null ? ReportSettings.defaults() : report;
        history = history == null ? HistorySettings.defaults() : history;
    }

    public static AuditConfig defaults() {
        return new AuditConfig(null, null, null, null);
    }

    /**
     * @param root corpus root relative to the base directory, also the segment of rooted references
     * @param recursive whether subdirectories are scanned
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CorpusSettings(
        @JsonProperty("root") String root,
        @JsonProperty("recursive") Boolean recursive
    ) {
        public CorpusSettings {
            root = root == null || root.isBlank() ? LinkResolver.DEFAULT_CORPUS_ROOT : root;
            recursive = recursive == null ? Boolean.TRUE : recursive;
        }

        public static CorpusSettings defaults() {
            return new CorpusSettings(null, null);
        }
    }

    /**
     * @param workers analysis threads, 0 for one per processor
     * @param timeoutSeconds deadline for the analysis stage
     * @param requiredFrontmatter fields every document must declare
     * @param includeReadability whether readability contributes to the report and score
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("workers") Integer workers,
        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
        @JsonProperty("requiredFrontmatter") List<String> requiredFrontmatter,
        @JsonProperty("includeReadability") Boolean includeReadability
    ) {
        public static final int DEFAULT_TIMEOUT_SECONDS = 300;

        public AnalysisSettings {
            workers = workers == null || workers < 0 ? 0 : workers;
            timeoutSeconds = timeoutSeconds == null || timeoutSeconds <= 0 ? DEFAULT_TIMEOUT_SECONDS : timeoutSeconds;
            requiredFrontmatter = requiredFrontmatter == null
                ? FrontmatterValidator.DEFAULT_REQUIRED_FIELDS
                : List.copyOf(requiredFrontmatter);
            includeReadability = includeReadability == null ? Boolean.TRUE : includeReadability;
        }

        public static AnalysisSettings defaults() {
            return new AnalysisSettings(null, null, null, null);
        }
    }

    /**
     * @param directory report directory relative to the base directory
     * @param formats report formats to write
     * @param ciThreshold minimum health score for the CI gate
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReportSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("ciThreshold") Integer ciThreshold
    ) {
        public static final String DEFAULT_DIRECTORY = "target/reports/docs_validation";
        public static final int DEFAULT_CI_THRESHOLD = 70;

        public ReportSettings {
            directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
            formats = formats == null || formats.isEmpty() ? List.of("markdown") : List.copyOf(formats);
            ciThreshold = ciThreshold == null ? DEFAULT_CI_THRESHOLD : Math.max(0, Math.min(100, ciThreshold));
        }

        public static ReportSettings defaults() {
            return new ReportSettings(null, null, null);
        }
    }

    /**
     * @param enabled whether runs are recorded
     * @param file history file name, relative to the report directory
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HistorySettings(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("file") String file
    ) {
        public HistorySettings {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            file = file == null || file.isBlank() ? HistoryTracker.DEFAULT_FILE_NAME : file;
        }

        public static HistorySettings defaults() {
            return new HistorySettings(null, null);
        }
    }
}
