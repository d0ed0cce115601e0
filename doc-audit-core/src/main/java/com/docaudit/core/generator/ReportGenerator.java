package com.docaudit.core.generator;

import com.docaudit.core.model.Report;

import java.time.format.DateTimeFormatter;

/**
 * Renders a {@link Report} into one file of a given format.
 *
 * <p>Implementations are discovered with {@link java.util.ServiceLoader} and must be stateless.</p>
 */
public interface ReportGenerator {

    /**
     * Unique generator identifier, the format id it produces.
     *
     * @return identifier such as {@code markdown}
     */
    String getId();

    String getDisplayName();

    ReportFormat getFormat();

    /**
     * Generates the report file.
     *
     * @param report report to render
     * @param config generation options
     * @return generated file
     */
    GeneratedReport generate(Report report, GeneratorConfig config);

    /**
     * Date-stamped file name for a report, e.g. {@code documentation_inventory_2024-05-01.csv}.
     *
     * @param report report being rendered
     * @return file name
     */
    default String fileNameFor(Report report) {
        ReportFormat format = getFormat();
        return format.filePrefix() + "_" + report.generatedAt().format(DateTimeFormatter.ISO_LOCAL_DATE)
            + "." + format.fileExtension();
    }
}
