package com.docaudit.core.history;

import com.docaudit.core.model.HistoryRow;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only CSV store of per-run metrics.
 *
 * <p>Rows are never rewritten. A missing or empty file gets the header first; each append is a
 * single write call.</p>
 */
public class HistoryTracker {

    private static final Logger log = LoggerFactory.getLogger(HistoryTracker.class);

    public static final String DEFAULT_FILE_NAME = "documentation_metrics_history.csv";

    private final Path historyFile;
    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    public HistoryTracker(Path historyFile) {
        this.historyFile = Objects.requireNonNull(historyFile, "historyFile must not be null");
        this.csvMapper = new CsvMapper();
        this.schema = csvMapper.schemaFor(HistoryCsvRow.class);
    }

    public Path getHistoryFile() {
        return historyFile;
    }

    /**
     * Appends one row, writing the header first when the file is missing or empty.
     *
     * @param row metrics of a completed run
     * @throws IOException if the store cannot be written
     */
    public void append(HistoryRow row) throws IOException {
        boolean hasHeader = Files.exists(historyFile) && Files.size(historyFile) > 0;
        CsvSchema rowSchema = hasHeader ? schema.withoutHeader() : schema.withHeader();
        String text = csvMapper.writer(rowSchema).writeValueAsString(HistoryCsvRow.of(row));

        Path parent = historyFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(historyFile, text.getBytes(StandardCharsets.UTF_8),
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        log.debug("Appended history row for {} to {}", row.date(), historyFile);
    }

    /**
     * Reads every row in file order. Rows that cannot be parsed are skipped with a warning.
     *
     * @return history rows, empty when the store does not exist
     * @throws IOException if the store cannot be read
     */
    public List<HistoryRow> readAll() throws IOException {
        if (!Files.exists(historyFile)) {
            return List.of();
        }
        List<HistoryRow> rows = new ArrayList<>();
        try (MappingIterator<HistoryCsvRow> iterator = csvMapper.readerFor(HistoryCsvRow.class)
                .with(schema.withHeader())
                .readValues(historyFile.toFile())) {
            while (iterator.hasNextValue()) {
                HistoryCsvRow row = iterator.nextValue();
                try {
                    rows.add(row.toHistoryRow());
                } catch (DateTimeParseException e) {
                    log.warn("Skipping history row with invalid date '{}'", row.date());
                }
            }
        }
        return rows;
    }
}
