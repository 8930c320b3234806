package com.csvgroupdiff;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

import lombok.extern.java.Log;
import me.tongfei.progressbar.ProgressBar;

/**
 * Reads a headed CSV file into a {@link Dataset}.
 * <p>
 * Fields matching one of the NA tokens become missing. A column whose every
 * remaining field is a number is read as numbers; any other column stays text.
 */
@Log
public class CsvDatasetReader {
    private static final char BOM = '\uFEFF';

    private final Set<String> naValues;

    public CsvDatasetReader() {
        this(DiffProfile.DEFAULT_NA_VALUES);
    }

    public CsvDatasetReader(Collection<String> naValues) {
        this.naValues = Set.copyOf(naValues);
    }

    public Dataset read(Path file) throws IOException {
        return read(file, null);
    }

    public Dataset read(Path file, ProgressBar progressBar) throws IOException {
        if (!Files.exists(file)) {
            throw new FileNotFoundException("CSV file not found: " + file);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            Dataset dataset = read(reader, file.toString(), progressBar);
            log.info(() -> "Read " + dataset.size() + " rows, " + dataset.columns().size() + " columns from " + file);
            return dataset;
        }
    }

    public Dataset read(Reader reader, String source, ProgressBar progressBar) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.DISALLOW)
                .setAllowMissingColumnNames(false)
                .setIgnoreEmptyLines(true)
                .build();

        List<String> columns;
        List<String[]> fields = new ArrayList<>();
        try (CSVParser parser = format.parse(reader)) {
            columns = new ArrayList<>(parser.getHeaderNames());
            if (columns.isEmpty()) {
                throw new IOException("No header row in " + source);
            }
            if (columns.get(0).indexOf(BOM) == 0) {
                columns.set(0, columns.get(0).substring(1));
            }

            for (CSVRecord record : parser) {
                String[] values = new String[columns.size()];
                for (int i = 0; i < columns.size(); i++) {
                    String value = i < record.size() ? record.get(i) : null;
                    values[i] = value == null || naValues.contains(value) ? null : value;
                }
                if (record.size() > columns.size()) {
                    log.fine("Record " + record.getRecordNumber() + " of " + source + " has "
                            + record.size() + " fields, extra fields ignored");
                }
                fields.add(values);
                if (progressBar != null) {
                    progressBar.stepTo(Math.min(record.getCharacterPosition(), progressBar.getMax()));
                }
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid CSV header in " + source + ": " + e.getMessage(), e);
        } catch (UncheckedIOException e) {
            throw new IOException("Malformed CSV in " + source + ": " + e.getCause().getMessage(), e.getCause());
        }

        boolean[] numeric = inferNumericColumns(columns.size(), fields);
        List<Row> rows = new ArrayList<>(fields.size());
        for (String[] values : fields) {
            Map<String, CellValue> cells = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                String value = values[i];
                if (value == null) {
                    cells.put(columns.get(i), CellValue.missing());
                } else {
                    cells.put(columns.get(i), numeric[i] ? CellValue.number(value) : CellValue.of(value));
                }
            }
            rows.add(new Row(cells));
        }
        return new Dataset(columns, rows);
    }

    // A column with no values at all stays text.
    private static boolean[] inferNumericColumns(int columnCount, List<String[]> fields) {
        boolean[] numeric = new boolean[columnCount];
        boolean[] seen = new boolean[columnCount];
        Arrays.fill(numeric, true);
        for (String[] values : fields) {
            for (int i = 0; i < columnCount; i++) {
                if (values[i] == null || !numeric[i]) {
                    continue;
                }
                seen[i] = true;
                if (!CellValue.isNumeric(values[i])) {
                    numeric[i] = false;
                }
            }
        }
        for (int i = 0; i < columnCount; i++) {
            numeric[i] = numeric[i] && seen[i];
        }
        return numeric;
    }
}
