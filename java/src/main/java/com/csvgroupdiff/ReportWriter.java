package com.csvgroupdiff;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import lombok.extern.java.Log;
import me.tongfei.progressbar.ProgressBar;

/**
 * Flattens a {@link ComparisonReport} into CSV files for download.
 * Missing values are written as empty fields.
 */
@Log
public class ReportWriter {
    public static final String CELL_CHANGES_FILE = "detailed_cell_changes_report.csv";
    public static final String COMBINATION_SUMMARY_FILE = "tactic_recency_summary.csv";
    public static final String UNMATCHED_FILE = "unmatched_combinations_report.csv";
    public static final String OVERALL_SUMMARY_FILE = "overall_comparison_summary.csv";
    public static final String JSON_FILE = "comparison_result.json";

    /** Number of files {@link #writeAll} may produce, for progress reporting. */
    public static final int MAX_FILES = 5;

    private static final String[] CELL_CHANGE_HEADER = {
            "dataset_id", "dataset_nm", "tactic_id", "tactic_nm", "channel_nm", "recency_flag",
            "Row_Index", "Column", "File_A_Value", "File_B_Value", "Change_Type" };
    private static final String[] COMBINATION_HEADER = {
            "dataset_id", "dataset_nm", "tactic_id", "tactic_nm", "channel_nm", "recency_flag",
            "change_type", "cell_changes_count" };
    private static final String[] UNMATCHED_HEADER = {
            "dataset_id", "dataset_nm", "tactic_id", "tactic_nm", "channel_nm", "recency_flag",
            "status", "change_type" };
    private static final String[] OVERALL_HEADER = { "Metric", "Count" };

    /**
     * Writes every report that has content into {@code outputDir}, creating it when needed.
     * The overall summary and the JSON result are always written.
     */
    public List<Path> writeAll(ComparisonReport report, Path outputDir, ProgressBar progressBar) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        ComparisonResult result = report.result();

        if (result.totalCellChanges() > 0) {
            written.add(writeCellChanges(result, outputDir.resolve(CELL_CHANGES_FILE)));
        }
        step(progressBar);
        if (result.totalCombinationChanges() > 0) {
            written.add(writeCombinationSummary(result, outputDir.resolve(COMBINATION_SUMMARY_FILE)));
        }
        step(progressBar);
        if (result.totalUnmatchedCombinations() > 0) {
            written.add(writeUnmatched(result, outputDir.resolve(UNMATCHED_FILE)));
        }
        step(progressBar);
        written.add(writeOverallSummary(report, outputDir.resolve(OVERALL_SUMMARY_FILE)));
        step(progressBar);
        Path json = outputDir.resolve(JSON_FILE);
        ResultJson.write(report, json);
        written.add(json);
        step(progressBar);

        for (Path path : written) {
            log.info("Wrote report " + path);
        }
        return written;
    }

    public Path writeCellChanges(ComparisonResult result, Path file) throws IOException {
        try (CSVPrinter printer = open(file, CELL_CHANGE_HEADER)) {
            for (GroupChange group : result.modifiedGroups().values()) {
                for (Map.Entry<CombinationKey, CombinationChange> entry : group.combinationChanges().entrySet()) {
                    CombinationChange combo = entry.getValue();
                    for (CellChange change : combo.cellChanges()) {
                        printer.printRecord(
                                cell(group.datasetId()),
                                cell(combo.datasetNm()),
                                cell(change.tacticId()),
                                cell(combo.tacticNm()),
                                cell(combo.channelNm()),
                                cell(change.recencyFlag()),
                                change.rowIndex() == null ? "" : change.rowIndex().toString(),
                                change.column(),
                                cell(change.fileAValue()),
                                cell(change.fileBValue()),
                                change.changeType().label());
                    }
                }
            }
        }
        return file;
    }

    public Path writeCombinationSummary(ComparisonResult result, Path file) throws IOException {
        try (CSVPrinter printer = open(file, COMBINATION_HEADER)) {
            for (GroupChange group : result.modifiedGroups().values()) {
                for (Map.Entry<CombinationKey, CombinationChange> entry : group.combinationChanges().entrySet()) {
                    CombinationKey key = entry.getKey();
                    CombinationChange combo = entry.getValue();
                    printer.printRecord(
                            cell(group.datasetId()),
                            cell(combo.datasetNm()),
                            cell(key.tacticId()),
                            cell(combo.tacticNm()),
                            cell(combo.channelNm()),
                            cell(key.recencyFlag()),
                            "modified",
                            combo.cellChanges().size());
                }
            }
        }
        return file;
    }

    public Path writeUnmatched(ComparisonResult result, Path file) throws IOException {
        try (CSVPrinter printer = open(file, UNMATCHED_HEADER)) {
            for (GroupChange group : result.modifiedGroups().values()) {
                for (UnmatchedCombination combo : group.unmatchedInA()) {
                    printUnmatched(printer, combo, "only_in_file_a", "removed");
                }
                for (UnmatchedCombination combo : group.unmatchedInB()) {
                    printUnmatched(printer, combo, "only_in_file_b", "added");
                }
            }
        }
        return file;
    }

    public Path writeOverallSummary(ComparisonReport report, Path file) throws IOException {
        ComparisonResult result = report.result();
        try (CSVPrinter printer = open(file, OVERALL_HEADER)) {
            printer.printRecord("Total Groups in File A", report.fileA().summary().distinctDatasetIds());
            printer.printRecord("Total Groups in File B", report.fileB().summary().distinctDatasetIds());
            printer.printRecord("Groups Only in File A", result.groupsOnlyInA().size());
            printer.printRecord("Groups Only in File B", result.groupsOnlyInB().size());
            printer.printRecord("Modified Groups", result.modifiedGroups().size());
            printer.printRecord("Identical Groups", result.identicalGroups().size());
            printer.printRecord("Total Tactic+Recency Changes", result.totalCombinationChanges());
            printer.printRecord("Total Cell Changes", result.totalCellChanges());
            printer.printRecord("Total Unmatched Combinations", result.totalUnmatchedCombinations());
            printer.printRecord("File A BLAKE3", report.fileA().blake3());
            printer.printRecord("File B BLAKE3", report.fileB().blake3());
        }
        return file;
    }

    private static void printUnmatched(CSVPrinter printer, UnmatchedCombination combo, String status,
            String changeType) throws IOException {
        printer.printRecord(
                cell(combo.datasetId()),
                cell(combo.datasetNm()),
                cell(combo.tacticId()),
                cell(combo.tacticNm()),
                cell(combo.channelNm()),
                cell(combo.recencyFlag()),
                status,
                changeType);
    }

    private static CSVPrinter open(Path file, String[] header) throws IOException {
        Writer out = Files.newBufferedWriter(file);
        return new CSVPrinter(out, CSVFormat.DEFAULT.builder().setHeader(header).build());
    }

    private static String cell(CellValue value) {
        return value == null ? "" : value.display();
    }

    private static void step(ProgressBar progressBar) {
        if (progressBar != null) {
            progressBar.step();
        }
    }
}
