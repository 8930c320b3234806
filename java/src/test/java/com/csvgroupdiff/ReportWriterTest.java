package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportWriterTest {

    @TempDir
    Path tempDir;

    private ComparisonReport report;

    @BeforeEach
    void compareFixtures() throws IOException {
        Path fileA = TestDatasets.fixture("file_a.csv");
        Path fileB = TestDatasets.fixture("file_b.csv");
        CsvDatasetReader reader = new CsvDatasetReader();
        Dataset a = reader.read(fileA);
        Dataset b = reader.read(fileB);
        ComparisonResult result = new DatasetComparator().compareDatasets(a, b);
        report = new ComparisonReport(
                new ComparisonReport.InputInfo(fileA.toString(), Blake3Hasher.hashFile(fileA),
                        DatasetSummary.of(a, "history")),
                new ComparisonReport.InputInfo(fileB.toString(), Blake3Hasher.hashFile(fileB),
                        DatasetSummary.of(b, "history")),
                result);
    }

    private static List<CSVRecord> readCsv(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file);
                CSVParser parser = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build()
                        .parse(in)) {
            return parser.getRecords();
        }
    }

    @Test
    void writeAll_producesEveryReportWithContent() throws IOException {
        Path out = tempDir.resolve("reports");

        List<Path> written = new ReportWriter().writeAll(report, out, null);

        assertEquals(List.of(
                out.resolve(ReportWriter.CELL_CHANGES_FILE),
                out.resolve(ReportWriter.COMBINATION_SUMMARY_FILE),
                out.resolve(ReportWriter.UNMATCHED_FILE),
                out.resolve(ReportWriter.OVERALL_SUMMARY_FILE),
                out.resolve(ReportWriter.JSON_FILE)), written);
        for (Path path : written) {
            assertTrue(Files.exists(path), path.toString());
        }
    }

    @Test
    void cellChanges_listOneRowPerChangedCell() throws IOException {
        Path file = new ReportWriter().writeCellChanges(report.result(), tempDir.resolve("cells.csv"));

        List<CSVRecord> records = readCsv(file);
        assertEquals(1, records.size());
        CSVRecord record = records.get(0);
        assertEquals("1", record.get("dataset_id"));
        assertEquals("Spring Launch", record.get("dataset_nm"));
        assertEquals("10", record.get("tactic_id"));
        assertEquals("history", record.get("recency_flag"));
        assertEquals("", record.get("Row_Index"));
        assertEquals("budget", record.get("Column"));
        assertEquals("100", record.get("File_A_Value"));
        assertEquals("150", record.get("File_B_Value"));
        assertEquals("Value Modified", record.get("Change_Type"));
    }

    @Test
    void unmatched_marksSideAndDirection() throws IOException {
        Path file = new ReportWriter().writeUnmatched(report.result(), tempDir.resolve("unmatched.csv"));

        List<CSVRecord> records = readCsv(file);
        assertEquals(2, records.size());
        assertEquals("11", records.get(0).get("tactic_id"));
        assertEquals("Promo Follow-up", records.get(0).get("tactic_nm"));
        assertEquals("only_in_file_a", records.get(0).get("status"));
        assertEquals("removed", records.get(0).get("change_type"));
        assertEquals("12", records.get(1).get("tactic_id"));
        assertEquals("only_in_file_b", records.get(1).get("status"));
        assertEquals("added", records.get(1).get("change_type"));
    }

    @Test
    void overallSummary_countsGroupsAndCarriesDigests() throws IOException {
        Path file = new ReportWriter().writeOverallSummary(report, tempDir.resolve("summary.csv"));

        Map<String, String> metrics = new LinkedHashMap<>();
        for (CSVRecord record : readCsv(file)) {
            metrics.put(record.get("Metric"), record.get("Count"));
        }
        assertEquals("3", metrics.get("Total Groups in File A"));
        assertEquals("3", metrics.get("Total Groups in File B"));
        assertEquals("1", metrics.get("Groups Only in File A"));
        assertEquals("1", metrics.get("Groups Only in File B"));
        assertEquals("1", metrics.get("Modified Groups"));
        assertEquals("1", metrics.get("Identical Groups"));
        assertEquals("1", metrics.get("Total Tactic+Recency Changes"));
        assertEquals("1", metrics.get("Total Cell Changes"));
        assertEquals("2", metrics.get("Total Unmatched Combinations"));
        assertEquals(report.fileA().blake3(), metrics.get("File A BLAKE3"));
        assertEquals(report.fileB().blake3(), metrics.get("File B BLAKE3"));
    }

    @Test
    void identicalInputs_skipEmptyReports() throws IOException {
        ComparisonResult same = new DatasetComparator().compareDatasets(
                new CsvDatasetReader().read(TestDatasets.fixture("file_a.csv")),
                new CsvDatasetReader().read(TestDatasets.fixture("file_a.csv")));
        ComparisonReport identical = new ComparisonReport(report.fileA(), report.fileA(), same);

        List<Path> written = new ReportWriter().writeAll(identical, tempDir, null);

        assertEquals(List.of(tempDir.resolve(ReportWriter.OVERALL_SUMMARY_FILE),
                tempDir.resolve(ReportWriter.JSON_FILE)), written);
        assertFalse(Files.exists(tempDir.resolve(ReportWriter.CELL_CHANGES_FILE)));
    }
}
