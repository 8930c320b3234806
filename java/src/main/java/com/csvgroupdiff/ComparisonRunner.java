package com.csvgroupdiff;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import lombok.extern.java.Log;
import me.tongfei.progressbar.ProgressBar;

/**
 * Command line pipeline: read both files, check their columns, compare, print
 * the outcome and optionally write reports.
 */
@Log
public class ComparisonRunner {
    private final DiffProfile profile;
    private final boolean debug;
    private final boolean timing;
    private final Path timingJson;
    private final PrintStream console;
    private final ProgressBarFactory progressBars;

    public ComparisonRunner(DiffProfile profile, boolean debug, boolean timing, Path timingJson,
            PrintStream console) {
        this.profile = profile;
        this.debug = debug;
        this.timing = timing;
        this.timingJson = timingJson;
        this.console = console;
        this.progressBars = new ProgressBarFactory(debug);
    }

    public ComparisonReport run(Path fileA, Path fileB, Path outputDir) throws IOException, MissingColumnsException {
        if (!Files.exists(fileA)) {
            throw new FileNotFoundException("File A not found: " + fileA);
        }
        if (!Files.exists(fileB)) {
            throw new FileNotFoundException("File B not found: " + fileB);
        }

        console.println("Step 1: Reading input files...");
        long start = System.nanoTime();
        CsvDatasetReader reader = new CsvDatasetReader(profile.na_values());
        Dataset datasetA;
        Dataset datasetB;
        try (ProgressBar pb = progressBars.create("Reading File A", Files.size(fileA), " bytes")) {
            datasetA = reader.read(fileA, pb);
        }
        try (ProgressBar pb = progressBars.create("Reading File B", Files.size(fileB), " bytes")) {
            datasetB = reader.read(fileB, pb);
        }
        String digestA = Blake3Hasher.hashFile(fileA);
        String digestB = Blake3Hasher.hashFile(fileB);
        long readMs = (System.nanoTime() - start) / 1_000_000L;

        console.println("Step 2: Validating required columns...");
        DatasetValidator.requireColumns("File A", datasetA, profile.required_columns());
        DatasetValidator.requireColumns("File B", datasetB, profile.required_columns());
        console.println("Files loaded successfully");

        console.println("Step 3: Comparing history rows by dataset_id groups...");
        start = System.nanoTime();
        ComparisonResult result;
        try (ProgressBar pb = progressBars.create("Comparing groups", -1)) {
            result = new DatasetComparator(profile).compareDatasets(datasetA, datasetB, new ComparisonListener() {
                @Override
                public void groupsFound(int commonGroups) {
                    pb.maxHint(commonGroups);
                }

                @Override
                public void groupCompared(CellValue datasetId, boolean changed) {
                    pb.step();
                }
            });
        }
        long compareMs = (System.nanoTime() - start) / 1_000_000L;

        ComparisonReport report = new ComparisonReport(
                new ComparisonReport.InputInfo(fileA.toString(), digestA,
                        DatasetSummary.of(datasetA, profile.history_flag())),
                new ComparisonReport.InputInfo(fileB.toString(), digestB,
                        DatasetSummary.of(datasetB, profile.history_flag())),
                result);

        console.println();
        new ConsoleRenderer(console).render(report);

        long writeMs = 0;
        if (outputDir != null) {
            console.println();
            console.println("Step 4: Writing reports to " + outputDir + "...");
            start = System.nanoTime();
            List<Path> written;
            try (ProgressBar pb = progressBars.create("Writing reports", ReportWriter.MAX_FILES)) {
                written = new ReportWriter().writeAll(report, outputDir, pb);
            }
            writeMs = (System.nanoTime() - start) / 1_000_000L;
            for (Path path : written) {
                console.println("  " + path);
            }
        }

        RunTiming runTiming = RunTiming.of(readMs, compareMs, writeMs);
        log.fine(() -> "Timing: " + runTiming);
        if (timing || debug) {
            console.printf("%nTiming: read %dms, compare %dms, write %dms, total %dms%n",
                    runTiming.readMs(), runTiming.compareMs(), runTiming.writeMs(), runTiming.totalMs());
        }
        if (timingJson != null) {
            ResultJson.write(runTiming, timingJson);
            log.info("Wrote timing report " + timingJson);
        }
        return report;
    }
}
