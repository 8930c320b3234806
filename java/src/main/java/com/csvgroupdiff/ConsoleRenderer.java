package com.csvgroupdiff;

import java.io.PrintStream;
import java.util.Collection;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Prints a human-readable account of a {@link ComparisonReport}.
 */
public class ConsoleRenderer {
    private static final String RULE = "=".repeat(60);

    private final PrintStream out;

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    public void render(ComparisonReport report) {
        ComparisonResult result = report.result();

        renderInput("File A", report.fileA());
        renderInput("File B", report.fileB());

        if (!result.validationMessages().isEmpty()) {
            out.println();
            out.println("Validation messages:");
            for (String message : result.validationMessages()) {
                out.println("  WARNING: " + message);
            }
        }

        out.println("\n" + RULE);
        out.println("SUMMARY (history rows only)");
        out.println(RULE);
        out.printf("Groups only in File A:         %,d%n", result.groupsOnlyInA().size());
        out.printf("Groups only in File B:         %,d%n", result.groupsOnlyInB().size());
        out.printf("Modified groups:               %,d%n", result.modifiedGroups().size());
        out.printf("Identical groups:              %,d%n", result.identicalGroups().size());
        out.printf("Tactic+recency changes:        %,d%n", result.totalCombinationChanges());
        out.printf("Cell changes:                  %,d%n", result.totalCellChanges());
        out.printf("Unmatched combinations:        %,d%n", result.totalUnmatchedCombinations());
        out.println(RULE);

        ColumnDifferences columns = result.columnDifferences();
        if (columns.hasDifferences()) {
            out.println();
            if (!columns.onlyInA().isEmpty()) {
                out.println("Columns only in File A: " + String.join(", ", columns.onlyInA()));
            }
            if (!columns.onlyInB().isEmpty()) {
                out.println("Columns only in File B: " + String.join(", ", columns.onlyInB()));
            }
        }

        if (!result.groupsOnlyInA().isEmpty()) {
            out.println();
            out.println("Groups only in File A (removed): " + ids(result.groupsOnlyInA()));
        }
        if (!result.groupsOnlyInB().isEmpty()) {
            out.println();
            out.println("Groups only in File B (added): " + ids(result.groupsOnlyInB()));
        }

        for (Map.Entry<CellValue, GroupChange> entry : result.modifiedGroups().entrySet()) {
            renderGroup(entry.getKey(), entry.getValue());
        }

        if (!result.identicalGroups().isEmpty()) {
            out.println();
            out.println("Dataset IDs with no changes: " + ids(result.identicalGroups()));
        }
    }

    private void renderInput(String label, ComparisonReport.InputInfo info) {
        DatasetSummary summary = info.summary();
        out.printf("%s: %s (%,d rows, %d columns)%n", label, info.path(), summary.rows(), summary.columns());
        out.printf("  Unique dataset_ids: %,d  Unique tactic_ids: %,d  History rows: %,d%n",
                summary.distinctDatasetIds(), summary.distinctTacticIds(), summary.historyRows());
        out.println("  Recency flags: " + summary.recencyFlags());
    }

    private void renderGroup(CellValue datasetId, GroupChange group) {
        out.println();
        out.println("-- Dataset ID: " + datasetId.display());
        out.printf("   File A: %d tactic+recency combination(s), File B: %d%n",
                group.combinationCountA(), group.combinationCountB());
        for (UnmatchedCombination combo : group.unmatchedInA()) {
            out.println("   Removed (only in File A): " + describe(combo));
        }
        for (UnmatchedCombination combo : group.unmatchedInB()) {
            out.println("   Added (only in File B):   " + describe(combo));
        }
        for (CombinationChange combo : group.combinationChanges().values()) {
            out.printf("   Modified: tactic %s (%s), recency %s, dataset %s, channel %s%n",
                    tacticLabel(combo.key().tacticId()), orNa(combo.tacticNm()),
                    combo.key().recencyFlag().display(), orNa(combo.datasetNm()), orNa(combo.channelNm()));
            for (CellChange change : combo.cellChanges()) {
                out.printf("      %s%s: %s -> %s [%s]%n",
                        change.rowIndex() == null ? "" : "row " + change.rowIndex() + " ",
                        change.column(), change.fileAValue().display(), change.fileBValue().display(),
                        change.changeType().label());
            }
        }
    }

    private static String describe(UnmatchedCombination combo) {
        return "tactic " + tacticLabel(combo.tacticId()) + " (" + orNa(combo.tacticNm()) + "), recency "
                + combo.recencyFlag().display() + ", dataset " + orNa(combo.datasetNm())
                + ", channel " + orNa(combo.channelNm());
    }

    private static String tacticLabel(CellValue tacticId) {
        return tacticId.isMissing() ? "NULL" : tacticId.display();
    }

    private static String orNa(CellValue value) {
        return value.isMissing() ? "N/A" : value.display();
    }

    private static String ids(Collection<CellValue> ids) {
        return ids.stream()
                .sorted()
                .map(CellValue::display)
                .collect(Collectors.joining(", "));
    }
}
