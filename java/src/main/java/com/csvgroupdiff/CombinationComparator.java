package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.extern.java.Log;

/**
 * Compares the rows of File A and File B that share one (tactic_id, recency_flag)
 * combination inside a dataset group.
 */
@Log
public class CombinationComparator {
    private final ValueEquivalence equivalence;
    private final RowPairingPolicy pairingPolicy;
    private final Set<String> ignoredColumns;

    public CombinationComparator(ValueEquivalence equivalence, RowPairingPolicy pairingPolicy,
            Set<String> ignoredColumns) {
        this.equivalence = equivalence;
        this.pairingPolicy = pairingPolicy;
        this.ignoredColumns = Set.copyOf(ignoredColumns);
    }

    public CombinationComparison compare(List<Row> rowsA, List<Row> rowsB, CellValue tacticId,
            CellValue recencyFlag, List<String> commonColumns, CellValue datasetId) {
        List<String> columns = commonColumns.stream()
                .filter(col -> !ignoredColumns.contains(col))
                .toList();
        boolean singleRow = Math.max(rowsA.size(), rowsB.size()) <= 1;

        List<CellChange> changes = new ArrayList<>();
        for (RowPair pair : pairingPolicy.pair(rowsA, rowsB)) {
            if (pair.isPaired()) {
                Integer rowIndex = singleRow ? null : pair.index();
                for (String col : columns) {
                    CellValue valA = pair.rowA().get(col);
                    CellValue valB = pair.rowB().get(col);
                    if (valA.isMissing() && valB.isMissing()) {
                        continue;
                    }
                    if (!equivalence.equal(valA, valB)) {
                        changes.add(new CellChange(datasetId, tacticId, recencyFlag, rowIndex, col,
                                CellChange.orNullMarker(valA), CellChange.orNullMarker(valB),
                                equivalence.classify(valA, valB)));
                    }
                }
            } else if (pair.rowA() != null) {
                for (String col : columns) {
                    changes.add(new CellChange(datasetId, tacticId, recencyFlag, pair.index(), col,
                            CellChange.orNullMarker(pair.rowA().get(col)), CellChange.ROW_REMOVED_MARKER,
                            ChangeType.ROW_REMOVED));
                }
            } else {
                for (String col : columns) {
                    changes.add(new CellChange(datasetId, tacticId, recencyFlag, pair.index(), col,
                            CellChange.ROW_ADDED_MARKER, CellChange.orNullMarker(pair.rowB().get(col)),
                            ChangeType.ROW_ADDED));
                }
            }
        }

        if (rowsA.size() != rowsB.size()) {
            log.fine(() -> "Dataset " + datasetId + " combination (" + tacticId + ", " + recencyFlag
                    + "): " + rowsA.size() + " rows in File A, " + rowsB.size() + " in File B");
        }
        return new CombinationComparison(!changes.isEmpty(), changes);
    }
}
