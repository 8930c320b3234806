package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import lombok.extern.java.Log;

/**
 * Compares one dataset_id group of File A with the same group of File B by
 * splitting both into (tactic_id, recency_flag) combinations.
 */
@Log
public class GroupComparator {
    private final CombinationComparator combinationComparator;
    private final Set<String> ignoredColumns;

    public GroupComparator(CombinationComparator combinationComparator, Set<String> ignoredColumns) {
        this.combinationComparator = combinationComparator;
        this.ignoredColumns = Set.copyOf(ignoredColumns);
    }

    public GroupChange compare(Dataset groupA, Dataset groupB, CellValue datasetId, List<String> commonColumns) {
        List<String> columns = commonColumns.stream()
                .filter(col -> !ignoredColumns.contains(col))
                .toList();

        Map<CombinationKey, List<Row>> combosA = partition(
                groupA.sorted(Dataset.byColumns(Columns.TACTIC_ID, Columns.RECENCY_FLAG)));
        Map<CombinationKey, List<Row>> combosB = partition(
                groupB.sorted(Dataset.byColumns(Columns.TACTIC_ID, Columns.RECENCY_FLAG)));

        Set<CombinationKey> onlyInA = new LinkedHashSet<>(combosA.keySet());
        onlyInA.removeAll(combosB.keySet());
        Set<CombinationKey> onlyInB = new LinkedHashSet<>(combosB.keySet());
        onlyInB.removeAll(combosA.keySet());
        Set<CombinationKey> common = new LinkedHashSet<>(combosA.keySet());
        common.retainAll(combosB.keySet());

        List<UnmatchedCombination> unmatchedInA = unmatched(datasetId, onlyInA, combosA);
        List<UnmatchedCombination> unmatchedInB = unmatched(datasetId, onlyInB, combosB);

        Map<CombinationKey, CombinationChange> combinationChanges = new LinkedHashMap<>();
        List<CellChange> cellChanges = new ArrayList<>();
        for (CombinationKey key : common) {
            List<Row> rowsA = combosA.get(key);
            List<Row> rowsB = combosB.get(key);
            CombinationComparison comparison = combinationComparator.compare(rowsA, rowsB, key.tacticId(),
                    key.recencyFlag(), columns, datasetId);
            if (comparison.hasChanges()) {
                combinationChanges.put(key,
                        CombinationChange.of(key, rowsA.get(0), rowsB.get(0), comparison.cellChanges()));
                cellChanges.addAll(comparison.cellChanges());
            }
        }

        boolean hasChanges = !onlyInA.isEmpty() || !onlyInB.isEmpty() || !combinationChanges.isEmpty();
        if (hasChanges) {
            log.fine(() -> "Dataset " + datasetId + ": " + onlyInA.size() + " combination(s) only in File A, "
                    + onlyInB.size() + " only in File B, " + combinationChanges.size() + " modified");
        }

        return new GroupChange(
                datasetId,
                hasChanges,
                Collections.unmodifiableMap(combinationChanges),
                unmatchedInA,
                unmatchedInB,
                List.copyOf(cellChanges),
                combosA.size(),
                combosB.size(),
                Collections.unmodifiableSet(onlyInA),
                Collections.unmodifiableSet(onlyInB),
                Collections.unmodifiableSet(common));
    }

    // Keys in first-appearance order of the sorted rows; rows keep their sorted order.
    private Map<CombinationKey, List<Row>> partition(Dataset sortedGroup) {
        Map<CombinationKey, List<Row>> combos = new LinkedHashMap<>();
        for (Row row : sortedGroup.rows()) {
            combos.computeIfAbsent(CombinationKey.of(row), k -> new ArrayList<>()).add(row);
        }
        return combos;
    }

    private List<UnmatchedCombination> unmatched(CellValue datasetId, Set<CombinationKey> keys,
            Map<CombinationKey, List<Row>> combos) {
        List<UnmatchedCombination> records = new ArrayList<>();
        for (CombinationKey key : keys) {
            for (Row row : combos.get(key)) {
                records.add(UnmatchedCombination.of(datasetId, key, row));
            }
        }
        return List.copyOf(records);
    }
}
