package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

class CombinationComparatorTest {

    private static final List<String> COLUMNS = List.of("tactic_id", "recency_flag", "col", "description");
    private static final CellValue DATASET = CellValue.number(1);
    private static final CellValue TACTIC = CellValue.number(7);
    private static final CellValue HISTORY = CellValue.of("history");

    private final CombinationComparator comparator = new CombinationComparator(
            new ValueEquivalence(), new PairBySortOrder(), Set.of("description"));

    private static Row row(Object col, Object description) {
        return TestDatasets.row(COLUMNS, 7, "history", col, description);
    }

    private CombinationComparison compare(List<Row> rowsA, List<Row> rowsB) {
        return comparator.compare(rowsA, rowsB, TACTIC, HISTORY, COLUMNS, DATASET);
    }

    @Test
    void singleRowOnEachSide_reportsChangeWithoutRowIndex() {
        CombinationComparison result = compare(List.of(row(10, "a")), List.of(row(20, "a")));

        assertTrue(result.hasChanges());
        assertEquals(1, result.cellChanges().size());
        CellChange change = result.cellChanges().get(0);
        assertNull(change.rowIndex());
        assertEquals("col", change.column());
        assertEquals(CellValue.number(10), change.fileAValue());
        assertEquals(CellValue.number(20), change.fileBValue());
        assertEquals(ChangeType.VALUE_MODIFIED, change.changeType());
        assertEquals(DATASET, change.datasetId());
        assertEquals(TACTIC, change.tacticId());
        assertEquals(HISTORY, change.recencyFlag());
    }

    @Test
    void identicalRows_reportNothing() {
        CombinationComparison result = compare(List.of(row(10, "a")), List.of(row(10.0, "b")));

        assertFalse(result.hasChanges());
        assertTrue(result.cellChanges().isEmpty());
    }

    @Test
    void ignoredColumn_isNeverCompared() {
        CombinationComparison result = compare(List.of(row(10, "old text")), List.of(row(10, "new text")));

        assertFalse(result.hasChanges());
    }

    @Test
    void missingValues_areMarkedNull() {
        CombinationComparison removed = compare(List.of(row(10, null)), List.of(row(null, null)));
        CombinationComparison added = compare(List.of(row(null, null)), List.of(row(10, null)));

        CellChange removal = removed.cellChanges().get(0);
        assertEquals(ChangeType.VALUE_REMOVED, removal.changeType());
        assertEquals(CellChange.NULL_MARKER, removal.fileBValue());

        CellChange addition = added.cellChanges().get(0);
        assertEquals(ChangeType.VALUE_ADDED, addition.changeType());
        assertEquals(CellChange.NULL_MARKER, addition.fileAValue());
    }

    @Test
    void extraRowInB_isReportedAsRowAddedPerColumn() {
        CombinationComparison result = compare(List.of(row(10, null)), List.of(row(10, null), row(99, null)));

        assertTrue(result.hasChanges());
        List<CellChange> changes = result.cellChanges();
        assertEquals(3, changes.size());
        for (CellChange change : changes) {
            assertEquals(ChangeType.ROW_ADDED, change.changeType());
            assertEquals(1, change.rowIndex());
            assertEquals(CellChange.ROW_ADDED_MARKER, change.fileAValue());
        }
        CellChange col = changes.stream().filter(c -> c.column().equals("col")).findFirst().orElseThrow();
        assertEquals(CellValue.number(99), col.fileBValue());
    }

    @Test
    void extraRowInA_isReportedAsRowRemoved() {
        CombinationComparison result = compare(List.of(row(10, null), row(null, null)), List.of(row(10, null)));

        CellChange col = result.cellChanges().stream()
                .filter(c -> c.column().equals("col"))
                .findFirst()
                .orElseThrow();
        assertEquals(ChangeType.ROW_REMOVED, col.changeType());
        assertEquals(CellChange.NULL_MARKER, col.fileAValue());
        assertEquals(CellChange.ROW_REMOVED_MARKER, col.fileBValue());
        assertEquals(1, col.rowIndex());
    }

    @Test
    void duplicatedCombination_pairsByPosition_withRowIndex() {
        CombinationComparison result = compare(
                List.of(row(1, null), row(2, null)),
                List.of(row(1, null), row(3, null)));

        assertEquals(1, result.cellChanges().size());
        CellChange change = result.cellChanges().get(0);
        assertEquals(1, change.rowIndex());
        assertEquals(CellValue.number(2), change.fileAValue());
        assertEquals(CellValue.number(3), change.fileBValue());
    }

    @Test
    void rowCountMismatch_withNoComparableColumns_reportsNothing() {
        CombinationComparison result = comparator.compare(List.of(row(1, null)), List.of(row(1, null), row(1, null)),
                TACTIC, HISTORY, List.of("description"), DATASET);

        assertFalse(result.hasChanges());
        assertTrue(result.cellChanges().isEmpty());
    }
}
