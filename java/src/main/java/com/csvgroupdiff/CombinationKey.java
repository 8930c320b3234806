package com.csvgroupdiff;

/**
 * The (tactic_id, recency_flag) pair rows are matched on inside a group.
 * A missing tactic id is kept as {@link CellValue#missing()}, which never equals a real id.
 */
public record CombinationKey(CellValue tacticId, CellValue recencyFlag) {

    public static CombinationKey of(Row row) {
        return new CombinationKey(row.get(Columns.TACTIC_ID), row.get(Columns.RECENCY_FLAG));
    }

    public boolean hasTacticId() {
        return !tacticId.isMissing();
    }

    @Override
    public String toString() {
        return "(" + (hasTacticId() ? tacticId.text() : "NULL") + ", " + recencyFlag.display() + ")";
    }
}
