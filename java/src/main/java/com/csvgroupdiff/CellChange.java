package com.csvgroupdiff;

import com.google.gson.annotations.SerializedName;

/**
 * One column that differs between a row of File A and its counterpart in File B.
 * <p>
 * Missing values carry the text {@code NULL}; rows present on one side only carry
 * {@code ROW_ADDED} or {@code ROW_REMOVED} on the other. {@code rowIndex} is null
 * when both sides of the combination hold exactly one row.
 */
public record CellChange(
        @SerializedName("dataset_id") CellValue datasetId,
        @SerializedName("tactic_id") CellValue tacticId,
        @SerializedName("recency_flag") CellValue recencyFlag,
        @SerializedName("Row_Index") Integer rowIndex,
        @SerializedName("Column") String column,
        @SerializedName("File_A_Value") CellValue fileAValue,
        @SerializedName("File_B_Value") CellValue fileBValue,
        @SerializedName("Change_Type") ChangeType changeType) {

    public static final CellValue NULL_MARKER = CellValue.of("NULL");
    public static final CellValue ROW_ADDED_MARKER = CellValue.of("ROW_ADDED");
    public static final CellValue ROW_REMOVED_MARKER = CellValue.of("ROW_REMOVED");

    static CellValue orNullMarker(CellValue value) {
        return value.isMissing() ? NULL_MARKER : value;
    }
}
