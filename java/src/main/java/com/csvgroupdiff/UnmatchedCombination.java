package com.csvgroupdiff;

import com.google.gson.annotations.SerializedName;

/**
 * One row whose combination exists in only one of the two files. Rows are listed
 * individually, so {@code count} is always 1.
 */
public record UnmatchedCombination(
        @SerializedName("dataset_id") CellValue datasetId,
        @SerializedName("dataset_nm") CellValue datasetNm,
        @SerializedName("tactic_id") CellValue tacticId,
        @SerializedName("tactic_nm") CellValue tacticNm,
        @SerializedName("channel_nm") CellValue channelNm,
        @SerializedName("recency_flag") CellValue recencyFlag,
        int count) {

    static UnmatchedCombination of(CellValue datasetId, CombinationKey key, Row row) {
        return new UnmatchedCombination(datasetId, row.get(Columns.DATASET_NM), key.tacticId(),
                row.get(Columns.TACTIC_NM), row.get(Columns.CHANNEL_NM), key.recencyFlag(), 1);
    }
}
