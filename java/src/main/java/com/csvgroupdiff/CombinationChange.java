package com.csvgroupdiff;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * A combination present in both files whose rows differ. The descriptive names
 * come from the first File B row of the combination, falling back to File A
 * where File B has no value.
 */
public record CombinationChange(
        CombinationKey key,
        @SerializedName("dataset_nm") CellValue datasetNm,
        @SerializedName("tactic_nm") CellValue tacticNm,
        @SerializedName("channel_nm") CellValue channelNm,
        @SerializedName("cell_changes") List<CellChange> cellChanges) {

    static CombinationChange of(CombinationKey key, Row firstA, Row firstB, List<CellChange> cellChanges) {
        return new CombinationChange(key,
                preferB(firstA, firstB, Columns.DATASET_NM),
                preferB(firstA, firstB, Columns.TACTIC_NM),
                preferB(firstA, firstB, Columns.CHANNEL_NM),
                List.copyOf(cellChanges));
    }

    private static CellValue preferB(Row firstA, Row firstB, String column) {
        CellValue fromB = firstB.get(column);
        return fromB.isMissing() ? firstA.get(column) : fromB;
    }
}
