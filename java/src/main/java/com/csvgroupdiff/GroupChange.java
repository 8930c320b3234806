package com.csvgroupdiff;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.annotations.SerializedName;

/**
 * Outcome of comparing one dataset_id group between the two files.
 * Combination counts are distinct keys per side, not rows.
 */
public record GroupChange(
        @SerializedName("dataset_id") CellValue datasetId,
        @SerializedName("has_changes") boolean hasChanges,
        @SerializedName("tactic_recency_changes") Map<CombinationKey, CombinationChange> combinationChanges,
        @SerializedName("only_in_file_a") List<UnmatchedCombination> unmatchedInA,
        @SerializedName("only_in_file_b") List<UnmatchedCombination> unmatchedInB,
        @SerializedName("cell_changes") List<CellChange> cellChanges,
        @SerializedName("file_a_tactic_recency_count") int combinationCountA,
        @SerializedName("file_b_tactic_recency_count") int combinationCountB,
        @SerializedName("combos_only_in_file_a") Set<CombinationKey> combosOnlyInA,
        @SerializedName("combos_only_in_file_b") Set<CombinationKey> combosOnlyInB,
        @SerializedName("common_combos") Set<CombinationKey> commonCombos) {

    public int unmatchedCount() {
        return unmatchedInA.size() + unmatchedInB.size();
    }
}
