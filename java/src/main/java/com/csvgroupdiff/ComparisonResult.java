package com.csvgroupdiff;

import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.annotations.SerializedName;

/**
 * Everything one comparison of File A against File B produced.
 * Group id sets are in ascending order; callers may re-sort for display.
 */
public record ComparisonResult(
        @SerializedName("groups_only_in_file_a") Set<CellValue> groupsOnlyInA,
        @SerializedName("groups_only_in_file_b") Set<CellValue> groupsOnlyInB,
        @SerializedName("modified_groups") Map<CellValue, GroupChange> modifiedGroups,
        @SerializedName("identical_groups") List<CellValue> identicalGroups,
        @SerializedName("column_differences") ColumnDifferences columnDifferences,
        @SerializedName("validation_messages") List<String> validationMessages) {

    public int totalCombinationChanges() {
        return modifiedGroups.values().stream().mapToInt(g -> g.combinationChanges().size()).sum();
    }

    public int totalCellChanges() {
        return modifiedGroups.values().stream().mapToInt(g -> g.cellChanges().size()).sum();
    }

    public int totalUnmatchedCombinations() {
        return modifiedGroups.values().stream().mapToInt(GroupChange::unmatchedCount).sum();
    }

    public boolean hasDifferences() {
        return !groupsOnlyInA.isEmpty() || !groupsOnlyInB.isEmpty() || !modifiedGroups.isEmpty();
    }
}
