package com.csvgroupdiff;

import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * Column names present in only one file, and those both share (in File A order).
 */
public record ColumnDifferences(
        @SerializedName("only_in_file_a") List<String> onlyInA,
        @SerializedName("only_in_file_b") List<String> onlyInB,
        @SerializedName("common") List<String> common) {

    public boolean hasDifferences() {
        return !onlyInA.isEmpty() || !onlyInB.isEmpty();
    }
}
