package com.csvgroupdiff;

import com.google.gson.annotations.SerializedName;

/**
 * A comparison result together with what is known about the two inputs.
 */
public record ComparisonReport(
        @SerializedName("file_a") InputInfo fileA,
        @SerializedName("file_b") InputInfo fileB,
        @SerializedName("result") ComparisonResult result) {

    public record InputInfo(
            @SerializedName("path") String path,
            @SerializedName("blake3") String blake3,
            @SerializedName("summary") DatasetSummary summary) {
    }
}
