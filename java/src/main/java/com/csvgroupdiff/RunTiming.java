package com.csvgroupdiff;

import com.google.gson.annotations.SerializedName;

public record RunTiming(
        @SerializedName("read_ms") long readMs,
        @SerializedName("compare_ms") long compareMs,
        @SerializedName("write_ms") long writeMs,
        @SerializedName("total_ms") long totalMs) {

    public static RunTiming of(long readMs, long compareMs, long writeMs) {
        return new RunTiming(readMs, compareMs, writeMs, readMs + compareMs + writeMs);
    }
}
