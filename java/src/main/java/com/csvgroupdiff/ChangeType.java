package com.csvgroupdiff;

import com.google.gson.annotations.SerializedName;

public enum ChangeType {
    @SerializedName("Value Added")
    VALUE_ADDED("Value Added"),
    @SerializedName("Value Removed")
    VALUE_REMOVED("Value Removed"),
    @SerializedName("Value Modified")
    VALUE_MODIFIED("Value Modified"),
    @SerializedName("No Change")
    NO_CHANGE("No Change"),
    @SerializedName("Row Added")
    ROW_ADDED("Row Added"),
    @SerializedName("Row Removed")
    ROW_REMOVED("Row Removed");

    private final String label;

    ChangeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
