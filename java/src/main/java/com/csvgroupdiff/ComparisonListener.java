package com.csvgroupdiff;

/**
 * Notified on the comparing thread as groups are processed.
 */
public interface ComparisonListener {
    ComparisonListener NONE = new ComparisonListener() {
    };

    default void groupsFound(int commonGroups) {
    }

    default void groupCompared(CellValue datasetId, boolean changed) {
    }
}
