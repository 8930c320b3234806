package com.csvgroupdiff;

import java.util.List;

/**
 * Decides which row of File A is compared with which row of File B when a
 * combination holds several rows.
 */
public interface RowPairingPolicy {

    /**
     * Returns paired rows first, then the leftover rows of the longer side.
     */
    List<RowPair> pair(List<Row> rowsA, List<Row> rowsB);
}
