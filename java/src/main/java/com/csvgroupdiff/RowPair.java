package com.csvgroupdiff;

/**
 * Rows from File A and File B that a pairing policy lined up at {@code index}.
 * One side is null when the other file has more rows for the combination.
 */
public record RowPair(int index, Row rowA, Row rowB) {

    public boolean isPaired() {
        return rowA != null && rowB != null;
    }
}
