package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs row i of A with row i of B, in the order the rows arrive. No content is
 * looked at, so duplicated combinations are matched purely by position.
 */
public class PairBySortOrder implements RowPairingPolicy {

    @Override
    public List<RowPair> pair(List<Row> rowsA, List<Row> rowsB) {
        int common = Math.min(rowsA.size(), rowsB.size());
        List<RowPair> pairs = new ArrayList<>(Math.max(rowsA.size(), rowsB.size()));
        for (int i = 0; i < common; i++) {
            pairs.add(new RowPair(i, rowsA.get(i), rowsB.get(i)));
        }
        for (int i = common; i < rowsA.size(); i++) {
            pairs.add(new RowPair(i, rowsA.get(i), null));
        }
        for (int i = common; i < rowsB.size(); i++) {
            pairs.add(new RowPair(i, null, rowsB.get(i)));
        }
        return pairs;
    }
}
