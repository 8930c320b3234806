package com.csvgroupdiff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Headline numbers for one input file, taken over all of its rows.
 */
public record DatasetSummary(
        int rows,
        int columns,
        int distinctDatasetIds,
        int distinctTacticIds,
        int historyRows,
        Map<String, Long> recencyFlags) {

    public static DatasetSummary of(Dataset dataset, String historyFlag) {
        Map<String, Long> flags = new LinkedHashMap<>();
        int history = 0;
        for (Row row : dataset.rows()) {
            CellValue flag = row.get(Columns.RECENCY_FLAG);
            if (flag.isMissing()) {
                continue;
            }
            flags.merge(flag.display(), 1L, Long::sum);
            if (flag.isText() && flag.text().equals(historyFlag)) {
                history++;
            }
        }
        return new DatasetSummary(
                dataset.size(),
                dataset.columns().size(),
                distinctPresent(dataset, Columns.DATASET_ID),
                distinctPresent(dataset, Columns.TACTIC_ID),
                history,
                Collections.unmodifiableMap(flags));
    }

    private static int distinctPresent(Dataset dataset, String column) {
        return (int) dataset.distinct(column).stream()
                .filter(value -> !value.isMissing())
                .count();
    }
}
