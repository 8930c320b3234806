package com.csvgroupdiff;

import java.util.List;

/**
 * Checks run on a loaded file before it is handed to {@link DatasetComparator}.
 */
public final class DatasetValidator {

    private DatasetValidator() {}

    public static List<String> missingColumns(Dataset dataset, List<String> required) {
        return required.stream()
                .filter(col -> !dataset.hasColumn(col))
                .toList();
    }

    public static void requireColumns(String fileName, Dataset dataset, List<String> required)
            throws MissingColumnsException {
        List<String> missing = missingColumns(dataset, required);
        if (!missing.isEmpty()) {
            throw new MissingColumnsException(fileName, missing);
        }
    }
}
