package com.csvgroupdiff;

import java.util.List;

/**
 * A file lacks columns the comparison cannot run without.
 */
public class MissingColumnsException extends Exception {
    private final String fileName;
    private final List<String> missingColumns;

    public MissingColumnsException(String fileName, List<String> missingColumns) {
        super("Missing columns in " + fileName + ": " + String.join(", ", missingColumns));
        this.fileName = fileName;
        this.missingColumns = List.copyOf(missingColumns);
    }

    public String fileName() {
        return fileName;
    }

    public List<String> missingColumns() {
        return missingColumns;
    }
}
