package com.csvgroupdiff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One dataset row: column name to cell. Absent columns read as missing.
 */
public record Row(Map<String, CellValue> values) {

    public Row {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public CellValue get(String column) {
        return values.getOrDefault(column, CellValue.missing());
    }

    public Row with(String column, CellValue value) {
        Map<String, CellValue> copy = new LinkedHashMap<>(values);
        copy.put(column, value);
        return new Row(copy);
    }
}
