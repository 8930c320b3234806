package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * An ordered, immutable table: column names plus rows.
 * Every transformation returns a new view and leaves this one untouched.
 */
public record Dataset(List<String> columns, List<Row> rows) {

    public Dataset {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return rows.size();
    }

    public Dataset filter(Predicate<Row> predicate) {
        return new Dataset(columns, rows.stream().filter(predicate).toList());
    }

    /**
     * Stable sort; rows comparing equal keep their relative order.
     */
    public Dataset sorted(Comparator<Row> comparator) {
        List<Row> copy = new ArrayList<>(rows);
        copy.sort(comparator);
        return new Dataset(columns, copy);
    }

    /**
     * Rewrites one column in every row. A column the dataset does not have is left alone.
     */
    public Dataset mapColumn(String column, UnaryOperator<CellValue> mapper) {
        if (!hasColumn(column)) {
            return this;
        }
        List<Row> mapped = new ArrayList<>(rows.size());
        for (Row row : rows) {
            mapped.add(row.with(column, mapper.apply(row.get(column))));
        }
        return new Dataset(columns, mapped);
    }

    /**
     * Distinct values of a column in first-appearance order, missing included.
     */
    public Set<CellValue> distinct(String column) {
        Set<CellValue> values = new LinkedHashSet<>();
        for (Row row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    /**
     * Sort order over several columns, missing values last.
     */
    public static Comparator<Row> byColumns(String... sortColumns) {
        Comparator<Row> comparator = (a, b) -> 0;
        for (String column : sortColumns) {
            comparator = comparator.thenComparing(row -> row.get(column));
        }
        return comparator;
    }
}
