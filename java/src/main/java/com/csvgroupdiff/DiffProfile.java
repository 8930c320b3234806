package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.List;

/**
 * Comparison settings, bound from a {@code profiles} entry of a YAML file.
 * Fields left out of the file keep the defaults below.
 */
public class DiffProfile {
    public static final List<String> DEFAULT_NA_VALUES = List.of(
            "", "#N/A", "#N/A N/A", "#NA", "-1.#IND", "-1.#QNAN", "-NaN", "-nan", "1.#IND", "1.#QNAN",
            "<NA>", "N/A", "NA", "NULL", "NaN", "None", "n/a", "nan", "null");

    private String history_flag = Columns.HISTORY;
    private List<String> ignored_columns = List.of(Columns.DESCRIPTION);
    private List<String> null_tokens = List.copyOf(NullTokenNormalizer.DEFAULT_NULL_TOKENS);
    private List<String> na_values = DEFAULT_NA_VALUES;
    private List<String> required_columns = Columns.REQUIRED;
    private List<String> key_columns = Columns.KEY;
    private List<String> datetime_patterns = DateNormalizer.DEFAULT_DATETIME_PATTERNS;
    private List<String> date_patterns = DateNormalizer.DEFAULT_DATE_PATTERNS;

    public DiffProfile() {
    }

    public static DiffProfile defaults() {
        return new DiffProfile();
    }

    public String history_flag() {
        return history_flag;
    }

    public void setHistory_flag(String history_flag) {
        this.history_flag = history_flag != null ? history_flag : Columns.HISTORY;
    }

    public List<String> ignored_columns() {
        return ignored_columns;
    }

    public void setIgnored_columns(List<String> ignored_columns) {
        this.ignored_columns = ignored_columns != null ? copy(ignored_columns) : List.of(Columns.DESCRIPTION);
    }

    public List<String> null_tokens() {
        return null_tokens;
    }

    public void setNull_tokens(List<String> null_tokens) {
        this.null_tokens = null_tokens != null ? copy(null_tokens)
                : List.copyOf(NullTokenNormalizer.DEFAULT_NULL_TOKENS);
    }

    public List<String> na_values() {
        return na_values;
    }

    public void setNa_values(List<String> na_values) {
        this.na_values = na_values != null ? copy(na_values) : DEFAULT_NA_VALUES;
    }

    public List<String> required_columns() {
        return required_columns;
    }

    public void setRequired_columns(List<String> required_columns) {
        this.required_columns = required_columns != null ? copy(required_columns) : Columns.REQUIRED;
    }

    public List<String> key_columns() {
        return key_columns;
    }

    public void setKey_columns(List<String> key_columns) {
        this.key_columns = key_columns != null ? copy(key_columns) : Columns.KEY;
    }

    public List<String> datetime_patterns() {
        return datetime_patterns;
    }

    public void setDatetime_patterns(List<String> datetime_patterns) {
        this.datetime_patterns = datetime_patterns != null ? copy(datetime_patterns)
                : DateNormalizer.DEFAULT_DATETIME_PATTERNS;
    }

    public List<String> date_patterns() {
        return date_patterns;
    }

    public void setDate_patterns(List<String> date_patterns) {
        this.date_patterns = date_patterns != null ? copy(date_patterns) : DateNormalizer.DEFAULT_DATE_PATTERNS;
    }

    // YAML reads an empty quoted token as "" but a bare empty item as null.
    private static List<String> copy(List<String> values) {
        List<String> result = new ArrayList<>(values.size());
        for (String value : values) {
            result.add(value == null ? "" : value);
        }
        return List.copyOf(result);
    }
}
