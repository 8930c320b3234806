package com.csvgroupdiff;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single cell: text, a number, or missing.
 * <p>
 * Numbers keep the text they were read from for display but compare by value,
 * so {@code 5} and {@code 5.0} are equal. Missing equals missing, which lets it
 * act as a grouping key.
 */
public record CellValue(Kind kind, String text, BigDecimal number) implements Comparable<CellValue> {

    public enum Kind {
        NUMBER,
        STRING,
        MISSING
    }

    private static final CellValue MISSING = new CellValue(Kind.MISSING, null, null);

    public static CellValue missing() {
        return MISSING;
    }

    public static CellValue of(String text) {
        return text == null ? MISSING : new CellValue(Kind.STRING, text, null);
    }

    public static CellValue number(String text) {
        if (text == null) {
            return MISSING;
        }
        return new CellValue(Kind.NUMBER, text, new BigDecimal(text.trim()));
    }

    public static CellValue number(long value) {
        return new CellValue(Kind.NUMBER, Long.toString(value), BigDecimal.valueOf(value));
    }

    /**
     * Returns true when the text parses as a {@link BigDecimal}, exponent notation included.
     */
    public static boolean isNumeric(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public boolean isMissing() {
        return kind == Kind.MISSING;
    }

    public boolean isText() {
        return kind == Kind.STRING;
    }

    public boolean isNumber() {
        return kind == Kind.NUMBER;
    }

    /**
     * The value as a plain Java object: {@link String}, {@link BigDecimal} or null.
     */
    public Object raw() {
        return switch (kind) {
            case STRING -> text;
            case NUMBER -> number;
            case MISSING -> null;
        };
    }

    /**
     * Text for reports; missing renders as the empty string.
     */
    public String display() {
        return kind == Kind.MISSING ? "" : text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue other) || kind != other.kind) {
            return false;
        }
        return switch (kind) {
            case STRING -> text.equals(other.text);
            case NUMBER -> number.compareTo(other.number) == 0;
            case MISSING -> true;
        };
    }

    @Override
    public int hashCode() {
        return switch (kind) {
            case STRING -> Objects.hash(kind, text);
            case NUMBER -> Objects.hash(kind, number.stripTrailingZeros());
            case MISSING -> 0;
        };
    }

    /**
     * Numbers first, then text, missing last.
     */
    @Override
    public int compareTo(CellValue other) {
        if (kind != other.kind) {
            return kind.compareTo(other.kind);
        }
        return switch (kind) {
            case STRING -> text.compareTo(other.text);
            case NUMBER -> number.compareTo(other.number);
            case MISSING -> 0;
        };
    }

    @Override
    public String toString() {
        return kind == Kind.MISSING ? "<missing>" : text;
    }
}
