package com.csvgroupdiff;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Maps null-like text tokens to {@link CellValue#missing()}.
 */
public class NullTokenNormalizer {

    public static final Set<String> DEFAULT_NULL_TOKENS = Set.of("", "NULL", "null", "None");

    private final Set<String> tokens;

    public NullTokenNormalizer() {
        this(DEFAULT_NULL_TOKENS);
    }

    public NullTokenNormalizer(Collection<String> tokens) {
        this.tokens = Set.copyOf(tokens);
    }

    public CellValue normalize(CellValue value) {
        if (value.isText() && tokens.contains(value.text())) {
            return CellValue.missing();
        }
        return value;
    }

    /**
     * Normalizes the given columns of a dataset; columns it lacks are skipped.
     */
    public Dataset normalize(Dataset dataset, List<String> columns) {
        Dataset result = dataset;
        for (String column : columns) {
            result = result.mapColumn(column, this::normalize);
        }
        return result;
    }
}
