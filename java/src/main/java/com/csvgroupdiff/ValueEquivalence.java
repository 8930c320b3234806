package com.csvgroupdiff;

/**
 * Decides whether two cells hold the same value and, when they do not, what kind
 * of change separates them.
 */
public class ValueEquivalence {
    private final DateNormalizer dateNormalizer;

    public ValueEquivalence() {
        this(new DateNormalizer());
    }

    public ValueEquivalence(DateNormalizer dateNormalizer) {
        this.dateNormalizer = dateNormalizer;
    }

    /**
     * Two missing cells are equal. If either side is recognised as a date or
     * timestamp, the normalized forms are compared; otherwise the raw values are.
     */
    public boolean equal(CellValue a, CellValue b) {
        if (a.isMissing() && b.isMissing()) {
            return true;
        }
        CellValue normA = dateNormalizer.normalize(a);
        CellValue normB = dateNormalizer.normalize(b);
        if (!normA.equals(a) || !normB.equals(b)) {
            return normA.equals(normB);
        }
        return a.equals(b);
    }

    /**
     * Not symmetric: the side that is missing decides between added and removed.
     */
    public ChangeType classify(CellValue a, CellValue b) {
        if (a.isMissing() && !b.isMissing()) {
            return ChangeType.VALUE_ADDED;
        }
        if (!a.isMissing() && b.isMissing()) {
            return ChangeType.VALUE_REMOVED;
        }
        if (a.isMissing()) {
            return ChangeType.NO_CHANGE;
        }
        if (dateNormalizer.normalize(a).equals(dateNormalizer.normalize(b))) {
            return ChangeType.NO_CHANGE;
        }
        return ChangeType.VALUE_MODIFIED;
    }
}
