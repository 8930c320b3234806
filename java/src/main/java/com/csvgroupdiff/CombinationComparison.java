package com.csvgroupdiff;

import java.util.List;

public record CombinationComparison(boolean hasChanges, List<CellChange> cellChanges) {
}
