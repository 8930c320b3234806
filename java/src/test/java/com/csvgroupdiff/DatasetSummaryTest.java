package com.csvgroupdiff;

import static com.csvgroupdiff.TestDatasets.standard;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class DatasetSummaryTest {

    @Test
    void countsAllRows_notOnlyHistory() {
        Dataset dataset = TestDatasets.standardDataset(
                standard(1, 5, "history", 1),
                standard(1, 6, "current", 1),
                standard(2, 5, "history", 1),
                standard(null, null, null, 1));

        DatasetSummary summary = DatasetSummary.of(dataset, "history");

        assertEquals(4, summary.rows());
        assertEquals(7, summary.columns());
        assertEquals(2, summary.distinctDatasetIds());
        assertEquals(2, summary.distinctTacticIds());
        assertEquals(2, summary.historyRows());
        assertEquals(Map.of("history", 2L, "current", 1L), summary.recencyFlags());
        assertEquals(List.of("history", "current"), List.copyOf(summary.recencyFlags().keySet()));
    }

    @Test
    void emptyDataset_summarizesToZero() {
        DatasetSummary summary = DatasetSummary.of(TestDatasets.dataset(List.of("a")), "history");

        assertEquals(0, summary.rows());
        assertEquals(1, summary.columns());
        assertEquals(0, summary.distinctDatasetIds());
        assertTrue(summary.recencyFlags().isEmpty());
    }
}
