package com.csvgroupdiff;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class DatasetValidatorTest {

    @Test
    void completeDataset_passes() {
        Dataset dataset = TestDatasets.standardDataset(TestDatasets.standard(1, 5, "history", 1));

        assertTrue(DatasetValidator.missingColumns(dataset, Columns.REQUIRED).isEmpty());
        assertDoesNotThrow(() -> DatasetValidator.requireColumns("File A", dataset, Columns.REQUIRED));
    }

    @Test
    void missingRequiredColumns_areNamedInOrder() {
        Dataset dataset = TestDatasets.dataset(List.of("tactic_id", "dataset_nm", "col"));

        MissingColumnsException e = assertThrows(MissingColumnsException.class,
                () -> DatasetValidator.requireColumns("File B", dataset, Columns.REQUIRED));

        assertEquals("File B", e.fileName());
        assertEquals(List.of("dataset_id", "recency_flag", "tactic_nm", "channel_nm"), e.missingColumns());
        assertEquals("Missing columns in File B: dataset_id, recency_flag, tactic_nm, channel_nm", e.getMessage());
    }
}
