package com.csvgroupdiff;

import java.util.List;

/**
 * Well-known column names of the tactic extract layout.
 */
public final class Columns {
    public static final String DATASET_ID = "dataset_id";
    public static final String DATASET_NM = "dataset_nm";
    public static final String TACTIC_ID = "tactic_id";
    public static final String TACTIC_NM = "tactic_nm";
    public static final String CHANNEL_NM = "channel_nm";
    public static final String RECENCY_FLAG = "recency_flag";
    public static final String DESCRIPTION = "description";

    public static final String HISTORY = "history";

    /** Without these the comparison is not attempted at all. */
    public static final List<String> REQUIRED = List.of(
            DATASET_ID, TACTIC_ID, RECENCY_FLAG, DATASET_NM, TACTIC_NM, CHANNEL_NM);

    /** Reported as a warning when absent; never blocks a comparison. */
    public static final List<String> KEY = List.of(TACTIC_ID, TACTIC_NM, DATASET_ID, DATASET_NM);

    private Columns() {}
}
