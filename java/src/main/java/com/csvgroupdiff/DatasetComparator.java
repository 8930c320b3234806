package com.csvgroupdiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import lombok.extern.java.Log;

/**
 * Compares the history rows of two datasets group by group.
 * <p>
 * Runs entirely on the calling thread over data already in memory. The inputs
 * are never modified; normalizing, filtering and sorting all produce new views.
 */
@Log
public class DatasetComparator {
    private static final List<String> NORMALIZED_COLUMNS = List.of(Columns.TACTIC_ID, Columns.TACTIC_NM);

    private final DiffProfile profile;
    private final NullTokenNormalizer nullTokens;
    private final GroupComparator groupComparator;
    private final Set<String> ignoredColumns;

    public DatasetComparator() {
        this(DiffProfile.defaults());
    }

    public DatasetComparator(DiffProfile profile) {
        this(profile, new PairBySortOrder());
    }

    public DatasetComparator(DiffProfile profile, RowPairingPolicy pairingPolicy) {
        this.profile = profile;
        this.nullTokens = new NullTokenNormalizer(profile.null_tokens());
        this.ignoredColumns = Set.copyOf(profile.ignored_columns());
        ValueEquivalence equivalence = new ValueEquivalence(
                new DateNormalizer(profile.datetime_patterns(), profile.date_patterns()));
        this.groupComparator = new GroupComparator(
                new CombinationComparator(equivalence, pairingPolicy, ignoredColumns), ignoredColumns);
    }

    public ComparisonResult compareDatasets(Dataset fileA, Dataset fileB) {
        return compareDatasets(fileA, fileB, ComparisonListener.NONE);
    }

    public ComparisonResult compareDatasets(Dataset fileA, Dataset fileB, ComparisonListener listener) {
        List<String> messages = new ArrayList<>();

        Dataset a = nullTokens.normalize(fileA, NORMALIZED_COLUMNS);
        Dataset b = nullTokens.normalize(fileB, NORMALIZED_COLUMNS);

        reportNullTactics("File A", a, messages);
        reportNullTactics("File B", b, messages);
        reportMissingKeyColumns("File A", a, messages);
        reportMissingKeyColumns("File B", b, messages);

        Dataset historyA = history(a).sorted(
                Dataset.byColumns(Columns.DATASET_ID, Columns.TACTIC_ID, Columns.RECENCY_FLAG));
        Dataset historyB = history(b).sorted(
                Dataset.byColumns(Columns.DATASET_ID, Columns.TACTIC_ID, Columns.RECENCY_FLAG));
        log.fine(() -> "History rows: File A " + historyA.size() + ", File B " + historyB.size());

        Set<CellValue> idsA = new TreeSet<>(historyA.distinct(Columns.DATASET_ID));
        Set<CellValue> idsB = new TreeSet<>(historyB.distinct(Columns.DATASET_ID));

        Set<CellValue> onlyInA = new TreeSet<>(idsA);
        onlyInA.removeAll(idsB);
        Set<CellValue> onlyInB = new TreeSet<>(idsB);
        onlyInB.removeAll(idsA);
        Set<CellValue> common = new TreeSet<>(idsA);
        common.retainAll(idsB);

        ColumnDifferences columnDifferences = columnDifferences(fileA.columns(), fileB.columns());

        Map<CellValue, List<Row>> groupsA = groupByDatasetId(historyA);
        Map<CellValue, List<Row>> groupsB = groupByDatasetId(historyB);

        Map<CellValue, GroupChange> modifiedGroups = new LinkedHashMap<>();
        List<CellValue> identicalGroups = new ArrayList<>();
        listener.groupsFound(common.size());
        for (CellValue datasetId : common) {
            GroupChange change = groupComparator.compare(
                    new Dataset(historyA.columns(), groupsA.get(datasetId)),
                    new Dataset(historyB.columns(), groupsB.get(datasetId)),
                    datasetId,
                    columnDifferences.common());
            if (change.hasChanges()) {
                modifiedGroups.put(datasetId, change);
            } else {
                identicalGroups.add(datasetId);
            }
            listener.groupCompared(datasetId, change.hasChanges());
        }

        log.info(() -> "Groups: " + onlyInA.size() + " only in File A, " + onlyInB.size() + " only in File B, "
                + modifiedGroups.size() + " modified, " + identicalGroups.size() + " identical");

        return new ComparisonResult(
                Collections.unmodifiableSet(onlyInA),
                Collections.unmodifiableSet(onlyInB),
                Collections.unmodifiableMap(modifiedGroups),
                List.copyOf(identicalGroups),
                columnDifferences,
                List.copyOf(messages));
    }

    private Dataset history(Dataset dataset) {
        CellValue historyFlag = CellValue.of(profile.history_flag());
        return dataset.filter(row -> row.get(Columns.RECENCY_FLAG).equals(historyFlag));
    }

    private void reportNullTactics(String fileName, Dataset dataset, List<String> messages) {
        if (!dataset.hasColumn(Columns.TACTIC_ID)) {
            return;
        }
        long nullTactics = dataset.rows().stream()
                .filter(row -> row.get(Columns.TACTIC_ID).isMissing())
                .count();
        if (nullTactics > 0) {
            warn(messages, fileName + " contains " + nullTactics + " rows with NULL tactic_id values");
        }
    }

    private void reportMissingKeyColumns(String fileName, Dataset dataset, List<String> messages) {
        List<String> missing = profile.key_columns().stream()
                .filter(col -> !dataset.hasColumn(col))
                .toList();
        if (!missing.isEmpty()) {
            warn(messages, fileName + " is missing the following key columns: " + String.join(", ", missing));
        }
    }

    private static void warn(List<String> messages, String message) {
        log.warning(message);
        messages.add(message);
    }

    private ColumnDifferences columnDifferences(List<String> columnsA, List<String> columnsB) {
        Set<String> setA = new HashSet<>(columnsA);
        Set<String> setB = new HashSet<>(columnsB);
        List<String> onlyInA = columnsA.stream()
                .filter(col -> !setB.contains(col) && !ignoredColumns.contains(col))
                .distinct()
                .sorted()
                .toList();
        List<String> onlyInB = columnsB.stream()
                .filter(col -> !setA.contains(col) && !ignoredColumns.contains(col))
                .distinct()
                .sorted()
                .toList();
        List<String> common = columnsA.stream()
                .filter(col -> setB.contains(col) && !ignoredColumns.contains(col))
                .distinct()
                .toList();
        return new ColumnDifferences(onlyInA, onlyInB, common);
    }

    private static Map<CellValue, List<Row>> groupByDatasetId(Dataset dataset) {
        Map<CellValue, List<Row>> groups = new LinkedHashMap<>();
        for (Row row : dataset.rows()) {
            groups.computeIfAbsent(row.get(Columns.DATASET_ID), k -> new ArrayList<>()).add(row);
        }
        return groups;
    }
}
