package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.SourceTable;
import lombok.Value;

/**
 * Outcome of one table in an ingestion run.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class TableLoadResult {

    /**
     * How the table was handled.
     */
    public enum Status {
        // Rows were read from the source file and written
        LOADED,
        // The table already held rows and was left untouched
        SKIPPED,
        // The load stopped; batches committed before the failure remain
        FAILED
    }

    SourceTable table;

    // Rows committed by this run (LOADED, FAILED) or rows found in the table (SKIPPED)
    long count;

    Status status;

    int failedBatches;

    long droppedRows;

    /**
     * Result of a table loaded by this run.
     *
     * @param table destination table
     * @param committed rows committed
     * @param failedBatches batches rolled back and skipped
     * @param droppedRows rows of the skipped batches
     * @return result
     */
    public static TableLoadResult loaded(SourceTable table, long committed, int failedBatches,
            long droppedRows) {
        return new TableLoadResult(table, committed, Status.LOADED, failedBatches, droppedRows);
    }

    /**
     * Result of a table skipped because it already held rows.
     *
     * @param table destination table
     * @param existing rows found in the table
     * @return result
     */
    public static TableLoadResult skipped(SourceTable table, long existing) {
        return new TableLoadResult(table, existing, Status.SKIPPED, 0, 0L);
    }

    /**
     * Result of a table whose load stopped with an error.
     *
     * @param table destination table
     * @param committed rows committed before the failure
     * @return result
     */
    public static TableLoadResult failed(SourceTable table, long committed) {
        return new TableLoadResult(table, committed, Status.FAILED, 0, 0L);
    }

    /**
     * Returns whether some batches of the table were dropped.
     *
     * @return {@code true} if at least one batch failed
     */
    public boolean hasGaps() {
        return failedBatches > 0;
    }
}
