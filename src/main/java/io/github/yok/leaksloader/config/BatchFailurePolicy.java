package io.github.yok.leaksloader.config;

/**
 * What the batch writer does after a batch insert fails and has been rolled back.
 *
 * @author Yasuharu.Okawauchi
 */
public enum BatchFailurePolicy {
    // Propagate the failure: the table's load stops, earlier committed batches stay
    ABORT_TABLE,
    // Log a warning and continue with the next batch, leaving a gap in the table
    SKIP_BATCH
}
