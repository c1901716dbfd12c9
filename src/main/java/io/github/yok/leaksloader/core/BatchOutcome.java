package io.github.yok.leaksloader.core;

/**
 * Result of writing one batch.
 *
 * @author Yasuharu.Okawauchi
 */
public enum BatchOutcome {

    // All rows of the batch were inserted and committed
    COMMITTED,

    // The batch was rolled back and skipped; no row of it is in the table
    FAILED
}
