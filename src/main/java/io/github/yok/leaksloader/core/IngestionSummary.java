package io.github.yok.leaksloader.core;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Per-table results of one run, in load order.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IngestionSummary {

    private final List<TableLoadResult> results = new ArrayList<>();

    void add(TableLoadResult result) {
        results.add(result);
    }

    /**
     * Returns the results in load order.
     *
     * @return immutable copy of the results
     */
    public List<TableLoadResult> getResults() {
        return ImmutableList.copyOf(results);
    }

    /**
     * Returns whether no table has been processed.
     *
     * @return {@code true} if there are no results
     */
    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * Returns whether some table stopped with an error.
     *
     * @return {@code true} if a table has status {@code FAILED}
     */
    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.getStatus() == TableLoadResult.Status.FAILED);
    }

    /**
     * Returns the sum of all table counts, loaded and pre-existing.
     *
     * @return total row count
     */
    public long getTotal() {
        return results.stream().mapToLong(TableLoadResult::getCount).sum();
    }

    /**
     * Returns whether any table finished with skipped batches.
     *
     * @return {@code true} if some rows were dropped
     */
    public boolean hasGaps() {
        return results.stream().anyMatch(TableLoadResult::hasGaps);
    }

    /**
     * Writes the aligned per-table summary to the log. Nothing is written when no table was
     * processed.
     */
    public void log() {
        if (results.isEmpty()) {
            return;
        }
        log.info(hasFailures() ? "===== Summary (run stopped) =====" : "===== Summary =====");
        int maxNameLen = results.stream().mapToInt(r -> r.getTable().getTableName().length()).max()
                .orElse(0);
        int maxCountDigits = Math.max(String.valueOf(getTotal()).length(), 1);
        String fmt = "  Table[%-" + Math.max(maxNameLen, 1) + "s] Total=%" + maxCountDigits + "d";
        for (TableLoadResult r : results) {
            String line = String.format(fmt, r.getTable().getTableName(), r.getCount());
            if (r.getStatus() == TableLoadResult.Status.SKIPPED) {
                line += " skipped (already loaded)";
            } else if (r.getStatus() == TableLoadResult.Status.FAILED) {
                line += " FAILED (rows committed before the failure are kept)";
            } else if (r.hasGaps()) {
                line += String.format(" loaded, failed batches=%d (dropped rows=%d)",
                        r.getFailedBatches(), r.getDroppedRows());
            } else {
                line += " loaded";
            }
            log.info(line);
        }
        log.info("  Total: {} rows", getTotal());
    }
}
