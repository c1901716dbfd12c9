package io.github.yok.leaksloader.core;

import com.google.common.base.Preconditions;
import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.model.TableRecord;
import io.github.yok.leaksloader.parser.CsvSourceReader;
import io.github.yok.leaksloader.parser.SourceRow;
import java.io.File;
import java.io.IOException;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads one source file into one destination table.
 *
 * <p>
 * Subclasses declare the table, its columns and how a source row becomes a record; the batching
 * loop is shared. Rows are read in file order and handed to the writer in batches of
 * {@code batchSize}; the trailing partial batch is flushed at end of input, so a file of
 * {@code N} rows results in {@code ceil(N / batchSize)} writes.
 * </p>
 *
 * @param <T> record type of the table
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public abstract class TableLoader<T extends TableRecord> {

    /**
     * Returns the destination table.
     *
     * @return table
     */
    public abstract SourceTable getTable();

    /**
     * Returns the destination columns in insert order.
     *
     * @return columns
     */
    public abstract List<ColumnSpec> getColumns();

    /**
     * Normalizes one source row.
     *
     * @param row source row
     * @return record for the table
     */
    protected abstract T toRecord(SourceRow row);

    /**
     * Streams the file into the writer.
     *
     * @param source source CSV file
     * @param writer batch writer of the table
     * @param batchSize rows per batch
     * @return committed row count and skipped batches
     * @throws IOException if the file cannot be read
     * @throws SQLException if a batch fails under {@code ABORT_TABLE}
     */
    public TableLoadResult load(File source, BatchWriter<T> writer, int batchSize)
            throws IOException, SQLException {
        Preconditions.checkArgument(batchSize > 0, "batchSize must be positive: %s", batchSize);
        String table = getTable().getTableName();
        log.info("[{}] Loading from {}", table, source.getAbsolutePath());

        Tally tally = new Tally();
        try (CsvSourceReader reader = CsvSourceReader.open(source, getColumns())) {
            List<String> unresolved = reader.getUnresolvedColumns();
            if (!unresolved.isEmpty()) {
                log.warn("[{}] Columns not found in header, loaded as NULL: {}", table,
                        unresolved);
            }

            List<T> batch = new ArrayList<>(batchSize);
            for (SourceRow row : reader) {
                batch.add(toRecord(row));
                if (batch.size() >= batchSize) {
                    flush(writer, batch, tally);
                    batch = new ArrayList<>(batchSize);
                }
            }
            if (!batch.isEmpty()) {
                flush(writer, batch, tally);
            }
        }

        if (tally.failedBatches > 0) {
            log.warn("[{}] Completed with gaps: {} rows loaded, {} batches ({} rows) skipped", table,
                    tally.committed, tally.failedBatches, tally.droppedRows);
        } else {
            log.info("[{}] Completed: {} rows loaded", table, tally.committed);
        }
        return TableLoadResult.loaded(getTable(), tally.committed, tally.failedBatches,
                tally.droppedRows);
    }

    private void flush(BatchWriter<T> writer, List<T> batch, Tally tally) throws SQLException {
        if (writer.write(batch) == BatchOutcome.COMMITTED) {
            tally.committed += batch.size();
            log.info("[{}] Loaded {} rows...", getTable().getTableName(), tally.committed);
        } else {
            tally.failedBatches++;
            tally.droppedRows += batch.size();
        }
    }

    // Running counters of one load
    private static final class Tally {
        long committed;
        int failedBatches;
        long droppedRows;
    }
}
