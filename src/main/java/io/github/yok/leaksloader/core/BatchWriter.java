package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.TableRecord;
import java.sql.SQLException;
import java.util.List;

/**
 * Persists batches of records into one destination table.
 *
 * <p>
 * A batch is all-or-nothing: after {@link #write(List)} returns or throws, either every row of
 * the batch is committed or none is.
 * </p>
 *
 * @param <T> record type of the table
 * @author Yasuharu.Okawauchi
 */
public interface BatchWriter<T extends TableRecord> extends AutoCloseable {

    /**
     * Inserts and commits one batch.
     *
     * @param batch records in source order
     * @return {@link BatchOutcome#COMMITTED}, or {@link BatchOutcome#FAILED} when the batch was
     *         rolled back and the failure policy allows continuing
     * @throws SQLException when the batch failed and the policy stops the table
     */
    BatchOutcome write(List<T> batch) throws SQLException;

    @Override
    void close() throws SQLException;
}
