package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.config.BatchFailurePolicy;
import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.TableRecord;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link BatchWriter} backed by a single JDBC {@link PreparedStatement}.
 *
 * <p>
 * One parameterized {@code INSERT} is prepared per table and reused for every batch. Each batch
 * is sent with {@code executeBatch} and committed; on failure it is rolled back and the table's
 * {@link BatchFailurePolicy} decides whether the error propagates or the batch is skipped.
 * </p>
 *
 * <p>
 * The connection must be the run's single session; auto-commit is switched off here if the
 * caller left it on.
 * </p>
 *
 * @param <T> record type of the table
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JdbcBatchWriter<T extends TableRecord> implements BatchWriter<T> {

    private final Connection connection;

    private final String tableName;

    private final List<ColumnSpec> columns;

    private final BatchFailurePolicy policy;

    private final PreparedStatement statement;

    // Zero-based source row offset of the next batch
    private long rowOffset;

    private long committedRows;

    /**
     * Prepares the insert statement of a table.
     *
     * @param connection open connection
     * @param tableName table name as used in SQL (optionally schema-qualified)
     * @param columns destination columns in insert order
     * @param policy failure policy of the table
     * @throws SQLException if the statement cannot be prepared
     */
    public JdbcBatchWriter(Connection connection, String tableName, List<ColumnSpec> columns,
            BatchFailurePolicy policy) throws SQLException {
        this.connection = connection;
        this.tableName = tableName;
        this.columns = columns;
        this.policy = policy;
        if (connection.getAutoCommit()) {
            connection.setAutoCommit(false);
        }
        this.statement = connection.prepareStatement(buildInsertSql(tableName, columns));
    }

    /**
     * Builds {@code INSERT INTO table (c1, c2, ...) VALUES (?, ?, ...)}.
     *
     * @param tableName table name
     * @param columns columns in bind order
     * @return SQL text
     */
    static String buildInsertSql(String tableName, List<ColumnSpec> columns) {
        String names = columns.stream().map(ColumnSpec::getName).collect(Collectors.joining(", "));
        String marks = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + tableName + " (" + names + ") VALUES (" + marks + ")";
    }

    @Override
    public BatchOutcome write(List<T> batch) throws SQLException {
        long offset = rowOffset;
        rowOffset += batch.size();
        if (batch.isEmpty()) {
            return BatchOutcome.COMMITTED;
        }

        try {
            for (T record : batch) {
                bind(record.toColumnValues());
                statement.addBatch();
            }
            statement.executeBatch();
            connection.commit();
            committedRows += batch.size();
            return BatchOutcome.COMMITTED;
        } catch (SQLException e) {
            rollback(e);
            if (policy == BatchFailurePolicy.SKIP_BATCH) {
                log.warn("[{}] Batch at row {} ({} rows) rolled back and skipped: {}", tableName,
                        offset, batch.size(), e.getMessage());
                return BatchOutcome.FAILED;
            }
            log.error("[{}] Batch at row {} ({} rows) rolled back: {}", tableName, offset,
                    batch.size(), e.getMessage());
            throw e;
        }
    }

    /**
     * Returns the rows committed by this writer so far.
     *
     * @return committed row count
     */
    public long getCommittedRows() {
        return committedRows;
    }

    private void bind(Object[] values) throws SQLException {
        for (int i = 0; i < columns.size(); i++) {
            Object value = values[i];
            int param = i + 1;
            if (value == null) {
                statement.setNull(param, columns.get(i).getSqlType());
            } else if (value instanceof LocalDate) {
                statement.setDate(param, java.sql.Date.valueOf((LocalDate) value));
            } else {
                statement.setString(param, value.toString());
            }
        }
    }

    private void rollback(SQLException cause) {
        try {
            statement.clearBatch();
        } catch (SQLException clearEx) {
            cause.addSuppressed(clearEx);
        }
        try {
            connection.rollback();
        } catch (SQLException rollbackEx) {
            log.warn("[{}] Rollback failed: {}", tableName, rollbackEx.getMessage(), rollbackEx);
            cause.addSuppressed(rollbackEx);
        }
    }

    @Override
    public void close() throws SQLException {
        statement.close();
    }
}
