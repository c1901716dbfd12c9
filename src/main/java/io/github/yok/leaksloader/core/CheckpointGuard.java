package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.config.CheckpointMode;
import io.github.yok.leaksloader.parser.CsvSourceReader;
import java.io.File;
import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a destination table still needs loading.
 *
 * <p>
 * A table is loaded only when it is empty. In {@link CheckpointMode#NON_EMPTY} mode any existing
 * row skips the table, so a table left half-loaded by an aborted run is skipped as well; a
 * warning says so. {@link CheckpointMode#STRICT} compares the existing count with the number of
 * data rows in the source file and refuses to continue over a partial table.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CheckpointGuard {

    private final Connection connection;

    private final CheckpointMode mode;

    /**
     * Creates a guard on the run's connection.
     *
     * @param connection open connection
     * @param mode checkpoint mode
     */
    public CheckpointGuard(Connection connection, CheckpointMode mode) {
        this.connection = connection;
        this.mode = mode;
    }

    /**
     * Counts the rows currently in a table.
     *
     * @param tableName table name as used in SQL
     * @return row count
     * @throws SQLException if the table cannot be queried
     */
    public long existingRowCount(String tableName) throws SQLException {
        try (Statement st = connection.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + tableName)) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Returns whether the table is empty and must be loaded.
     *
     * @param tableName table name as used in SQL
     * @return {@code true} if the table holds no rows
     * @throws SQLException if the table cannot be queried
     */
    public boolean shouldLoad(String tableName) throws SQLException {
        return existingRowCount(tableName) == 0;
    }

    /**
     * Confirms that a non-empty table may be skipped.
     *
     * @param tableName table name as used in SQL
     * @param existing rows found in the table
     * @param source source file of the table
     * @throws IOException if the source file cannot be counted ({@code STRICT} only)
     * @throws IllegalStateException in {@code STRICT} mode when the table holds fewer rows than
     *         the source file
     */
    public void confirmSkip(String tableName, long existing, File source) throws IOException {
        if (mode == CheckpointMode.STRICT) {
            long expected = CsvSourceReader.countRows(source);
            if (existing < expected) {
                throw new IllegalStateException("Table [" + tableName + "] is partially loaded: "
                        + existing + " of " + expected + " rows. Empty the table and re-run.");
            }
            log.info("[{}] Skipping, already holds {} rows (source has {})", tableName, existing,
                    expected);
            return;
        }
        log.info("[{}] Skipping, already holds {} rows", tableName, existing);
        log.warn("[{}] A partial load from an earlier run cannot be told apart from a complete"
                + " one; empty the table or use --strict-checkpoint to verify.", tableName);
    }
}
