package io.github.yok.leaksloader.core;

import com.google.common.collect.ImmutableList;
import io.github.yok.leaksloader.config.LoadSettings;
import io.github.yok.leaksloader.db.ConnectionFactory;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.model.TableRecord;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs the table loaders in dependency order over a single connection.
 *
 * <p>
 * <strong>Order:</strong> entities, officers, intermediaries, addresses, relationships. Tables not
 * selected in {@link LoadSettings} are left out; the order of the rest is kept.
 * </p>
 *
 * <p>
 * <strong>Per table:</strong>
 * </p>
 * <ul>
 * <li>A non-empty table is skipped (see {@link CheckpointGuard}) and its existing count is
 * reported.</li>
 * <li>An empty table is loaded from its source file; a missing file stops the run.</li>
 * <li>A loader failure stops the run with the table and file in the message. Batches committed
 * before the failure, and tables completed before it, stay in place; the table is reported as
 * {@code FAILED} with its committed count.</li>
 * </ul>
 *
 * <p>
 * The summary is logged whether or not the run completes, once at least one table was reached.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IngestionOrchestrator {

    private final LoadSettings settings;

    private final ConnectionFactory connectionFactory;

    private final List<TableLoader<?>> loaders;

    /**
     * Creates an orchestrator with the five standard loaders.
     *
     * @param settings run settings
     * @param connectionFactory source of the run's connection
     */
    public IngestionOrchestrator(LoadSettings settings, ConnectionFactory connectionFactory) {
        this(settings, connectionFactory, ImmutableList.of(new EntityTableLoader(),
                new OfficerTableLoader(), new IntermediaryTableLoader(), new AddressTableLoader(),
                new RelationshipTableLoader()));
    }

    /**
     * Creates an orchestrator with explicit loaders, run in the given order.
     *
     * @param settings run settings
     * @param connectionFactory source of the run's connection
     * @param loaders loaders in load order
     */
    IngestionOrchestrator(LoadSettings settings, ConnectionFactory connectionFactory,
            List<TableLoader<?>> loaders) {
        this.settings = settings;
        this.connectionFactory = connectionFactory;
        this.loaders = ImmutableList.copyOf(loaders);
    }

    /**
     * Runs the ingestion.
     *
     * @return per-table results
     * @throws SQLException if the connection cannot be opened or a table cannot be counted
     * @throws IOException if a source file cannot be counted in {@code STRICT} mode
     * @throws IllegalStateException if a source file is missing, a table is partially loaded in
     *         {@code STRICT} mode, or a loader fails
     */
    public IngestionSummary execute() throws SQLException, IOException {
        return execute(new IngestionSummary());
    }

    /**
     * Runs the ingestion, recording results into the given summary as tables are processed.
     *
     * @param summary summary to fill; holds the tables reached so far if the run stops
     * @return {@code summary}
     * @throws SQLException if the connection cannot be opened or a table cannot be counted
     * @throws IOException if a source file cannot be counted in {@code STRICT} mode
     */
    IngestionSummary execute(IngestionSummary summary) throws SQLException, IOException {
        log.info("=== Ingestion started (dir={}, batchSize={}, checkpoint={}) ===",
                settings.getSourceDir().getAbsolutePath(), settings.getBatchSize(),
                settings.getCheckpointMode());

        try (Connection connection = connectionFactory.open()) {
            connection.setAutoCommit(false);
            CheckpointGuard guard = new CheckpointGuard(connection, settings.getCheckpointMode());

            for (TableLoader<?> loader : loaders) {
                SourceTable table = loader.getTable();
                if (!settings.isSelected(table)) {
                    log.info("[{}] Not selected → skipping", table.getTableName());
                    continue;
                }
                String tableName = settings.qualify(table);
                File source = settings.resolveSourceFile(table);

                if (!guard.shouldLoad(tableName)) {
                    long existing = guard.existingRowCount(tableName);
                    guard.confirmSkip(tableName, existing, source);
                    summary.add(TableLoadResult.skipped(table, existing));
                    continue;
                }

                if (!source.isFile() || !source.canRead()) {
                    summary.add(TableLoadResult.failed(table, 0L));
                    throw new IllegalStateException("Source file for table [" + tableName
                            + "] not found or unreadable: " + source.getAbsolutePath());
                }
                summary.add(loadTable(connection, loader, tableName, source, summary));
            }
            log.info("=== Ingestion finished ===");
        } finally {
            summary.log();
        }
        return summary;
    }

    private <T extends TableRecord> TableLoadResult loadTable(Connection connection,
            TableLoader<T> loader, String tableName, File source, IngestionSummary summary) {
        JdbcBatchWriter<T> writer = null;
        try {
            writer = new JdbcBatchWriter<>(connection, tableName, loader.getColumns(),
                    settings.failurePolicyFor(loader.getTable()));
            try (JdbcBatchWriter<T> open = writer) {
                return loader.load(source, open, settings.getBatchSize());
            }
        } catch (SQLException | IOException | UncheckedIOException e) {
            long committed = writer == null ? 0L : writer.getCommittedRows();
            summary.add(TableLoadResult.failed(loader.getTable(), committed));
            throw new IllegalStateException("Table [" + tableName + "] load failed (file="
                    + source.getAbsolutePath() + ", committed rows=" + committed + ")", e);
        }
    }
}
