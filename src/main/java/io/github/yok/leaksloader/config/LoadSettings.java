package io.github.yok.leaksloader.config;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.github.yok.leaksloader.model.SourceTable;
import java.io.File;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable settings of one ingestion run.
 *
 * <p>
 * Built once from the bound configuration by the caller of the orchestrator and passed
 * explicitly to the checkpoint guard, loaders and batch writers. Every per-table value (source
 * file, failure policy, selection) is resolved here, so an unknown table name in the
 * configuration fails before any table is touched.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class LoadSettings {

    // Plain (unquoted) SQL identifier
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_$#]*");

    private final File sourceDir;

    private final int batchSize;

    private final CheckpointMode checkpointMode;

    // Schema prefix for table names, or null
    private final String schema;

    private final Map<SourceTable, BatchFailurePolicy> failurePolicies;

    private final Map<SourceTable, String> sourceFileNames;

    private final Set<SourceTable> selectedTables;

    private LoadSettings(File sourceDir, int batchSize, CheckpointMode checkpointMode,
            String schema, Map<SourceTable, BatchFailurePolicy> failurePolicies,
            Map<SourceTable, String> sourceFileNames, Set<SourceTable> selectedTables) {
        this.sourceDir = sourceDir;
        this.batchSize = batchSize;
        this.checkpointMode = checkpointMode;
        this.schema = schema;
        this.failurePolicies = ImmutableMap.copyOf(failurePolicies);
        this.sourceFileNames = ImmutableMap.copyOf(sourceFileNames);
        this.selectedTables = ImmutableSet.copyOf(selectedTables);
    }

    /**
     * Resolves the run settings from the bound configuration.
     *
     * @param pathsConfig source directory settings
     * @param ingestConfig batch, policy and table selection settings
     * @param connectionConfig connection settings (schema only)
     * @return settings for one run
     * @throws IllegalStateException if the source directory is not configured
     * @throws IllegalArgumentException if the batch size is not positive, a table name is
     *         unknown, or the schema is not a plain identifier
     */
    public static LoadSettings from(PathsConfig pathsConfig, IngestConfig ingestConfig,
            ConnectionConfig connectionConfig) {
        File sourceDir = pathsConfig.getSourceDir();

        int batchSize = ingestConfig.getBatchSize();
        Preconditions.checkArgument(batchSize > 0, "ingest.batch-size must be positive: %s",
                batchSize);

        String schema = StringUtils.trimToNull(connectionConfig.getSchema());
        if (schema != null) {
            Preconditions.checkArgument(IDENTIFIER.matcher(schema).matches(),
                    "connection.schema is not a valid identifier: %s", schema);
        }

        BatchFailurePolicy defaultPolicy = ingestConfig.getFailurePolicy() == null
                ? BatchFailurePolicy.ABORT_TABLE
                : ingestConfig.getFailurePolicy();
        Map<SourceTable, BatchFailurePolicy> policies = new EnumMap<>(SourceTable.class);
        for (SourceTable table : SourceTable.values()) {
            policies.put(table, defaultPolicy);
        }
        ingestConfig.getTableFailurePolicies()
                .forEach((name, policy) -> policies.put(SourceTable.fromName(name), policy));

        Map<SourceTable, String> fileNames = new EnumMap<>(SourceTable.class);
        for (SourceTable table : SourceTable.values()) {
            fileNames.put(table, table.getDefaultFileName());
        }
        ingestConfig.getSourceFiles()
                .forEach((name, file) -> fileNames.put(SourceTable.fromName(name), file));

        Set<SourceTable> selected = EnumSet.noneOf(SourceTable.class);
        ingestConfig.getTables().stream().filter(StringUtils::isNotBlank)
                .forEach(name -> selected.add(SourceTable.fromName(name)));
        if (selected.isEmpty()) {
            selected.addAll(EnumSet.allOf(SourceTable.class));
        }

        CheckpointMode mode = ingestConfig.getCheckpointMode() == null ? CheckpointMode.NON_EMPTY
                : ingestConfig.getCheckpointMode();

        return new LoadSettings(sourceDir, batchSize, mode, schema, policies, fileNames, selected);
    }

    /**
     * Returns the source file of a table.
     *
     * @param table destination table
     * @return file under {@link #sourceDir}
     */
    public File resolveSourceFile(SourceTable table) {
        return new File(sourceDir, sourceFileNames.get(table));
    }

    /**
     * Returns the table name used in SQL, prefixed with the schema when one is configured.
     *
     * @param table destination table
     * @return {@code table} or {@code schema.table}
     */
    public String qualify(SourceTable table) {
        return schema == null ? table.getTableName() : schema + "." + table.getTableName();
    }

    /**
     * Returns the batch-failure policy declared for a table.
     *
     * @param table destination table
     * @return policy
     */
    public BatchFailurePolicy failurePolicyFor(SourceTable table) {
        return failurePolicies.get(table);
    }

    /**
     * Returns whether the table takes part in this run.
     *
     * @param table destination table
     * @return {@code true} if selected
     */
    public boolean isSelected(SourceTable table) {
        return selectedTables.contains(table);
    }
}
