package io.github.yok.leaksloader.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code ingest} section in {@code application.yml}.
 *
 * <pre>
 * ingest:
 *   batch-size: 5000
 *   failure-policy: ABORT_TABLE
 *   table-failure-policies:
 *     entities: SKIP_BATCH
 *   checkpoint-mode: NON_EMPTY
 *   tables: []
 *   source-files:
 *     relationships: relationships.csv
 * </pre>
 *
 * <p>
 * Map keys and {@code tables} entries are destination table names. The values are read once into
 * {@link LoadSettings}; loaders never consult this class directly.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "ingest")
@Data
public class IngestConfig {

    /**
     * Number of rows per insert batch (one commit per batch).
     */
    private int batchSize = 5000;

    /**
     * Policy applied to every table without an entry in {@link #tableFailurePolicies}.
     */
    private BatchFailurePolicy failurePolicy = BatchFailurePolicy.ABORT_TABLE;

    /**
     * Per-table policy overrides.
     */
    private Map<String, BatchFailurePolicy> tableFailurePolicies = new LinkedHashMap<>();

    /**
     * Interpretation of non-empty destination tables.
     */
    private CheckpointMode checkpointMode = CheckpointMode.NON_EMPTY;

    /**
     * Tables to process; empty means all five.
     */
    private List<String> tables = new ArrayList<>();

    /**
     * Source file name overrides relative to the data directory.
     */
    private Map<String, String> sourceFiles = new LinkedHashMap<>();
}
