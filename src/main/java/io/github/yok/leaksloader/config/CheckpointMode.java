package io.github.yok.leaksloader.config;

/**
 * How the checkpoint guard interprets a non-empty destination table.
 *
 * @author Yasuharu.Okawauchi
 */
public enum CheckpointMode {
    // Any row means "already loaded"; a partial load is indistinguishable from a complete one
    NON_EMPTY,
    // Compare with the source row count; a partial table is a fatal error
    STRICT
}
