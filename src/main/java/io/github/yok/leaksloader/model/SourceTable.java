package io.github.yok.leaksloader.model;

import java.util.Arrays;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Destination tables in load order.
 *
 * <p>
 * Relationships come last because they reference the four node tables by node id. The order of
 * the constants is the order in which the orchestrator runs the loaders.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum SourceTable {

    ENTITIES("entities", "nodes-entities.csv"),

    OFFICERS("officers", "nodes-officers.csv"),

    INTERMEDIARIES("intermediaries", "nodes-intermediaries.csv"),

    ADDRESSES("addresses", "nodes-addresses.csv"),

    RELATIONSHIPS("relationships", "relationships.csv");

    // Destination table name
    private final String tableName;

    // Source file name under the data directory
    private final String defaultFileName;

    /**
     * Resolves a table by its destination name (case-insensitive, surrounding blanks ignored).
     *
     * @param name table name such as {@code "officers"}
     * @return matching constant
     * @throws IllegalArgumentException if no table has that name
     */
    public static SourceTable fromName(String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.tableName.equals(key)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown table: " + name
                        + " (expected one of " + Arrays.toString(values()) + ")"));
    }
}
