package io.github.yok.leaksloader.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.sql.Types;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Definition of one destination column.
 *
 * <p>
 * Holds the column name, its JDBC type, the maximum width in characters (text columns only) and
 * the source header names that may carry its value, most specific first.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
public final class ColumnSpec {

    // Destination column name (lower case)
    private final String name;

    // JDBC type used when binding NULL (Types.VARCHAR or Types.DATE)
    private final int sqlType;

    // Maximum width in characters; 0 for date columns
    private final int maxLength;

    // Source header aliases in priority order
    private final List<String> aliases;

    private ColumnSpec(String name, int sqlType, int maxLength, String... aliases) {
        Preconditions.checkArgument(name != null && !name.isBlank(), "name must not be blank");
        this.name = name;
        this.sqlType = sqlType;
        this.maxLength = maxLength;
        this.aliases = aliases.length == 0 ? ImmutableList.of(name) : ImmutableList.copyOf(aliases);
    }

    /**
     * Creates a text column truncated to {@code maxLength} characters.
     *
     * @param name destination column name
     * @param maxLength maximum width in characters
     * @param aliases source header names, most specific first; defaults to {@code name}
     * @return column definition
     */
    public static ColumnSpec text(String name, int maxLength, String... aliases) {
        Preconditions.checkArgument(maxLength > 0, "maxLength must be positive: %s", maxLength);
        return new ColumnSpec(name, Types.VARCHAR, maxLength, aliases);
    }

    /**
     * Creates an optional calendar date column.
     *
     * @param name destination column name
     * @param aliases source header names, most specific first; defaults to {@code name}
     * @return column definition
     */
    public static ColumnSpec date(String name, String... aliases) {
        return new ColumnSpec(name, Types.DATE, 0, aliases);
    }

    /**
     * Returns whether this column holds a calendar date.
     *
     * @return {@code true} for date columns
     */
    public boolean isDate() {
        return sqlType == Types.DATE;
    }
}
