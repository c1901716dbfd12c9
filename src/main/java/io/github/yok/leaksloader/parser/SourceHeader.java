package io.github.yok.leaksloader.parser;

import io.github.yok.leaksloader.model.ColumnSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalized header row of a source file.
 *
 * <p>
 * Header names are lower-cased, trimmed and stripped of a leading byte order mark. When a name
 * occurs more than once the first occurrence wins.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SourceHeader {

    private static final String BOM = "\uFEFF";

    // normalized header name -> zero-based cell index
    private final Map<String, Integer> index;

    private SourceHeader(Map<String, Integer> index) {
        this.index = Collections.unmodifiableMap(index);
    }

    /**
     * Builds a header from the raw names of the first record.
     *
     * @param rawNames header cells as read from the file
     * @return normalized header
     */
    public static SourceHeader of(List<String> rawNames) {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < rawNames.size(); i++) {
            index.putIfAbsent(normalize(rawNames.get(i)), i);
        }
        return new SourceHeader(index);
    }

    /**
     * Normalizes one header name.
     *
     * @param raw raw header cell, may be {@code null}
     * @return lower-cased, trimmed name without BOM; empty for {@code null}
     */
    public static String normalize(String raw) {
        String name = StringUtils.removeStart(StringUtils.defaultString(raw), BOM);
        return name.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the source header name that carries the column, i.e. the first of its aliases that
     * is present.
     *
     * @param column destination column
     * @return the matched header name, or empty if none of the aliases is present
     */
    public Optional<String> resolveName(ColumnSpec column) {
        return column.getAliases().stream().filter(index::containsKey).findFirst();
    }

    /**
     * Returns the cell index that carries the column.
     *
     * @param column destination column
     * @return zero-based index, or {@code -1} if none of the aliases is present
     */
    public int resolveIndex(ColumnSpec column) {
        return resolveName(column).map(index::get).orElse(-1);
    }

    /**
     * Returns the normalized header names in file order.
     *
     * @return header names
     */
    public List<String> getNames() {
        return List.copyOf(index.keySet());
    }
}
