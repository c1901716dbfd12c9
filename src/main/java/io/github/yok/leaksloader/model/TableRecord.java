package io.github.yok.leaksloader.model;

/**
 * A normalized row ready to be inserted into its destination table.
 *
 * @author Yasuharu.Okawauchi
 */
public interface TableRecord {

    /**
     * Returns the column values in the order of the owning table's column list. Absent values are
     * {@code null}; dates are {@link java.time.LocalDate}; everything else is {@link String}.
     *
     * @return column values
     */
    Object[] toColumnValues();
}
