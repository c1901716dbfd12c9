package io.github.yok.leaksloader.parser;

import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.util.FieldNormalizer;
import java.time.LocalDate;
import java.util.Map;
import org.apache.commons.csv.CSVRecord;

/**
 * One data row of a source file, with access by destination column.
 *
 * <p>
 * Cells are read through the alias resolution done once per file by {@link CsvSourceReader}. A
 * column whose aliases are all absent from the header, or a cell beyond the end of a short row,
 * reads as {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class SourceRow {

    private final CSVRecord record;

    // destination column name -> cell index (-1 when unresolved)
    private final Map<String, Integer> columnIndex;

    SourceRow(CSVRecord record, Map<String, Integer> columnIndex) {
        this.record = record;
        this.columnIndex = columnIndex;
    }

    /**
     * Returns the raw cell text for the column.
     *
     * @param column destination column
     * @return raw text, or {@code null} if the column is unresolved or the row is short
     */
    public String raw(ColumnSpec column) {
        Integer idx = columnIndex.get(column.getName());
        if (idx == null || idx < 0 || idx >= record.size()) {
            return null;
        }
        return record.get(idx);
    }

    /**
     * Returns the cell as text truncated to the column width.
     *
     * @param column text column
     * @return normalized text or {@code null}
     */
    public String text(ColumnSpec column) {
        return FieldNormalizer.truncate(raw(column), column.getMaxLength());
    }

    /**
     * Returns the cell parsed as a calendar date.
     *
     * @param column date column
     * @return parsed date or {@code null}
     */
    public LocalDate date(ColumnSpec column) {
        return FieldNormalizer.parseDate(raw(column)).orElse(null);
    }
}
