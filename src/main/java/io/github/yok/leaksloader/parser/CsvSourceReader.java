package io.github.yok.leaksloader.parser;

import com.google.common.base.Preconditions;
import io.github.yok.leaksloader.model.ColumnSpec;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Streams the data rows of one ICIJ CSV file.
 *
 * <p>
 * The first record is the header. It is normalized by {@link SourceHeader} and every destination
 * column is resolved to a cell index once, before any data row is read. Rows are returned in file
 * order. The file is read as UTF-8 with standard double-quote quoting, so quoted values may span
 * lines.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class CsvSourceReader implements Closeable, Iterable<SourceRow> {

    static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setIgnoreEmptyLines(true).get();

    private final CSVParser parser;

    private final Iterator<CSVRecord> records;

    // destination column name -> cell index (-1 when unresolved)
    private final Map<String, Integer> columnIndex;

    private CsvSourceReader(CSVParser parser, List<ColumnSpec> columns) {
        this.parser = parser;
        this.records = parser.iterator();
        List<String> headerCells = records.hasNext() ? recordValues(records.next())
                : Collections.emptyList();
        SourceHeader header = SourceHeader.of(headerCells);

        Map<String, Integer> idx = new LinkedHashMap<>();
        for (ColumnSpec column : columns) {
            idx.put(column.getName(), header.resolveIndex(column));
        }
        this.columnIndex = Collections.unmodifiableMap(idx);
    }

    /**
     * Opens a source file and resolves the given columns against its header.
     *
     * @param file CSV file
     * @param columns destination columns of the target table
     * @return open reader; the caller must close it
     * @throws IOException if the file cannot be opened
     */
    public static CsvSourceReader open(File file, List<ColumnSpec> columns) throws IOException {
        Preconditions.checkNotNull(file, "file must not be null");
        CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, FORMAT);
        try {
            return new CsvSourceReader(parser, columns);
        } catch (RuntimeException e) {
            parser.close();
            throw e;
        }
    }

    /**
     * Counts the data rows of a file (header excluded).
     *
     * @param file CSV file
     * @return number of data records
     * @throws IOException if the file cannot be read
     */
    public static long countRows(File file) throws IOException {
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, FORMAT)) {
            long records = 0;
            for (CSVRecord ignored : parser) {
                records++;
            }
            return Math.max(0, records - 1);
        }
    }

    /**
     * Returns the destination column names whose aliases are all absent from the header.
     *
     * @return unresolved column names, in column order
     */
    public List<String> getUnresolvedColumns() {
        return columnIndex.entrySet().stream().filter(e -> e.getValue() < 0).map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /**
     * Returns the cell index each destination column reads from.
     *
     * @return column name to cell index ({@code -1} when unresolved)
     */
    public Map<String, Integer> getColumnIndex() {
        return columnIndex;
    }

    /**
     * Returns an iterator over the remaining data rows. Malformed input surfaces as
     * {@link java.io.UncheckedIOException} from {@code hasNext()}/{@code next()}.
     *
     * @return row iterator
     */
    @Override
    public Iterator<SourceRow> iterator() {
        return new Iterator<SourceRow>() {
            @Override
            public boolean hasNext() {
                return records.hasNext();
            }

            @Override
            public SourceRow next() {
                if (!records.hasNext()) {
                    throw new NoSuchElementException();
                }
                return new SourceRow(records.next(), columnIndex);
            }
        };
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }

    private static List<String> recordValues(CSVRecord record) {
        return record.stream().collect(Collectors.toList());
    }
}
