package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.IntermediaryRecord;
import io.github.yok.leaksloader.model.NodeColumns;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.parser.SourceRow;
import java.util.List;

/**
 * Loads {@code nodes-intermediaries.csv} into {@code intermediaries}.
 *
 * @author Yasuharu.Okawauchi
 */
public class IntermediaryTableLoader extends TableLoader<IntermediaryRecord> {

    @Override
    public SourceTable getTable() {
        return SourceTable.INTERMEDIARIES;
    }

    @Override
    public List<ColumnSpec> getColumns() {
        return IntermediaryRecord.COLUMNS;
    }

    @Override
    protected IntermediaryRecord toRecord(SourceRow row) {
        return new IntermediaryRecord(row.text(NodeColumns.NODE_ID), row.text(NodeColumns.NAME),
                row.text(NodeColumns.COUNTRY_CODES), row.text(NodeColumns.COUNTRIES),
                row.text(NodeColumns.SOURCE_ID), row.text(NodeColumns.STATUS),
                row.text(NodeColumns.INTERNAL_ID), row.text(NodeColumns.ADDRESS));
    }
}
