package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.NodeColumns;
import io.github.yok.leaksloader.model.OfficerRecord;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.parser.SourceRow;
import java.util.List;

/**
 * Loads {@code nodes-officers.csv} into {@code officers}.
 *
 * @author Yasuharu.Okawauchi
 */
public class OfficerTableLoader extends TableLoader<OfficerRecord> {

    @Override
    public SourceTable getTable() {
        return SourceTable.OFFICERS;
    }

    @Override
    public List<ColumnSpec> getColumns() {
        return OfficerRecord.COLUMNS;
    }

    @Override
    protected OfficerRecord toRecord(SourceRow row) {
        return new OfficerRecord(row.text(NodeColumns.NODE_ID), row.text(NodeColumns.NAME),
                row.text(NodeColumns.COUNTRY_CODES), row.text(NodeColumns.COUNTRIES),
                row.text(NodeColumns.SOURCE_ID), row.text(OfficerRecord.VALID_UNTIL));
    }
}
