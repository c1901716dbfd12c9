package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.AddressRecord;
import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.NodeColumns;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.parser.SourceRow;
import java.util.List;

/**
 * Loads {@code nodes-addresses.csv} into {@code addresses}.
 *
 * @author Yasuharu.Okawauchi
 */
public class AddressTableLoader extends TableLoader<AddressRecord> {

    @Override
    public SourceTable getTable() {
        return SourceTable.ADDRESSES;
    }

    @Override
    public List<ColumnSpec> getColumns() {
        return AddressRecord.COLUMNS;
    }

    @Override
    protected AddressRecord toRecord(SourceRow row) {
        return new AddressRecord(row.text(NodeColumns.NODE_ID), row.text(AddressRecord.ADDRESS),
                row.text(NodeColumns.COUNTRY_CODES), row.text(NodeColumns.COUNTRIES),
                row.text(NodeColumns.SOURCE_ID));
    }
}
