package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.EntityRecord;
import io.github.yok.leaksloader.model.NodeColumns;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.parser.SourceRow;
import java.util.List;

/**
 * Loads {@code nodes-entities.csv} into {@code entities}.
 *
 * <p>
 * The three lifecycle dates (incorporation, inactivation, struck off) are parsed from any of the
 * supported formats; an unparseable date is stored as NULL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class EntityTableLoader extends TableLoader<EntityRecord> {

    @Override
    public SourceTable getTable() {
        return SourceTable.ENTITIES;
    }

    @Override
    public List<ColumnSpec> getColumns() {
        return EntityRecord.COLUMNS;
    }

    @Override
    protected EntityRecord toRecord(SourceRow row) {
        return new EntityRecord(row.text(NodeColumns.NODE_ID), row.text(NodeColumns.NAME),
                row.text(EntityRecord.JURISDICTION), row.text(EntityRecord.JURISDICTION_DESC),
                row.text(NodeColumns.COUNTRY_CODES), row.text(NodeColumns.COUNTRIES),
                row.date(EntityRecord.INCORPORATION_DATE), row.date(EntityRecord.INACTIVATION_DATE),
                row.date(EntityRecord.STRUCK_OFF_DATE), row.text(NodeColumns.STATUS),
                row.text(EntityRecord.SERVICE_PROVIDER), row.text(NodeColumns.SOURCE_ID),
                row.text(NodeColumns.ADDRESS), row.text(NodeColumns.INTERNAL_ID));
    }
}
