package io.github.yok.leaksloader.core;

import io.github.yok.leaksloader.model.ColumnSpec;
import io.github.yok.leaksloader.model.NodeColumns;
import io.github.yok.leaksloader.model.RelationshipRecord;
import io.github.yok.leaksloader.model.SourceTable;
import io.github.yok.leaksloader.parser.SourceRow;
import java.util.List;

/**
 * Loads {@code relationships.csv} into {@code relationships}.
 *
 * <p>
 * Older releases name the endpoint columns {@code start}/{@code end} and the type column
 * {@code type}; both spellings are accepted, the long one taking precedence when a file carries
 * both.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RelationshipTableLoader extends TableLoader<RelationshipRecord> {

    @Override
    public SourceTable getTable() {
        return SourceTable.RELATIONSHIPS;
    }

    @Override
    public List<ColumnSpec> getColumns() {
        return RelationshipRecord.COLUMNS;
    }

    @Override
    protected RelationshipRecord toRecord(SourceRow row) {
        return new RelationshipRecord(row.text(RelationshipRecord.NODE_ID_START),
                row.text(RelationshipRecord.NODE_ID_END), row.text(RelationshipRecord.REL_TYPE),
                row.text(NodeColumns.SOURCE_ID), row.date(RelationshipRecord.START_DATE),
                row.date(RelationshipRecord.END_DATE));
    }
}
