package io.github.yok.leaksloader.model;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.List;
import lombok.Value;

/**
 * Directed edge between two nodes, destined for the {@code relationships} table.
 *
 * <p>
 * The node ids are not checked against the node tables; referential integrity belongs to the
 * destination schema.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class RelationshipRecord implements TableRecord {

    public static final ColumnSpec NODE_ID_START =
            ColumnSpec.text("node_id_start", 50, "node_id_start", "start");

    public static final ColumnSpec NODE_ID_END =
            ColumnSpec.text("node_id_end", 50, "node_id_end", "end");

    public static final ColumnSpec REL_TYPE = ColumnSpec.text("rel_type", 100, "rel_type", "type");

    public static final ColumnSpec START_DATE =
            ColumnSpec.date("start_date", "rel_start_date", "start_date");

    public static final ColumnSpec END_DATE = ColumnSpec.date("end_date", "rel_end_date", "end_date");

    /**
     * Columns in insert order.
     */
    public static final List<ColumnSpec> COLUMNS = ImmutableList.of(NODE_ID_START, NODE_ID_END,
            REL_TYPE, NodeColumns.SOURCE_ID, START_DATE, END_DATE);

    String nodeIdStart;
    String nodeIdEnd;
    String relType;
    String sourceId;
    LocalDate startDate;
    LocalDate endDate;

    @Override
    public Object[] toColumnValues() {
        return new Object[] {nodeIdStart, nodeIdEnd, relType, sourceId, startDate, endDate};
    }
}
