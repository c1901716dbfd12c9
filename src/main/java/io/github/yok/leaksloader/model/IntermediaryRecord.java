package io.github.yok.leaksloader.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Intermediary (law firm, bank, corporate agent) destined for the {@code intermediaries} table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class IntermediaryRecord implements TableRecord {

    /**
     * Columns in insert order.
     */
    public static final List<ColumnSpec> COLUMNS = ImmutableList.of(NodeColumns.NODE_ID,
            NodeColumns.NAME, NodeColumns.COUNTRY_CODES, NodeColumns.COUNTRIES,
            NodeColumns.SOURCE_ID, NodeColumns.STATUS, NodeColumns.INTERNAL_ID,
            NodeColumns.ADDRESS);

    String nodeId;
    String name;
    String countryCodes;
    String countries;
    String sourceId;
    String status;
    String internalId;
    String address;

    @Override
    public Object[] toColumnValues() {
        return new Object[] {nodeId, name, countryCodes, countries, sourceId, status, internalId,
                address};
    }
}
