package io.github.yok.leaksloader.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Registered address destined for the {@code addresses} table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class AddressRecord implements TableRecord {

    // Some releases carry the address text in a "name" column
    public static final ColumnSpec ADDRESS = ColumnSpec.text("address", 2000, "address", "name");

    /**
     * Columns in insert order.
     */
    public static final List<ColumnSpec> COLUMNS = ImmutableList.of(NodeColumns.NODE_ID, ADDRESS,
            NodeColumns.COUNTRY_CODES, NodeColumns.COUNTRIES, NodeColumns.SOURCE_ID);

    String nodeId;
    String address;
    String countryCodes;
    String countries;
    String sourceId;

    @Override
    public Object[] toColumnValues() {
        return new Object[] {nodeId, address, countryCodes, countries, sourceId};
    }
}
