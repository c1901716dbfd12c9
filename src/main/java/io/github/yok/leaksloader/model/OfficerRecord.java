package io.github.yok.leaksloader.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Officer (director, shareholder, beneficiary) destined for the {@code officers} table.
 *
 * <p>
 * {@code valid_until} is stored as free text; the ICIJ files use it for notes such as "The
 * Panama Papers data is current through 2015" rather than for a date.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class OfficerRecord implements TableRecord {

    public static final ColumnSpec VALID_UNTIL = ColumnSpec.text("valid_until", 100);

    /**
     * Columns in insert order.
     */
    public static final List<ColumnSpec> COLUMNS = ImmutableList.of(NodeColumns.NODE_ID,
            NodeColumns.NAME, NodeColumns.COUNTRY_CODES, NodeColumns.COUNTRIES,
            NodeColumns.SOURCE_ID, VALID_UNTIL);

    String nodeId;
    String name;
    String countryCodes;
    String countries;
    String sourceId;
    String validUntil;

    @Override
    public Object[] toColumnValues() {
        return new Object[] {nodeId, name, countryCodes, countries, sourceId, validUntil};
    }
}
