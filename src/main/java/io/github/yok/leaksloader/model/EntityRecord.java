package io.github.yok.leaksloader.model;

import com.google.common.collect.ImmutableList;
import java.time.LocalDate;
import java.util.List;
import lombok.Value;

/**
 * Offshore entity (company, trust, foundation) destined for the {@code entities} table.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class EntityRecord implements TableRecord {

    public static final ColumnSpec JURISDICTION = ColumnSpec.text("jurisdiction", 200);

    public static final ColumnSpec JURISDICTION_DESC = ColumnSpec.text("jurisdiction_desc", 500,
            "jurisdiction_description", "jurisdiction_desc");

    public static final ColumnSpec INCORPORATION_DATE = ColumnSpec.date("incorporation_date");

    public static final ColumnSpec INACTIVATION_DATE = ColumnSpec.date("inactivation_date");

    public static final ColumnSpec STRUCK_OFF_DATE = ColumnSpec.date("struck_off_date");

    public static final ColumnSpec SERVICE_PROVIDER = ColumnSpec.text("service_provider", 200);

    /**
     * Columns in insert order.
     */
    public static final List<ColumnSpec> COLUMNS = ImmutableList.of(NodeColumns.NODE_ID,
            NodeColumns.NAME, JURISDICTION, JURISDICTION_DESC, NodeColumns.COUNTRY_CODES,
            NodeColumns.COUNTRIES, INCORPORATION_DATE, INACTIVATION_DATE, STRUCK_OFF_DATE,
            NodeColumns.STATUS, SERVICE_PROVIDER, NodeColumns.SOURCE_ID, NodeColumns.ADDRESS,
            NodeColumns.INTERNAL_ID);

    String nodeId;
    String name;
    String jurisdiction;
    String jurisdictionDesc;
    String countryCodes;
    String countries;
    LocalDate incorporationDate;
    LocalDate inactivationDate;
    LocalDate struckOffDate;
    String status;
    String serviceProvider;
    String sourceId;
    String address;
    String internalId;

    @Override
    public Object[] toColumnValues() {
        return new Object[] {nodeId, name, jurisdiction, jurisdictionDesc, countryCodes, countries,
                incorporationDate, inactivationDate, struckOffDate, status, serviceProvider,
                sourceId, address, internalId};
    }
}
