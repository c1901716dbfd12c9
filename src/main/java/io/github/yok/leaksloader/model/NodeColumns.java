package io.github.yok.leaksloader.model;

import lombok.Generated;

/**
 * Column definitions shared by the node tables (entities, officers, intermediaries, addresses)
 * and, for {@link #SOURCE_ID}, by relationships.
 *
 * @author Yasuharu.Okawauchi
 */
public final class NodeColumns {

    public static final ColumnSpec NODE_ID = ColumnSpec.text("node_id", 50);

    public static final ColumnSpec NAME = ColumnSpec.text("name", 500);

    public static final ColumnSpec COUNTRY_CODES = ColumnSpec.text("country_codes", 200);

    public static final ColumnSpec COUNTRIES = ColumnSpec.text("countries", 500);

    // ICIJ releases spell the header "sourceID" (lower-cased to "sourceid") or "source_id"
    public static final ColumnSpec SOURCE_ID =
            ColumnSpec.text("source_id", 100, "sourceid", "source_id");

    public static final ColumnSpec STATUS = ColumnSpec.text("status", 100);

    public static final ColumnSpec INTERNAL_ID = ColumnSpec.text("internal_id", 100);

    public static final ColumnSpec ADDRESS = ColumnSpec.text("address", 1000);

    @Generated
    private NodeColumns() {}
}
