package com.rms.cdc.core.model;

import java.util.List;

/**
 * One table a {@link Consumer} subscribes to.
 *
 * <p>All {@link #columnFilters()} must pass (logical AND). An empty filter
 * list is an unconditional subscription to the table.</p>
 *
 * @param oid           table identifier, compared with {@link Change#tableOid()}
 * @param columnFilters filters applied to the change's fields
 */
public record SourceTable(long oid, List<ColumnFilter> columnFilters) {

    public SourceTable {
        columnFilters = columnFilters == null ? List.of() : List.copyOf(columnFilters);
    }

    public static SourceTable unfiltered(long oid) {
        return new SourceTable(oid, List.of());
    }
}
