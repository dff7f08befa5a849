package com.rms.cdc.core.model;

import java.util.Objects;

/**
 * Per-column predicate of a {@link SourceTable} subscription.
 *
 * @param columnAttnum positional column the predicate reads
 * @param operator     comparison to apply
 * @param value        typed literal; ignored by null checks
 */
public record ColumnFilter(int columnAttnum, FilterOperator operator, FilterValue value) {

    public ColumnFilter {
        Objects.requireNonNull(operator, "operator");
        if (value == null) {
            value = FilterValue.nullValue();
        }
        if (operator.isSetOperator() && value.type() != ValueType.LIST) {
            throw new IllegalArgumentException(operator.symbol() + " requires a list literal but was: " + value.type());
        }
    }
}
