package com.rms.cdc.core.model;

import java.util.Locale;

/**
 * Closed set of column filter operators.
 *
 * <p>Each operator carries the symbol used in persisted consumer
 * configuration ({@code "=="}, {@code "in"}, ...).</p>
 */
public enum FilterOperator {

    EQ("=="),
    NEQ("!="),
    GT(">"),
    LT("<"),
    GTE(">="),
    LTE("<="),
    IN("in"),
    NOT_IN("not_in"),
    IS_NULL("is_null"),
    NOT_NULL("not_null");

    private final String symbol;

    FilterOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Operators that take a {@link ValueType#LIST} literal. */
    public boolean isSetOperator() {
        return this == IN || this == NOT_IN;
    }

    /** Operators that only inspect nullness and ignore the literal. */
    public boolean isNullCheck() {
        return this == IS_NULL || this == NOT_NULL;
    }

    /**
     * Resolves a persisted symbol (or enum name) to an operator.
     *
     * @throws IllegalArgumentException for unknown symbols
     */
    public static FilterOperator fromSymbol(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("operator is required");
        }
        String s = raw.trim();
        for (FilterOperator op : values()) {
            if (op.symbol.equals(s) || op.name().equals(s.toUpperCase(Locale.ROOT))) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + raw);
    }
}
