package com.rms.cdc.core.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Typed literal of a {@link ColumnFilter}.
 *
 * <p>The {@link ValueType} tag is explicit so that a string {@code "42"} and
 * the number {@code 42} never compare equal by accident. Literals are
 * normalised on construction:</p>
 * <ul>
 *   <li>{@code NUMBER}: {@link BigDecimal}</li>
 *   <li>{@code DATETIME}: {@link Instant}</li>
 *   <li>{@code LIST}: {@code List<FilterValue>} of scalar literals</li>
 *   <li>{@code NULL}: {@code null}</li>
 * </ul>
 */
public record FilterValue(ValueType type, Object value) {

    public FilterValue {
        Objects.requireNonNull(type, "type");
        switch (type) {
            case STRING -> requireType(value, String.class, type);
            case NUMBER -> {
                if (value instanceof Number n) {
                    value = toBigDecimal(n);
                } else {
                    requireType(value, BigDecimal.class, type);
                }
            }
            case BOOLEAN -> requireType(value, Boolean.class, type);
            case DATETIME -> requireType(value, Instant.class, type);
            case LIST -> {
                if (!(value instanceof List<?> list)) {
                    throw new IllegalArgumentException("list literal requires a List but was: " + value);
                }
                for (Object element : list) {
                    if (!(element instanceof FilterValue fv) || fv.type() == ValueType.LIST) {
                        throw new IllegalArgumentException("list literal elements must be scalar FilterValues");
                    }
                }
                value = List.copyOf(list);
            }
            case NULL -> {
                if (value != null) {
                    throw new IllegalArgumentException("null literal must not carry a value");
                }
            }
        }
    }

    public static FilterValue string(String value) {
        return new FilterValue(ValueType.STRING, value);
    }

    public static FilterValue number(Number value) {
        return new FilterValue(ValueType.NUMBER, value);
    }

    public static FilterValue bool(boolean value) {
        return new FilterValue(ValueType.BOOLEAN, value);
    }

    public static FilterValue datetime(Instant value) {
        return new FilterValue(ValueType.DATETIME, value);
    }

    public static FilterValue list(List<FilterValue> values) {
        return new FilterValue(ValueType.LIST, values);
    }

    public static FilterValue nullValue() {
        return new FilterValue(ValueType.NULL, null);
    }

    @SuppressWarnings("unchecked")
    public List<FilterValue> elements() {
        if (type != ValueType.LIST) {
            throw new IllegalStateException("not a list literal: " + type);
        }
        return (List<FilterValue>) value;
    }

    static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal bd) {
            return bd;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        if (n instanceof java.math.BigInteger bi) {
            return new BigDecimal(bi);
        }
        return BigDecimal.valueOf(n.longValue());
    }

    private static void requireType(Object value, Class<?> expected, ValueType type) {
        if (!expected.isInstance(value)) {
            throw new IllegalArgumentException(type.tag() + " literal requires " + expected.getSimpleName()
                    + " but was: " + value);
        }
    }
}
