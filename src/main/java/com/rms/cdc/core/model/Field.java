package com.rms.cdc.core.model;

/**
 * One decoded column of a changed row.
 *
 * @param columnAttnum positional column identifier, stable across column renames
 * @param columnName   column name at decode time
 * @param value        decoded runtime value (may be {@code null})
 */
public record Field(int columnAttnum, String columnName, Object value) {
}
