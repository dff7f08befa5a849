package com.rms.cdc.core.filter;

/**
 * Outcome of a column filter whose column is absent from the change payload.
 */
public enum MissingColumnPolicy {

    /** The filter fails; a consumer cannot match on a column it never saw. */
    FAIL,

    /** The filter is skipped (treated as passing). */
    PASS
}
