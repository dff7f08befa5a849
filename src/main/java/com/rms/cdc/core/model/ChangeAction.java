package com.rms.cdc.core.model;

/**
 * =====================================================================
 * ChangeAction
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Tag of the {@link Change} variant produced by the logical replication
 * decoder.
 *
 * The constant name is used verbatim as:
 *  - the {@code action} of a delivered event
 *  - the operation token of a keyed-delivery key
 *    ({@code prefix.schema.table.<action>.id})
 *
 * LOCKED SEMANTICS
 * ----------------
 * Names and case are part of the wire and key contract and MUST NOT change.
 */
public enum ChangeAction {

    /** Row inserted; the change carries a post-image only. */
    insert,

    /** Row updated; post-image always, pre-image only when the decoder tracks prior values. */
    update,

    /** Row deleted; the change carries a pre-image only. */
    delete
}
