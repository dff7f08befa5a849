package com.rms.cdc.core.key;

/**
 * Key naming scheme of the keyed delivery path.
 *
 * <pre>
 * BASIC          : prefix.schema.table.id
 * WITH_OPERATION : prefix.schema.table.action.id
 * </pre>
 *
 * <p>Changing the scheme of a live stream orphans every key written before.</p>
 */
public enum KeyFormat {
    BASIC,
    WITH_OPERATION
}
