package com.rms.cdc.core.envelope;

/**
 * Wire-format version of the JSON documents written by {@link EnvelopeCodec}.
 *
 * <p>A new constant is added, never an existing layout changed, when the wire
 * format has to evolve; readers of stored documents select the layout by version.</p>
 */
public enum EnvelopeVersion {

    /**
     * Keyed upsert: {@code {"data": {...}, "deleted": bool}}.
     * Event data: {@code {"action", "record", "changes", "metadata": {"table_schema", "table_name", "commit_timestamp"}}}.
     */
    V1
}
