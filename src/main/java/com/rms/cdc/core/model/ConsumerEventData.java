package com.rms.cdc.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of a {@link ConsumerEvent}.
 *
 * @param action   change variant
 * @param record   post-image for insert/update, pre-image for delete
 * @param changes  prior values of modified columns; {@code null} unless the decoder tracked them
 * @param metadata source table and commit information
 */
public record ConsumerEventData(ChangeAction action, Map<String, Object> record, Map<String, Object> changes,
                                Metadata metadata) {

    public ConsumerEventData {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(metadata, "metadata");
    }

    /** Builds the payload for a change. */
    public static ConsumerEventData from(Change change) {
        return new ConsumerEventData(
                change.action(),
                change.image(),
                change.changes(),
                new Metadata(change.schema(), change.table(), change.commitTimestamp()));
    }

    public record Metadata(String tableSchema, String tableName, Instant commitTimestamp) {
    }
}
