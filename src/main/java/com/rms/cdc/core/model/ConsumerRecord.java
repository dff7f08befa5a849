package com.rms.cdc.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Delivery record for a consumer of {@link MessageKind#record}: one per
 * (consumer, matching change), pointing at the changed row rather than
 * carrying its payload.
 *
 * @param ackId {@code null} until persisted
 */
public record ConsumerRecord(UUID consumerId, long tableOid, long commitLsn, List<String> recordPks,
                             ConsumerRecordState state, UUID ackId) {

    public ConsumerRecord {
        Objects.requireNonNull(consumerId, "consumerId");
        Objects.requireNonNull(state, "state");
        recordPks = recordPks == null ? List.of() : List.copyOf(recordPks);
    }

    /** Builds the unpersisted, {@code available} record for a (consumer, change) match. */
    public static ConsumerRecord of(Consumer consumer, Change change) {
        return new ConsumerRecord(consumer.id(), change.tableOid(), change.commitLsn(), change.recordPks(),
                ConsumerRecordState.available, null);
    }
}
