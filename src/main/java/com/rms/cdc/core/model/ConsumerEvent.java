package com.rms.cdc.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * =====================================================================
 * ConsumerEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Delivery record for a consumer of {@link MessageKind#event}: one per
 * (consumer, matching change), carrying the whole change payload.
 *
 * LIFECYCLE
 * ---------
 * 1. Built by the message handler (ackId == null)
 * 2. Bulk-inserted; the store assigns the ackId
 * 3. Read, acknowledged and deleted by the pull side
 *
 * Never mutated after creation.
 */
public record ConsumerEvent(

        /** Owning consumer; deleting the consumer cascades to its events. */
        UUID consumerId,

        long tableOid,

        /** Commit time of the source transaction in microseconds since the epoch. */
        long commitLsn,

        /** Primary-key values as strings, in key column order. */
        List<String> recordPks,

        ConsumerEventData data,

        /** Acknowledgement handle; {@code null} until persisted. */
        UUID ackId) {

    public ConsumerEvent {
        Objects.requireNonNull(consumerId, "consumerId");
        Objects.requireNonNull(data, "data");
        recordPks = recordPks == null ? List.of() : List.copyOf(recordPks);
    }

    /** Builds the unpersisted event for a (consumer, change) match. */
    public static ConsumerEvent of(Consumer consumer, Change change) {
        return new ConsumerEvent(consumer.id(), change.tableOid(), change.commitLsn(), change.recordPks(),
                ConsumerEventData.from(change), null);
    }
}
