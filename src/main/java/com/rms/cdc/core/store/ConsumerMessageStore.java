package com.rms.cdc.core.store;

import java.util.List;

import com.rms.cdc.core.model.ConsumerEvent;
import com.rms.cdc.core.model.ConsumerRecord;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ConsumerMessageStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Persistence-facing contract of the fan-out path. The core hands over
 * fully built delivery records; the store only writes them.
 *
 *   [ MessageHandler ]
 *          │
 *          ▼
 *   [ ConsumerMessageStore ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ relational store ]
 *
 * BULK CONTRACT
 * -------------
 * Each insert method is ONE round trip for the whole list, whatever its
 * size. Callers never pass an empty list.
 *
 * ATOMICITY
 * ---------
 * {@link #atomically(Mono)} runs the given work in a single transaction:
 * either every insert inside it commits, or none does. The default
 * implementation adds no transaction and is only suitable for stores that
 * are atomic per call and used with a single insert.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono completes → rows are durably written (at commit of the enclosing scope)
 * - Mono errors    → nothing of the call is guaranteed to be written
 */
public interface ConsumerMessageStore {

    /**
     * Inserts event-kind delivery records.
     *
     * @return number of rows written
     */
    Mono<Long> insertConsumerEvents(List<ConsumerEvent> events);

    /**
     * Inserts record-kind delivery records.
     *
     * @return number of rows written
     */
    Mono<Long> insertConsumerRecords(List<ConsumerRecord> records);

    /**
     * Runs {@code work} as one transactional unit.
     */
    default <T> Mono<T> atomically(Mono<T> work) {
        return work;
    }
}
