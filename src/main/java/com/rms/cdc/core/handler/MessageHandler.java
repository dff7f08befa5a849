package com.rms.cdc.core.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rms.cdc.core.error.DeliveryWriteException;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.ConsumerEvent;
import com.rms.cdc.core.model.ConsumerRecord;
import com.rms.cdc.core.routing.ConsumerMatcher;
import com.rms.cdc.core.store.ConsumerMessageStore;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * MessageHandler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Fan-out engine: turns one batch of changes into delivery records for every
 * active consumer whose subscription the changes satisfy.
 *
 * FLOW
 * ----
 * 1. Evaluate every (consumer, change) pair with the {@link ConsumerMatcher}
 * 2. Build one delivery record per match, shaped by the consumer's kind
 *      event  → {@link ConsumerEvent}
 *      record → {@link ConsumerRecord}
 * 3. Partition by shape
 * 4. Write each non-empty partition with ONE bulk insert, both inside a
 *    single {@link ConsumerMessageStore#atomically(Mono)} scope
 * 5. Emit the number of delivery records written
 *
 * FAILURE MODEL
 * -------------
 * A failed insert fails the whole batch with {@link DeliveryWriteException};
 * nothing of the batch stays committed. Re-running the same batch produces
 * the same records again: de-duplication across retries belongs to the
 * caller's replication position tracking, which must not advance before
 * this Mono completes.
 *
 * THREADING
 * ---------
 * Matching is pure and runs on the subscribing thread. The handler keeps no
 * state between invocations.
 */
public final class MessageHandler {

    private static final Logger log = LoggerFactory.getLogger(MessageHandler.class);

    private final ConsumerMatcher matcher;
    private final ConsumerMessageStore store;

    public MessageHandler(ConsumerMatcher matcher, ConsumerMessageStore store) {
        this.matcher = Objects.requireNonNull(matcher, "matcher");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Routes a batch of changes to the active consumers and persists the
     * resulting delivery records.
     *
     * @param activeConsumers consumers to route to; empty is allowed
     * @param changes         batch in commit order; empty is allowed
     * @return number of delivery records written (0 when nothing matched)
     */
    public Mono<Integer> handleMessages(List<Consumer> activeConsumers, List<Change> changes) {
        return Mono.defer(() -> {
            FanOut fanOut = fanOut(activeConsumers, changes);
            if (fanOut.total() == 0) {
                log.debug("No delivery records for batch (consumers={} changes={})",
                        sizeOf(activeConsumers), sizeOf(changes));
                return Mono.just(0);
            }

            return store.atomically(write(fanOut))
                    .thenReturn(fanOut.total())
                    .onErrorMap(e -> !(e instanceof DeliveryWriteException),
                            e -> new DeliveryWriteException("Failed to persist delivery records (events="
                                    + fanOut.events().size() + ", records=" + fanOut.records().size() + ")",
                                    sizeOf(changes), e))
                    .doOnSuccess(n -> log.info("Fanned out {} changes to {} delivery records (events={} records={})",
                            sizeOf(changes), n, fanOut.events().size(), fanOut.records().size()));
        });
    }

    /**
     * Evaluates the full consumer × change cross product. Pure.
     */
    FanOut fanOut(List<Consumer> activeConsumers, List<Change> changes) {
        List<ConsumerEvent> events = new ArrayList<>();
        List<ConsumerRecord> records = new ArrayList<>();
        if (activeConsumers == null || changes == null) {
            return new FanOut(events, records);
        }

        for (Consumer consumer : activeConsumers) {
            for (Change change : changes) {
                if (!matcher.matches(consumer, change)) {
                    continue;
                }
                switch (consumer.messageKind()) {
                    case event -> events.add(ConsumerEvent.of(consumer, change));
                    case record -> records.add(ConsumerRecord.of(consumer, change));
                }
                log.debug("Matched consumer={} table_oid={} action={} lsn={}",
                        consumer.id(), change.tableOid(), change.action(), change.commitLsn());
            }
        }
        return new FanOut(List.copyOf(events), List.copyOf(records));
    }

    private Mono<Void> write(FanOut fanOut) {
        Mono<Long> eventsWrite = fanOut.events().isEmpty()
                ? Mono.just(0L)
                : Mono.defer(() -> store.insertConsumerEvents(fanOut.events()));
        Mono<Long> recordsWrite = fanOut.records().isEmpty()
                ? Mono.just(0L)
                : Mono.defer(() -> store.insertConsumerRecords(fanOut.records()));
        return eventsWrite.then(recordsWrite).then();
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }

    /**
     * Delivery records of one batch, partitioned by shape.
     */
    record FanOut(List<ConsumerEvent> events, List<ConsumerRecord> records) {

        int total() {
            return events.size() + records.size();
        }
    }
}
