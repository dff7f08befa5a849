package com.rms.cdc.core.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rms.cdc.core.ChangeFixtures;
import com.rms.cdc.core.error.DeliveryWriteException;
import com.rms.cdc.core.filter.ColumnFilterEvaluator;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ChangeAction;
import com.rms.cdc.core.model.Consumer;
import com.rms.cdc.core.model.ConsumerEvent;
import com.rms.cdc.core.model.ConsumerRecord;
import com.rms.cdc.core.model.ConsumerRecordState;
import com.rms.cdc.core.model.MessageKind;
import com.rms.cdc.core.model.SourceTable;
import com.rms.cdc.core.routing.ConsumerMatcher;
import com.rms.cdc.core.store.ConsumerMessageStore;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class MessageHandlerTest {

    @Mock
    private ConsumerMessageStore store;

    @Captor
    private ArgumentCaptor<List<ConsumerEvent>> events;

    @Captor
    private ArgumentCaptor<List<ConsumerRecord>> records;

    private MessageHandler handler;

    @BeforeEach
    void setUp() {
        handler = new MessageHandler(new ConsumerMatcher(new ColumnFilterEvaluator()), store);
    }

    private void storeAcceptsEverything() {
        when(store.atomically(any())).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void singleInsertBecomesOneEvent() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.just(1L));
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));
        Change change = ChangeFixtures.insert(1, "test");

        StepVerifier.create(handler.handleMessages(List.of(consumer), List.of(change)))
                .expectNext(1)
                .verifyComplete();

        verify(store).insertConsumerEvents(events.capture());
        ConsumerEvent event = events.getValue().get(0);
        assertThat(event.consumerId()).isEqualTo(consumer.id());
        assertThat(event.tableOid()).isEqualTo(ChangeFixtures.ORDERS_OID);
        assertThat(event.commitLsn()).isEqualTo(change.commitLsn());
        assertThat(event.recordPks()).containsExactly("1");
        assertThat(event.ackId()).isNull();
        assertThat(event.data().action()).isEqualTo(ChangeAction.insert);
        assertThat(event.data().changes()).isNull();
        assertThat(event.data().metadata().tableName()).isEqualTo("orders");
        assertThat(event.data().metadata().tableSchema()).isEqualTo("public");
        assertThat(event.data().metadata().commitTimestamp()).isEqualTo(ChangeFixtures.COMMITTED_AT);
        verify(store, never()).insertConsumerRecords(anyList());
    }

    @Test
    void filterSelectsOnlyMatchingChanges() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.just(1L));
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, ChangeFixtures.nameEquals("test"));

        StepVerifier.create(handler.handleMessages(List.of(consumer),
                        List.of(ChangeFixtures.insert(1, "test"), ChangeFixtures.insert(2, "not_test"))))
                .expectNext(1)
                .verifyComplete();

        verify(store).insertConsumerEvents(events.capture());
        assertThat(events.getValue()).extracting(ConsumerEvent::recordPks).containsExactly(List.of("1"));
    }

    @Test
    void multiTableConsumersGetOneDeliveryPerSubscribedTable() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.just(2L));
        when(store.insertConsumerRecords(anyList())).thenReturn(Mono.just(2L));
        Consumer eventConsumer = ChangeFixtures.consumer(MessageKind.event,
                SourceTable.unfiltered(ChangeFixtures.ORDERS_OID), SourceTable.unfiltered(ChangeFixtures.ITEMS_OID));
        Consumer recordConsumer = ChangeFixtures.consumer(MessageKind.record,
                SourceTable.unfiltered(ChangeFixtures.ORDERS_OID), SourceTable.unfiltered(ChangeFixtures.ITEMS_OID));

        StepVerifier.create(handler.handleMessages(List.of(eventConsumer, recordConsumer),
                        List.of(ChangeFixtures.insert(1, "order"), ChangeFixtures.insertItem(2, "item"))))
                .expectNext(4)
                .verifyComplete();

        verify(store).insertConsumerEvents(events.capture());
        verify(store).insertConsumerRecords(records.capture());
        assertThat(events.getValue())
                .allSatisfy(e -> assertThat(e.consumerId()).isEqualTo(eventConsumer.id()))
                .extracting(ConsumerEvent::tableOid)
                .containsExactlyInAnyOrder(ChangeFixtures.ORDERS_OID, ChangeFixtures.ITEMS_OID);
        assertThat(events.getValue())
                .filteredOn(e -> e.tableOid() == ChangeFixtures.ITEMS_OID)
                .singleElement()
                .satisfies(e -> assertThat(e.data().metadata().tableName()).isEqualTo("items"));
        assertThat(records.getValue())
                .allSatisfy(r -> assertThat(r.consumerId()).isEqualTo(recordConsumer.id()))
                .extracting(ConsumerRecord::tableOid)
                .containsExactlyInAnyOrder(ChangeFixtures.ORDERS_OID, ChangeFixtures.ITEMS_OID);
    }

    @Test
    void everyConsumerGetsEveryMatchingChange() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.just(4L));
        Consumer first = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));
        Consumer second = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        StepVerifier.create(handler.handleMessages(List.of(first, second),
                        List.of(ChangeFixtures.insert(1, "a"), ChangeFixtures.insert(2, "b"))))
                .expectNext(4)
                .verifyComplete();

        verify(store).insertConsumerEvents(events.capture());
        assertThat(events.getValue()).hasSize(4)
                .extracting(ConsumerEvent::consumerId)
                .containsExactly(first.id(), first.id(), second.id(), second.id());
    }

    @Test
    void mixedKindsAreWrittenOncePerKindInOneScope() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.just(1L));
        when(store.insertConsumerRecords(anyList())).thenReturn(Mono.just(1L));
        Consumer eventConsumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));
        Consumer recordConsumer = ChangeFixtures.consumer(MessageKind.record, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        StepVerifier.create(handler.handleMessages(List.of(eventConsumer, recordConsumer),
                        List.of(ChangeFixtures.delete(9, "gone"))))
                .expectNext(2)
                .verifyComplete();

        verify(store).atomically(any());
        verify(store).insertConsumerEvents(events.capture());
        verify(store).insertConsumerRecords(records.capture());
        assertThat(events.getValue()).singleElement()
                .satisfies(e -> assertThat(e.data().record()).containsEntry("name", "gone"));
        assertThat(records.getValue()).singleElement()
                .satisfies(r -> {
                    assertThat(r.consumerId()).isEqualTo(recordConsumer.id());
                    assertThat(r.state()).isEqualTo(ConsumerRecordState.available);
                    assertThat(r.recordPks()).containsExactly("9");
                });
    }

    @Test
    void nothingMatchedWritesNothing() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(99L));

        StepVerifier.create(handler.handleMessages(List.of(consumer), List.of(ChangeFixtures.insert(1, "a"))))
                .expectNext(0)
                .verifyComplete();

        verifyNoInteractions(store);
    }

    @Test
    void emptyInputsWriteNothing() {
        StepVerifier.create(handler.handleMessages(List.of(), List.of()))
                .expectNext(0)
                .verifyComplete();

        verifyNoInteractions(store);
    }

    @Test
    void storeFailureFailsTheWholeBatch() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.error(new IllegalStateException("db down")));
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        StepVerifier.create(handler.handleMessages(List.of(consumer),
                        List.of(ChangeFixtures.insert(1, "a"), ChangeFixtures.insert(2, "b"))))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(DeliveryWriteException.class).hasRootCauseMessage("db down");
                    assertThat(((DeliveryWriteException) e).getBatchSize()).isEqualTo(2);
                })
                .verify();
    }

    @Test
    void eventFailureSkipsTheRecordInsert() {
        storeAcceptsEverything();
        when(store.insertConsumerEvents(anyList())).thenReturn(Mono.error(new IllegalStateException("db down")));
        Consumer eventConsumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));
        Consumer recordConsumer = ChangeFixtures.consumer(MessageKind.record, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        StepVerifier.create(handler.handleMessages(List.of(eventConsumer, recordConsumer),
                        List.of(ChangeFixtures.insert(1, "a"))))
                .expectError(DeliveryWriteException.class)
                .verify();

        verify(store, never()).insertConsumerRecords(anyList());
    }

    @Test
    void nothingIsWrittenUntilSubscribed() {
        Consumer consumer = ChangeFixtures.consumer(MessageKind.event, SourceTable.unfiltered(ChangeFixtures.ORDERS_OID));

        handler.handleMessages(List.of(consumer), List.of(ChangeFixtures.insert(1, "a")));

        verifyNoInteractions(store);
    }
}
