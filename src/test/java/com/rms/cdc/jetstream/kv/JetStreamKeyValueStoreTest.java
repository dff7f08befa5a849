package com.rms.cdc.jetstream.kv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rms.cdc.core.store.KeyedMessage;

import io.nats.client.Connection;
import io.nats.client.KeyValue;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class JetStreamKeyValueStoreTest {

    @Mock
    private Connection connection;

    @Mock
    private KeyValue kv;

    @InjectMocks
    private JetStreamKeyValueStore store;

    private static KeyedMessage message(String key, String json) {
        return new KeyedMessage(key, json.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void putsEveryMessageInOrder() throws Exception {
        when(connection.keyValue("CDC_ROWS")).thenReturn(kv);
        when(kv.put(any(String.class), any(byte[].class))).thenReturn(1L, 2L);

        StepVerifier.create(store.upsert("CDC_ROWS", List.of(
                        message("db.public.orders.1", "{\"a\":1}"),
                        message("db.public.orders.1", "{\"a\":2}"))))
                .verifyComplete();

        InOrder order = inOrder(kv);
        order.verify(kv).put("db.public.orders.1", "{\"a\":1}".getBytes(StandardCharsets.UTF_8));
        order.verify(kv).put("db.public.orders.1", "{\"a\":2}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void bucketHandleIsReused() throws Exception {
        when(connection.keyValue("CDC_ROWS")).thenReturn(kv);
        when(kv.put(any(String.class), any(byte[].class))).thenReturn(1L);

        StepVerifier.create(store.upsert("CDC_ROWS", List.of(message("k1", "{}")))).verifyComplete();
        StepVerifier.create(store.upsert("CDC_ROWS", List.of(message("k2", "{}")))).verifyComplete();

        verify(connection, times(1)).keyValue("CDC_ROWS");
    }

    @Test
    void concurrentUpsertsOpenTheBucketOnce() throws Exception {
        when(connection.keyValue("CDC_ROWS")).thenReturn(kv);
        when(kv.put(any(String.class), any(byte[].class))).thenReturn(1L);

        StepVerifier.create(Flux.range(0, 16)
                        .flatMap(i -> store.upsert("CDC_ROWS", List.of(message("k" + i, "{}")))))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        verify(connection, times(1)).keyValue("CDC_ROWS");
        verify(kv, times(16)).put(any(String.class), any(byte[].class));
    }

    @Test
    void bucketThatCannotBeOpenedIsRetriedOnTheNextCall() throws Exception {
        when(connection.keyValue("CDC_ROWS")).thenThrow(new IOException("no bucket")).thenReturn(kv);
        when(kv.put(any(String.class), any(byte[].class))).thenReturn(1L);

        StepVerifier.create(store.upsert("CDC_ROWS", List.of(message("k1", "{}"))))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(UncheckedIOException.class)
                        .hasRootCauseMessage("no bucket"))
                .verify();
        StepVerifier.create(store.upsert("CDC_ROWS", List.of(message("k1", "{}")))).verifyComplete();

        verify(connection, times(2)).keyValue("CDC_ROWS");
    }

    @Test
    void putFailureStopsTheCallAndPropagates() throws Exception {
        when(connection.keyValue("CDC_ROWS")).thenReturn(kv);
        when(kv.put(eq("k1"), any(byte[].class))).thenThrow(new IOException("timeout"));

        StepVerifier.create(store.upsert("CDC_ROWS", List.of(message("k1", "{}"), message("k2", "{}"))))
                .expectErrorMessage("timeout")
                .verify();

        verify(kv, never()).put(eq("k2"), any(byte[].class));
    }

    @Test
    void emptyBatchDoesNotTouchNats() {
        StepVerifier.create(store.upsert("CDC_ROWS", List.of())).verifyComplete();

        verifyNoInteractions(connection);
    }
}
