package com.rms.cdc.jetstream.kv;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.cdc.core.store.KeyedMessage;
import com.rms.cdc.core.store.KeyedStreamStore;

import io.nats.client.Connection;
import io.nats.client.KeyValue;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * =====================================================================
 * JetStreamKeyValueStore
 * =====================================================================
 *
 * PURPOSE
 * -------
 * {@link KeyedStreamStore} backed by a JetStream key/value bucket. The
 * stream id is the bucket name; each message is one {@code put}, which
 * replaces the previous value of the key and bumps its revision.
 *
 * BLOCKING
 * --------
 * jNATS calls block until the server acknowledges. They run on
 * boundedElastic, never on the caller's thread.
 *
 * Bucket handles are cached per stream id; the bucket itself is created by
 * {@link com.rms.cdc.jetstream.bootstrap.KeyValueBootstrapper}.
 */
@Component
public class JetStreamKeyValueStore implements KeyedStreamStore {

    private static final Logger log = LoggerFactory.getLogger(JetStreamKeyValueStore.class);

    private final Connection connection;

    private final Map<String, KeyValue> buckets = new ConcurrentHashMap<>();

    public JetStreamKeyValueStore(Connection connection) {
        this.connection = connection;
    }

    @Override
    public Mono<Void> upsert(String streamId, List<KeyedMessage> messages) {
        if (messages == null || messages.isEmpty()) {
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                    KeyValue kv = bucket(streamId);
                    for (KeyedMessage message : messages) {
                        // Blocking: waits for the server to store the new revision.
                        long revision = kv.put(message.key(), message.data());
                        log.debug("KV put bucket={} key={} revision={}", streamId, message.key(), revision);
                    }
                    return messages.size();
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }

    private KeyValue bucket(String streamId) {
        return buckets.computeIfAbsent(streamId, name -> {
            try {
                return connection.keyValue(name);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to open key/value bucket " + name, e);
            }
        });
    }
}
