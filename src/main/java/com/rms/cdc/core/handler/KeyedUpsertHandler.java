package com.rms.cdc.core.handler;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rms.cdc.core.envelope.EnvelopeCodec;
import com.rms.cdc.core.error.DeliveryWriteException;
import com.rms.cdc.core.error.KeyDerivationException;
import com.rms.cdc.core.key.KeyFormatter;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.store.KeyedMessage;
import com.rms.cdc.core.store.KeyedStreamStore;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * KeyedUpsertHandler
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Keyed delivery path: every change becomes one upsert into a keyed
 * stream. The latest change of a row overwrites earlier ones under the
 * same key.
 *
 * FLOW
 * ----
 * 1. Read the row identifier from the delivered image ({@code id} column)
 * 2. Derive the key via {@link KeyFormatter}
 * 3. Encode the envelope via {@link EnvelopeCodec}
 * 4. Upsert via {@link KeyedStreamStore}
 *
 * ERRORS
 * ------
 * - missing id / bad key token → KeyDerivationException, nothing written
 * - store failure              → DeliveryWriteException
 *
 * Batches are written in list order. A change whose key cannot be derived
 * aborts only its own upsert: it is logged at ERROR and the batch moves on.
 * A store failure stops the batch so the caller can retry it in order.
 */
public final class KeyedUpsertHandler {

    private static final Logger log = LoggerFactory.getLogger(KeyedUpsertHandler.class);

    static final String ID_COLUMN = "id";

    private final KeyFormatter keyFormatter;
    private final EnvelopeCodec codec;
    private final KeyedStreamStore store;

    public KeyedUpsertHandler(KeyFormatter keyFormatter, EnvelopeCodec codec, KeyedStreamStore store) {
        this.keyFormatter = Objects.requireNonNull(keyFormatter, "keyFormatter");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Upserts one change.
     *
     * @return the message that was written
     */
    public Mono<KeyedMessage> handleMessage(KeyedDeliveryContext context, Change change) {
        Objects.requireNonNull(context, "context");
        return Mono.fromCallable(() -> toMessage(context, change))
                .flatMap(message -> store.upsert(context.streamId(), List.of(message))
                        .onErrorMap(e -> !(e instanceof DeliveryWriteException),
                                e -> new DeliveryWriteException("Failed to upsert key " + message.key()
                                        + " into " + context.streamId(), 1, e))
                        .doOnSuccess(v -> log.debug("Upserted stream={} key={}", context.streamId(), message.key()))
                        .thenReturn(message));
    }

    /**
     * Upserts a batch of changes in order. Changes without a derivable key
     * are skipped; they are not counted.
     *
     * @return number of messages written
     */
    public Mono<Integer> handleMessages(KeyedDeliveryContext context, List<Change> changes) {
        if (changes == null || changes.isEmpty()) {
            return Mono.just(0);
        }
        return Flux.fromIterable(changes)
                .concatMap(change -> handleMessage(context, change)
                        .onErrorResume(KeyDerivationException.class, e -> {
                            log.error("Skipping change without a derivable key stream={} table={}.{} action={} err={}",
                                    context.streamId(), change.schema(), change.table(), change.action(),
                                    e.getMessage());
                            return Mono.empty();
                        }))
                .count()
                .map(Long::intValue)
                .doOnSuccess(n -> log.info("Upserted {} changes into stream={}", n, context.streamId()));
    }

    KeyedMessage toMessage(KeyedDeliveryContext context, Change change) {
        Objects.requireNonNull(change, "change");
        Object recordId = change.image().get(ID_COLUMN);
        String key = keyFormatter.formatKey(context.keyPrefix(), change, recordId, context.keyFormat());
        return new KeyedMessage(key, codec.encodeUpsert(change));
    }
}
