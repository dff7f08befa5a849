package com.rms.cdc.core.store;

import java.util.List;

import reactor.core.publisher.Mono;

/**
 * Addressable key/value stream with upsert semantics.
 *
 * <p>Implementations MUST:</p>
 * <ul>
 *   <li>replace any existing value under the same key (last write wins)</li>
 *   <li>write the messages of one call in list order</li>
 *   <li>propagate failures via {@code Mono.error(...)}</li>
 * </ul>
 */
public interface KeyedStreamStore {

    /**
     * Upserts messages into the stream identified by {@code streamId}.
     *
     * @return Mono that completes once every message is accepted by the store
     */
    Mono<Void> upsert(String streamId, List<KeyedMessage> messages);
}
