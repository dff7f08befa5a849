package com.rms.cdc.core.handler;

import java.util.Objects;

import com.rms.cdc.core.key.KeyFormat;

/**
 * Target of the keyed delivery path.
 *
 * @param streamId  keyed stream the upserts go to
 * @param keyPrefix leading key segment, typically the source database name
 * @param keyFormat key naming scheme
 */
public record KeyedDeliveryContext(String streamId, String keyPrefix, KeyFormat keyFormat) {

    public KeyedDeliveryContext {
        if (streamId == null || streamId.isBlank()) {
            throw new IllegalArgumentException("streamId is required");
        }
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("keyPrefix is required");
        }
        Objects.requireNonNull(keyFormat, "keyFormat");
    }
}
