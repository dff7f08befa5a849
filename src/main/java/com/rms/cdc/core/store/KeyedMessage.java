package com.rms.cdc.core.store;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A value addressed by key in a keyed stream.
 *
 * @param key  derived delivery key
 * @param data encoded envelope (UTF-8 JSON)
 */
public record KeyedMessage(String key, byte[] data) {

    public KeyedMessage {
        Objects.requireNonNull(key, "key");
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public String dataAsString() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof KeyedMessage other && key.equals(other.key) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "KeyedMessage{key='" + key + "', bytes=" + data.length + '}';
    }
}
