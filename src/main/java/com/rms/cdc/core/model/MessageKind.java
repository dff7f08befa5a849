package com.rms.cdc.core.model;

import java.util.Locale;

/**
 * Shape of the delivery records a {@link Consumer} receives.
 *
 * <ul>
 *   <li>{@code event}: a {@link ConsumerEvent} carrying the full change payload</li>
 *   <li>{@code record}: a {@link ConsumerRecord} pointing at the changed row</li>
 * </ul>
 */
public enum MessageKind {
    event,
    record;

    public static MessageKind fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("message kind is required");
        }
        return MessageKind.valueOf(raw.trim().toLowerCase(Locale.ROOT));
    }
}
