package com.rms.cdc.core.model;

/**
 * Delivery state of a {@link ConsumerRecord}.
 *
 * <p>The fan-out core only ever creates records in {@code available}. The
 * remaining states are driven by the pull/acknowledgement side:</p>
 *
 * <pre>
 *   available ──receive──▶ delivered ──ack──▶ (deleted)
 *       ▲                      │
 *       └──────nack/timeout────┘
 * </pre>
 */
public enum ConsumerRecordState {
    available,
    delivered,
    pending_redelivery
}
