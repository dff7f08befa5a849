package com.rms.cdc.core.model;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * =====================================================================
 * Consumer
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A durable subscription: which tables (and which rows of them, through
 * column filters) produce delivery records, and in which shape.
 *
 * Loaded once per batch from the relational store and treated as an
 * immutable value for the duration of that batch.
 *
 * ROUTING RULE
 * ------------
 * A consumer matches a change iff the {@link SourceTable} whose oid equals
 * the change's table oid exists and all of its filters pass. At most one
 * source table per oid is expected; see
 * {@link com.rms.cdc.core.routing.ConsumerMatcher}.
 */
public record Consumer(UUID id, String name, MessageKind messageKind, List<SourceTable> sourceTables) {

    public Consumer {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(messageKind, "messageKind");
        sourceTables = sourceTables == null ? List.of() : List.copyOf(sourceTables);
    }
}
