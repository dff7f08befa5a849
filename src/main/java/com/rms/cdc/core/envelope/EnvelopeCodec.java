package com.rms.cdc.core.envelope;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ChangeAction;
import com.rms.cdc.core.model.ConsumerEventData;

/**
 * =====================================================================
 * EnvelopeCodec
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The single place where delivery payloads become JSON, for both paths:
 *
 *  - fan-out : {@link ConsumerEventData} → JSONB {@code data} column
 *  - keyed   : {@link Change} → upsert envelope stored under the key
 *
 * WIRE STABILITY
 * --------------
 * Documents are assembled field by field into ordered maps with explicit
 * snake_case names instead of serialising Java types directly. Renaming a
 * record component therefore cannot change what consumers read.
 *
 * The layout is selected by {@link EnvelopeVersion}.
 */
public final class EnvelopeCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;
    private final EnvelopeVersion version;

    public EnvelopeCodec(ObjectMapper mapper) {
        this(mapper, EnvelopeVersion.V1);
    }

    public EnvelopeCodec(ObjectMapper mapper, EnvelopeVersion version) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.version = Objects.requireNonNull(version, "version");
    }

    public EnvelopeVersion version() {
        return version;
    }

    /**
     * Encodes the keyed-upsert envelope: the delivered row image and whether
     * the row was deleted.
     */
    public byte[] encodeUpsert(Change change) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        switch (version) {
            case V1 -> {
                envelope.put("data", change.image());
                envelope.put("deleted", change.action() == ChangeAction.delete);
            }
        }
        return writeBytes(envelope);
    }

    /** Encodes the payload stored with a consumer event. */
    public String encodeEventData(ConsumerEventData data) {
        Map<String, Object> doc = new LinkedHashMap<>();
        switch (version) {
            case V1 -> {
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("table_schema", data.metadata().tableSchema());
                metadata.put("table_name", data.metadata().tableName());
                Instant committedAt = data.metadata().commitTimestamp();
                metadata.put("commit_timestamp", committedAt == null ? null : committedAt.toString());

                doc.put("action", data.action().name());
                doc.put("record", data.record());
                doc.put("changes", data.changes());
                doc.put("metadata", metadata);
            }
        }
        return writeString(doc);
    }

    /** Reads back a payload written by {@link #encodeEventData(ConsumerEventData)}. */
    public ConsumerEventData decodeEventData(String json) {
        try {
            JsonNode root = mapper.readTree(json);
            JsonNode metadata = root.path("metadata");
            String commitTimestamp = metadata.path("commit_timestamp").asText(null);

            return new ConsumerEventData(
                    ChangeAction.valueOf(root.path("action").asText()),
                    toMap(root.get("record")),
                    toMap(root.get("changes")),
                    new ConsumerEventData.Metadata(
                            metadata.path("table_schema").asText(null),
                            metadata.path("table_name").asText(null),
                            commitTimestamp == null ? null : Instant.parse(commitTimestamp)));
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to decode consumer event data", e);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private byte[] writeBytes(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to serialize envelope to JSON", e);
        }
    }

    private String writeString(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to serialize event data to JSON", e);
        }
    }
}
