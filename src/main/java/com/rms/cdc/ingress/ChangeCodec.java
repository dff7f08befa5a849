package com.rms.cdc.ingress;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.cdc.core.model.Change;
import com.rms.cdc.core.model.ChangeAction;
import com.rms.cdc.core.model.Field;

/**
 * Decodes the JSON form of a change as published by the replication decoder:
 *
 * <pre>
 * {"table_oid": 16384, "schema": "public", "table": "orders", "action": "update",
 *  "commit_timestamp": "2024-05-01T10:15:30.123456Z",
 *  "identifier_column_values": [42],
 *  "fields": [{"column_attnum": 1, "column_name": "id", "value": 42}, ...],
 *  "record": {...}, "old_record": {...}}
 * </pre>
 *
 * Unknown properties are ignored. Anything that does not yield a valid
 * {@link Change} is an {@link UndecodableChangeException}.
 */
@Component
public class ChangeCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public ChangeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Change decode(byte[] json) {
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new UndecodableChangeException("change must be a JSON object");
            }

            List<Field> fields = new ArrayList<>();
            for (JsonNode f : root.path("fields")) {
                fields.add(new Field(
                        f.path("column_attnum").asInt(),
                        f.path("column_name").asText(null),
                        mapper.treeToValue(f.get("value"), Object.class)));
            }

            List<Object> ids = new ArrayList<>();
            for (JsonNode id : root.path("identifier_column_values")) {
                ids.add(mapper.treeToValue(id, Object.class));
            }

            return Change.builder()
                    .tableOid(root.path("table_oid").asLong())
                    .schema(root.path("schema").asText(null))
                    .table(root.path("table").asText(null))
                    .action(ChangeAction.valueOf(root.path("action").asText()))
                    .commitTimestamp(Instant.parse(root.path("commit_timestamp").asText()))
                    .fields(fields)
                    .identifierColumnValues(ids)
                    .record(toMap(root.get("record")))
                    .oldRecord(toMap(root.get("old_record")))
                    .build();
        } catch (UndecodableChangeException e) {
            throw e;
        } catch (Exception e) {
            throw new UndecodableChangeException("Failed to decode change: " + e.getMessage(), e);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return mapper.convertValue(node, MAP_TYPE);
    }
}
