package com.rms.cdc.view;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rms.cdc.core.model.ConsumerEvent;

/**
 * Renders persisted consumer events as the pull response body:
 *
 * <pre>
 * {"data": [{"ack_id": "...", "data": {"action": "insert", "record": {...}, "changes": null}}]}
 * </pre>
 *
 * {@code changes} is always present; metadata stays internal.
 */
@Component
public class PullRenderer {

    private final ObjectMapper mapper;

    public PullRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String render(List<ConsumerEvent> events) {
        List<Map<String, Object>> data = new ArrayList<>();
        for (ConsumerEvent event : events) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("action", event.data().action().name());
            payload.put("record", event.data().record());
            payload.put("changes", event.data().changes());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("ack_id", event.ackId() == null ? null : event.ackId().toString());
            item.put("data", payload);
            data.add(item);
        }

        try {
            return mapper.writeValueAsString(Map.of("data", data));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to render pull response", e);
        }
    }
}
