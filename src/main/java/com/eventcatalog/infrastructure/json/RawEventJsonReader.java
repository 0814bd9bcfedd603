package com.eventcatalog.infrastructure.json;

import com.eventcatalog.domain.model.NormalizedEvent;
import com.eventcatalog.domain.model.RawEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads provider JSON into {@link RawEvent}s and writes normalized events back out.
 */
@Component
public class RawEventJsonReader {

    private static final Logger logger = LoggerFactory.getLogger(RawEventJsonReader.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;
    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RawEventJsonReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a provider response body. Malformed JSON and anything other than
     * a JSON array yield an empty list.
     */
    public List<RawEvent> readEvents(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return toRawEvents(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            logger.warn("Failed to parse provider JSON: {}", e.getOriginalMessage());
            logger.debug("Response body preview: {}", preview(json));
            return List.of();
        }
    }

    /**
     * Converts a JSON array of event objects. Elements that are not objects become
     * empty records so that validation, not parsing, is where they get rejected.
     */
    public List<RawEvent> toRawEvents(JsonNode node) {
        if (node == null || !node.isArray()) {
            if (node != null && !node.isMissingNode() && !node.isNull()) {
                logger.warn("Expected a JSON array of events but got {}", node.getNodeType());
            }
            return List.of();
        }
        List<RawEvent> events = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            if (element.isObject()) {
                events.add(RawEvent.of(objectMapper.convertValue(element, FIELD_MAP)));
            } else {
                events.add(RawEvent.empty());
            }
        }
        return events;
    }

    /**
     * Serializes normalized events with their snake_case field names.
     */
    public String writeEvents(List<NormalizedEvent> events) throws JsonProcessingException {
        return objectMapper.writeValueAsString(events != null ? events : List.of());
    }

    private static String preview(String body) {
        return body.length() > MAX_LOG_BODY_LENGTH
            ? body.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : body;
    }
}
