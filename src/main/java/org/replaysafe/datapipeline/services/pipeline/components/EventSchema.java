package org.replaysafe.datapipeline.services.pipeline.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.replaysafe.datapipeline.api.contracts.Event;
import org.replaysafe.datapipeline.api.resources.log.LogRecord;

/**
 * Validates upstream records at the ingestion boundary and turns them into {@link Event}s.
 * <p>
 * A record is a JSON object with:
 * <ul>
 *   <li>{@code principal_id}: non-blank string (required)</li>
 *   <li>{@code event_type}: non-blank string (required)</li>
 *   <li>{@code event_timestamp}: integral epoch milliseconds or a string (required)</li>
 *   <li>{@code sequence}: integral number (optional)</li>
 *   <li>{@code payload}: any JSON value (optional, absent or null means {@code {}})</li>
 * </ul>
 * Other fields are ignored. Thread-safe.
 */
public class EventSchema {

    static final String EMPTY_PAYLOAD = "{}";

    private final ObjectMapper mapper;

    public EventSchema() {
        this(new ObjectMapper());
    }

    public EventSchema(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @throws MissingFieldException if the record does not conform; the field names what is wrong.
     */
    public Event parse(LogRecord record) throws MissingFieldException {
        JsonNode root;
        try {
            root = mapper.readTree(record.value());
        } catch (JsonProcessingException e) {
            throw new MissingFieldException("record", "Record is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new MissingFieldException("record", "Record is not a JSON object");
        }

        String principalId = requiredText(root, "principal_id");
        String eventType = requiredText(root, "event_type");

        JsonNode timestampNode = root.get("event_timestamp");
        String eventTimestamp;
        if (timestampNode == null || timestampNode.isNull()) {
            throw new MissingFieldException("event_timestamp", "Required field 'event_timestamp' is missing");
        } else if (timestampNode.isIntegralNumber() && timestampNode.canConvertToLong()) {
            eventTimestamp = Long.toString(timestampNode.longValue());
        } else if (timestampNode.isTextual() && !timestampNode.textValue().isBlank()) {
            eventTimestamp = timestampNode.textValue();
        } else {
            throw new MissingFieldException("event_timestamp",
                "Field 'event_timestamp' must be epoch milliseconds or an ISO-8601 string, got: " + timestampNode);
        }

        Long sequence = null;
        JsonNode sequenceNode = root.get("sequence");
        if (sequenceNode != null && !sequenceNode.isNull()) {
            if (!sequenceNode.isIntegralNumber() || !sequenceNode.canConvertToLong()) {
                throw new MissingFieldException("sequence", "Field 'sequence' must be an integer, got: " + sequenceNode);
            }
            sequence = sequenceNode.longValue();
        }

        JsonNode payloadNode = root.get("payload");
        String payload = payloadNode == null || payloadNode.isNull() ? EMPTY_PAYLOAD : payloadNode.toString();

        return new Event(record.partition(), record.offset(), principalId, eventType, eventTimestamp, sequence, payload);
    }

    private static String requiredText(JsonNode root, String field) throws MissingFieldException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new MissingFieldException(field, "Required field '" + field + "' is missing");
        }
        if (!node.isTextual() || node.textValue().isBlank()) {
            throw new MissingFieldException(field, "Field '" + field + "' must be a non-blank string, got: " + node);
        }
        return node.textValue();
    }
}
