package com.example.issuelifecycle.eventstore;

import com.example.issuelifecycle.events.EventKind;
import com.example.issuelifecycle.events.IssueEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Converts issue events to and from the JSON payload stored next to their event kind.
 *
 * <p>The kind selects the record type on the way back, so the payload itself carries no type
 * information. Serialization failures are storage failures and surface as
 * {@link EventStoreException}.</p>
 */
public class IssueEventCodec {

    private final ObjectMapper objectMapper;

    public IssueEventCodec() {
        this(defaultObjectMapper());
    }

    public IssueEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    public String encode(IssueEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to serialize " + event.kind() + " event of stream "
                    + event.issueId(), e);
        }
    }

    public IssueEvent decode(EventKind kind, String payload) {
        try {
            return objectMapper.readValue(payload, kind.eventType());
        } catch (JsonProcessingException e) {
            throw new EventStoreException("Failed to deserialize " + kind + " event payload", e);
        }
    }
}
