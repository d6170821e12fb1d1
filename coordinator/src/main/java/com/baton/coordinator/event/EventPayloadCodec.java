package com.baton.coordinator.event;

import com.baton.coordinator.model.Event;
import com.baton.coordinator.model.EventType;
import com.baton.coordinator.store.CoordinationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Converts typed event payloads to and from the JSON kept in the events table.
 *
 * Decoding is strict (unknown properties are rejected) because this is the
 * schema check for payloads arriving from outside the engine.
 */
@Component
public class EventPayloadCodec {

    private final ObjectMapper json;

    public EventPayloadCodec(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public static Class<? extends EventPayload> payloadClass(EventType type) {
        return switch (type) {
            case ISSUES_RAISED       -> IssuesRaised.class;
            case ISSUE_RESPONSES     -> IssueResponses.class;
            case REVIEW_VERDICTS     -> ReviewVerdicts.class;
            case TRANSITION          -> TransitionRecorded.class;
            case NO_PROGRESS         -> NoProgress.class;
            case SCOPE_CHANGE        -> ScopeChange.class;
            case ROLE_VIOLATION      -> RoleViolation.class;
            case COMPLETION_DECLARED -> CompletionDeclared.class;
            case VALIDATOR_VERDICT   -> ValidatorVerdict.class;
            case AUDIT               -> AuditEntry.class;
        };
    }

    /** Validate and serialise a payload for storage. */
    public String encode(EventPayload payload) {
        if (payload == null) {
            throw CoordinationException.validation("payload is required");
        }
        payload.validate();
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw CoordinationException.validation("payload cannot be serialised: " + e.getOriginalMessage());
        }
    }

    /**
     * Parse an externally supplied payload for the given type.
     *
     * @throws CoordinationException VALIDATION_ERROR when the JSON does not match the type's schema
     */
    public EventPayload fromJson(EventType type, JsonNode node) {
        if (type == null) {
            throw CoordinationException.validation("event type is required");
        }
        if (node == null || !node.isObject()) {
            throw CoordinationException.validation("payload for " + type + " must be a JSON object");
        }
        try {
            EventPayload payload = strictReader(payloadClass(type)).readValue(node);
            payload.validate();
            return payload;
        } catch (java.io.IOException e) {
            throw CoordinationException.validation("payload does not match " + type + ": " + e.getMessage());
        }
    }

    /** Decode a stored event into its payload record. */
    public <T extends EventPayload> T decode(Event event, Class<T> expected) {
        Class<? extends EventPayload> actual = payloadClass(event.getEventType());
        if (!expected.equals(actual)) {
            throw new CoordinationException(CoordinationException.Kind.STATE_INCONSISTENCY,
                    "event %d is %s, not %s".formatted(event.getId(), event.getEventType(), expected.getSimpleName()));
        }
        try {
            return expected.cast(json.readValue(event.getPayload(), actual));
        } catch (JsonProcessingException e) {
            throw new CoordinationException(CoordinationException.Kind.STATE_INCONSISTENCY,
                    "stored payload of event " + event.getId() + " is unreadable: " + e.getOriginalMessage(), e);
        }
    }

    public <T extends EventPayload> List<T> decodeAll(List<Event> events, Class<T> expected) {
        return events.stream().map(e -> decode(e, expected)).toList();
    }

    private ObjectReader strictReader(Class<?> type) {
        return json.readerFor(type).with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
