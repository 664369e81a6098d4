package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledges that the authority processed the event with {@code event_id}.
 */
public final class EventAckPayload implements Payload, Correlated {

    private final String eventId;

    @JsonCreator
    public EventAckPayload(@JsonProperty("event_id") String eventId) {
        this.eventId = eventId;
    }

    @JsonProperty("event_id")
    public String getEventId() {
        return eventId;
    }

    @Override
    public String correlationId() {
        return eventId;
    }
}
