package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authoritative state broadcast by the remote authority.
 *
 * {@code value} is the externally computed scalar; {@code attributes} carries any
 * structured remainder. Both are opaque to the client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StateSyncPayload implements Payload, Correlated {

    private final double value;
    private final String phase;
    private final Map<String, Object> attributes;
    private final String replyTo;

    @JsonCreator
    public StateSyncPayload(@JsonProperty("value") double value,
                            @JsonProperty("phase") String phase,
                            @JsonProperty("attributes") Map<String, Object> attributes,
                            @JsonProperty("reply_to") String replyTo) {
        this.value = value;
        this.phase = phase;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.replyTo = replyTo;
    }

    public StateSyncPayload(double value, String phase) {
        this(value, phase, null, null);
    }

    @JsonProperty("value")
    public double getValue() {
        return value;
    }

    @JsonProperty("phase")
    public String getPhase() {
        return phase;
    }

    @JsonProperty("attributes")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @JsonProperty("reply_to")
    public String getReplyTo() {
        return replyTo;
    }

    @Override
    public String correlationId() {
        return replyTo;
    }

    @Override
    public String toString() {
        return "StateSyncPayload{value=" + value + ", phase='" + phase + "'}";
    }
}
