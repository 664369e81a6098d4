package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The authority's answer to {@link AuthPayload}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AuthAckPayload implements Payload {

    private final boolean accepted;
    private final String sessionId;
    private final String reason;

    @JsonCreator
    public AuthAckPayload(@JsonProperty("accepted") boolean accepted,
                          @JsonProperty("session_id") String sessionId,
                          @JsonProperty("reason") String reason) {
        this.accepted = accepted;
        this.sessionId = sessionId;
        this.reason = reason;
    }

    public static AuthAckPayload accept(String sessionId) {
        return new AuthAckPayload(true, sessionId, null);
    }

    public static AuthAckPayload reject(String reason) {
        return new AuthAckPayload(false, null, reason);
    }

    @JsonProperty("accepted")
    public boolean isAccepted() {
        return accepted;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }
}
