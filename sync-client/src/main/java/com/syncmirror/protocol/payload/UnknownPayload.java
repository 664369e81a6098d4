package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw body of a message whose wire type this client does not recognize.
 * Never produced for outbound traffic.
 */
public final class UnknownPayload implements Payload {

    private final String rawType;
    private final JsonNode body;

    public UnknownPayload(String rawType, JsonNode body) {
        this.rawType = rawType;
        this.body = body;
    }

    public String getRawType() {
        return rawType;
    }

    /**
     * Returns a copy of the raw body; callers cannot mutate the received message.
     */
    public JsonNode getBody() {
        return body == null ? null : body.deepCopy();
    }
}
