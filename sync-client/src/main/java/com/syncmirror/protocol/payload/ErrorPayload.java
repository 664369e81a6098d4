package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error reported by the authority, optionally tied to a request.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorPayload implements Payload, Correlated {

    private final String code;
    private final String message;
    private final String replyTo;

    @JsonCreator
    public ErrorPayload(@JsonProperty("code") String code,
                        @JsonProperty("message") String message,
                        @JsonProperty("reply_to") String replyTo) {
        this.code = code;
        this.message = message;
        this.replyTo = replyTo;
    }

    @JsonProperty("code")
    public String getCode() {
        return code;
    }

    @JsonProperty("message")
    public String getMessage() {
        return message;
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
        return "ErrorPayload{code='" + code + "', message='" + message + "'}";
    }
}
