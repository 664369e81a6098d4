package com.syncmirror.protocol.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of ping and pong frames.
 */
public final class HeartbeatPayload implements Payload {

    private final long sentAt;

    @JsonCreator
    public HeartbeatPayload(@JsonProperty("sent_at") long sentAt) {
        this.sentAt = sentAt;
    }

    @JsonProperty("sent_at")
    public long getSentAt() {
        return sentAt;
    }
}
