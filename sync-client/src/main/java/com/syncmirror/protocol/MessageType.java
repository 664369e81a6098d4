package com.syncmirror.protocol;

import com.syncmirror.protocol.payload.AuthAckPayload;
import com.syncmirror.protocol.payload.AuthPayload;
import com.syncmirror.protocol.payload.CommandPayload;
import com.syncmirror.protocol.payload.ContextUpdatePayload;
import com.syncmirror.protocol.payload.ErrorPayload;
import com.syncmirror.protocol.payload.EventAckPayload;
import com.syncmirror.protocol.payload.EventPayload;
import com.syncmirror.protocol.payload.HeartbeatPayload;
import com.syncmirror.protocol.payload.Payload;
import com.syncmirror.protocol.payload.StateSyncPayload;
import com.syncmirror.protocol.payload.UnknownPayload;

import java.util.HashMap;
import java.util.Map;

/**
 * Defines all message types for the sync protocol.
 *
 * Each type is bound to exactly one payload class, so decoding never has to
 * guess a type from the payload's shape.
 *
 * Client → Server:
 * - AUTH: Identify this client instance on a fresh connection
 * - EVENT: A locally generated event, acknowledged by EVENT_ACK
 * - CONTEXT_UPDATE: Conversation context changes
 * - COMMAND: Control requests (e.g. full_sync)
 * - PING / PONG: Heartbeat
 *
 * Server → Client:
 * - AUTH_ACK: Handshake accepted or rejected
 * - STATE_SYNC: Authoritative state broadcast
 * - CONTEXT_UPDATE: Conversation context broadcast
 * - EVENT_ACK: An event was processed
 * - ERROR: Error notification
 * - PING / PONG: Heartbeat
 *
 * UNKNOWN stands in for any wire type this client does not know.
 */
public enum MessageType {
    STATE_SYNC("state_sync", StateSyncPayload.class),
    CONTEXT_UPDATE("context_update", ContextUpdatePayload.class),
    EVENT("event", EventPayload.class),
    EVENT_ACK("event_ack", EventAckPayload.class),
    PING("ping", HeartbeatPayload.class),
    PONG("pong", HeartbeatPayload.class),
    ERROR("error", ErrorPayload.class),
    AUTH("auth", AuthPayload.class),
    AUTH_ACK("auth_ack", AuthAckPayload.class),
    COMMAND("command", CommandPayload.class),
    UNKNOWN(null, UnknownPayload.class);

    private static final Map<String, MessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (MessageType type : values()) {
            if (type.wireName != null) {
                BY_WIRE_NAME.put(type.wireName, type);
            }
        }
    }

    private final String wireName;
    private final Class<? extends Payload> payloadType;

    MessageType(String wireName, Class<? extends Payload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    public String getWireName() {
        return wireName;
    }

    public Class<? extends Payload> getPayloadType() {
        return payloadType;
    }

    public boolean isHeartbeat() {
        return this == PING || this == PONG;
    }

    /**
     * Resolves a wire name, returning UNKNOWN for anything unrecognized.
     */
    public static MessageType fromWireName(String wireName) {
        if (wireName == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(wireName, UNKNOWN);
    }
}
