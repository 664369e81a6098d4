package com.syncmirror.protocol;

import com.syncmirror.protocol.payload.Correlated;
import com.syncmirror.protocol.payload.Payload;

import java.util.Objects;
import java.util.UUID;

/**
 * Represents a message in the sync protocol.
 *
 * This class is immutable for thread safety - once created, it cannot be modified.
 * This allows safe sharing across the caller, I/O and timer threads.
 *
 * Wire format (priority is local and never serialized):
 * {
 *     "id": "5f0c...",
 *     "type": "state_sync",
 *     "payload": { ... },
 *     "timestamp": 1234567890
 * }
 */
public final class Message {

    private final String id;
    private final MessageType type;
    private final Payload payload;
    private final long timestamp;
    private final Priority priority;

    private Message(String id, MessageType type, Payload payload, long timestamp, Priority priority) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.timestamp = timestamp;
        this.priority = priority;
    }

    public String getId() {
        return id;
    }

    public MessageType getType() {
        return type;
    }

    public Payload getPayload() {
        return payload;
    }

    /**
     * Returns the payload as the given payload class.
     *
     * @throws IllegalStateException if the payload is absent or of another class
     */
    public <P extends Payload> P getPayload(Class<P> payloadClass) {
        if (!payloadClass.isInstance(payload)) {
            throw new IllegalStateException("Message " + id + " of type " + type
                    + " does not carry a " + payloadClass.getSimpleName());
        }
        return payloadClass.cast(payload);
    }

    public boolean hasPayload() {
        return payload != null;
    }

    public long getTimestamp() {
        return timestamp;
    }

    public Priority getPriority() {
        return priority;
    }

    /**
     * Id of the earlier outbound message this one answers, or null.
     */
    public String getCorrelationId() {
        if (payload instanceof Correlated) {
            return ((Correlated) payload).correlationId();
        }
        return null;
    }

    /**
     * Builder pattern for creating immutable Message objects.
     */
    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .type(type)
                .payload(payload)
                .timestamp(timestamp)
                .priority(priority);
    }

    public static class Builder {
        private String id;
        private MessageType type;
        private Payload payload;
        private Long timestamp;
        private Priority priority = Priority.NORMAL;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Message build() {
            Objects.requireNonNull(type, "type");
            if (payload != null && !type.getPayloadType().isInstance(payload)) {
                throw new IllegalArgumentException(type + " cannot carry "
                        + payload.getClass().getSimpleName());
            }
            return new Message(
                    id != null ? id : UUID.randomUUID().toString(),
                    type,
                    payload,
                    timestamp != null ? timestamp : System.currentTimeMillis(),
                    priority != null ? priority : Priority.NORMAL);
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", priority=" + priority +
                ", timestamp=" + timestamp +
                '}';
    }
}
