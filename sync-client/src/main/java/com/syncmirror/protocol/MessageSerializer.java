package com.syncmirror.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.syncmirror.error.MessageCodecException;
import com.syncmirror.protocol.payload.Payload;
import com.syncmirror.protocol.payload.UnknownPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles serialization/deserialization of messages.
 *
 * The envelope is written through Jackson's tree model so the {@code type} tag and
 * the typed payload stay in step: the tag selects the payload class on the way in,
 * and the payload class is checked against the tag on the way out.
 *
 * Unknown properties are ignored so newer authorities can add fields without
 * breaking older clients.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    private static final String FIELD_ID = "id";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_PAYLOAD = "payload";
    private static final String FIELD_TIMESTAMP = "timestamp";

    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Serializes a Message to JSON string.
     *
     * @param message The message to serialize
     * @return JSON string representation
     */
    public String serialize(Message message) {
        if (message.getType() == MessageType.UNKNOWN) {
            throw new MessageCodecException("Refusing to send message of unknown type: " + message.getId());
        }
        try {
            ObjectNode root = objectMapper.createObjectNode();
            root.put(FIELD_ID, message.getId());
            root.put(FIELD_TYPE, message.getType().getWireName());
            if (message.hasPayload()) {
                root.set(FIELD_PAYLOAD, objectMapper.valueToTree(message.getPayload()));
            } else {
                root.putNull(FIELD_PAYLOAD);
            }
            root.put(FIELD_TIMESTAMP, message.getTimestamp());
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new MessageCodecException("Serialization failed for " + message.getId(), e);
        }
    }

    /**
     * Deserializes a JSON string to Message.
     *
     * @param json The JSON string to deserialize
     * @return Deserialized Message object
     * @throws MessageCodecException if the text is not a valid envelope
     */
    public Message deserialize(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MessageCodecException("Malformed frame: " + abbreviate(json), e);
        }
        if (root == null || !root.isObject()) {
            throw new MessageCodecException("Frame is not a JSON object: " + abbreviate(json));
        }

        JsonNode typeNode = root.get(FIELD_TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MessageCodecException("Frame has no type: " + abbreviate(json));
        }
        String rawType = typeNode.asText();
        MessageType type = MessageType.fromWireName(rawType);

        Message.Builder builder = Message.builder()
                .type(type)
                .payload(decodePayload(type, rawType, root.get(FIELD_PAYLOAD)));

        JsonNode idNode = root.get(FIELD_ID);
        if (idNode != null && !idNode.isNull()) {
            builder.id(idNode.asText());
        }
        JsonNode timestampNode = root.get(FIELD_TIMESTAMP);
        if (timestampNode != null && timestampNode.isNumber()) {
            builder.timestamp(timestampNode.asLong());
        }
        return builder.build();
    }

    private Payload decodePayload(MessageType type, String rawType, JsonNode payloadNode) {
        if (type == MessageType.UNKNOWN) {
            return new UnknownPayload(rawType, payloadNode);
        }
        if (payloadNode == null || payloadNode.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(payloadNode, type.getPayloadType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MessageCodecException("Invalid " + rawType + " payload", e);
        }
    }

    private static String abbreviate(String json) {
        if (json == null) {
            return "null";
        }
        return json.length() <= 200 ? json : json.substring(0, 200) + "...";
    }
}
