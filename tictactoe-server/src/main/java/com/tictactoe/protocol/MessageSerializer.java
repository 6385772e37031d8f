package com.tictactoe.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tictactoe.game.Mark;
import com.tictactoe.game.Rejection;
import com.tictactoe.game.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles serialization/deserialization of messages, and builds the JSON for
 * every message the server sends.
 *
 * The serializer is thread-safe - ObjectMapper is thread-safe after configuration.
 */
public class MessageSerializer {

    private static final Logger logger = LoggerFactory.getLogger(MessageSerializer.class);

    // ObjectMapper is thread-safe and should be reused
    private final ObjectMapper objectMapper;

    public MessageSerializer() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Serializes a Message to JSON string.
     */
    public String serialize(Message message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("Failed to serialize message: {}", message, e);
            throw new IllegalStateException("Serialization failed", e);
        }
    }

    /**
     * Deserializes a JSON string to Message.
     *
     * @throws MalformedMessageException if the text is not a message with a known type
     */
    public Message deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new MalformedMessageException("Empty message");
        }
        Message message;
        try {
            message = objectMapper.readValue(json, Message.class);
        } catch (JsonProcessingException e) {
            logger.debug("Failed to deserialize message: {}", json, e);
            throw new MalformedMessageException("Invalid message format", e);
        }
        if (message == null || message.getType() == null) {
            throw new MalformedMessageException("Message type is required");
        }
        return message;
    }

    public ObjectNode createObjectNode() {
        return objectMapper.createObjectNode();
    }

    // === Server → Client ===

    /**
     * Full session snapshot, broadcast after every accepted change.
     */
    public String state(SessionSnapshot snapshot) {
        Message message = Message.builder()
                .type(MessageType.STATE)
                .sessionId(snapshot.getSessionId())
                .payload(objectMapper.valueToTree(snapshot))
                .version(snapshot.getVersion())
                .build();
        return serialize(message);
    }

    /**
     * Role assignment for the joining connection only.
     */
    public String joined(String sessionId, Mark role, String name, boolean reconnected) {
        ObjectNode payload = createObjectNode();
        payload.put("role", role.name());
        payload.put("name", name);
        payload.put("reconnected", reconnected);

        return serialize(Message.builder()
                .type(MessageType.JOINED)
                .sessionId(sessionId)
                .payload(payload)
                .build());
    }

    public String rejected(String sessionId, Rejection rejection) {
        ObjectNode payload = createObjectNode();
        payload.put("reason", rejection.name());
        payload.put("message", rejection.getMessage());

        return serialize(Message.builder()
                .type(MessageType.REJECTED)
                .sessionId(sessionId)
                .payload(payload)
                .build());
    }

    public String error(String errorMessage) {
        ObjectNode payload = createObjectNode();
        payload.put("message", errorMessage);

        return serialize(Message.builder()
                .type(MessageType.ERROR)
                .payload(payload)
                .build());
    }

    public String pong() {
        return serialize(Message.builder()
                .type(MessageType.PONG)
                .build());
    }
}
