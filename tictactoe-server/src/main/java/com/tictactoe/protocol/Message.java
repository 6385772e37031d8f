package com.tictactoe.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Represents a message in the game protocol.
 *
 * Instances built through the builder are never modified afterwards, so one
 * serialized broadcast can be shared by every recipient.
 *
 * JSON format:
 * {
 *     "type": "JOIN",
 *     "sessionId": "abc",
 *     "payload": { "name": "Alice" },
 *     "version": 42,
 *     "timestamp": 1234567890
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    private MessageType type;
    private String sessionId;
    private JsonNode payload;
    private Long version;
    private Long timestamp;

    // Default constructor for Jackson deserialization
    public Message() {
    }

    private Message(MessageType type, String sessionId, JsonNode payload, Long version, Long timestamp) {
        this.type = type;
        this.sessionId = sessionId;
        this.payload = payload;
        this.version = version;
        this.timestamp = timestamp;
    }

    public MessageType getType() {
        return type;
    }

    public String getSessionId() {
        return sessionId;
    }

    public JsonNode getPayload() {
        return payload;
    }

    public Long getVersion() {
        return version;
    }

    public Long getTimestamp() {
        return timestamp;
    }

    // Setters for Jackson deserialization
    public void setType(MessageType type) {
        this.type = type;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public void setPayload(JsonNode payload) {
        this.payload = payload;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public void setTimestamp(Long timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Text field of the payload, or null when the payload or the field is missing.
     */
    public String payloadText(String field) {
        if (payload == null || !payload.hasNonNull(field)) {
            return null;
        }
        return payload.get(field).asText();
    }

    /**
     * Session id of a request that has to name one.
     *
     * @throws MalformedMessageException if it is missing or blank
     */
    public String requireSessionId() {
        if (sessionId == null || sessionId.isBlank()) {
            throw new MalformedMessageException("Session ID is required");
        }
        return sessionId;
    }

    /**
     * @throws MalformedMessageException if the payload field is missing or blank
     */
    public String requireText(String field, String label) {
        String value = payloadText(field);
        if (value == null || value.isBlank()) {
            throw new MalformedMessageException(label + " is required");
        }
        return value;
    }

    /**
     * @throws MalformedMessageException if the payload field is not an int
     */
    public int requireInt(String field, String label) {
        JsonNode value = payload != null ? payload.get(field) : null;
        if (value == null || !value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MalformedMessageException(label + " must be an integer");
        }
        return value.intValue();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MessageType type;
        private String sessionId;
        private JsonNode payload;
        private Long version;
        private Long timestamp;

        public Builder type(MessageType type) {
            this.type = type;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder version(Long version) {
            this.version = version;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Message build() {
            return new Message(type, sessionId, payload, version,
                    timestamp != null ? timestamp : System.currentTimeMillis());
        }
    }

    @Override
    public String toString() {
        return "Message{" +
                "type=" + type +
                ", sessionId='" + sessionId + '\'' +
                ", version=" + version +
                '}';
    }
}
