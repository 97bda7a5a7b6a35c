package com.phillippitts.voicelink.domain;

import org.json.JSONObject;

import java.util.Objects;

/**
 * Decoded inbound message envelope.
 *
 * @param type    classified message type
 * @param rawType the {@code type} tag exactly as sent, or {@code "unknown"} when absent
 * @param body    the full decoded JSON object (not copied; treat as read-only)
 */
public record InboundMessage(MessageType type, String rawType, JSONObject body) {

    public static final String TYPE_FIELD = "type";
    public static final String DEFAULT_TYPE = "unknown";

    public InboundMessage {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(rawType, "rawType must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    /**
     * Classifies a decoded JSON object by its {@code type} field.
     */
    public static InboundMessage of(JSONObject body) {
        String rawType = body.optString(TYPE_FIELD, DEFAULT_TYPE);
        return new InboundMessage(MessageType.fromWire(rawType), rawType, body);
    }
}
