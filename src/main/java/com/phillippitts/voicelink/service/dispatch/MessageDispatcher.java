package com.phillippitts.voicelink.service.dispatch;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.domain.InboundMessage;
import com.phillippitts.voicelink.exception.MessageDispatchException;
import com.phillippitts.voicelink.util.TimeUtils;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Maps an inbound message to its response.
 *
 * <p>Pure apart from reading the injected {@link Clock}: no I/O, no registry access, no
 * state between calls. Per-connection figures (message count, connect time) come in
 * through the {@link ConnectionSnapshot} supplied by the caller.
 *
 * <p>Response types:
 * <pre>
 * ping         → pong
 * test         → test_response
 * heartbeat    → heartbeat_ack
 * audio_stream → audio_received
 * (anything)   → echo
 * </pre>
 *
 * <p>The server-initiated {@code system_ready} and {@code error} messages are built here
 * too so the whole wire vocabulary lives in one place.
 *
 * @since 1.0
 */
@Component
public class MessageDispatcher {

    static final String INVALID_JSON_MESSAGE = "Invalid JSON format";
    static final String PROCESSING_ERROR_MESSAGE = "Server processing error";

    private final Clock clock;

    public MessageDispatcher(Clock clock) {
        this.clock = clock;
    }

    /**
     * Builds the response for one decoded message.
     *
     * @param message    decoded message
     * @param connection the sender's connection state, already counting {@code message}
     * @return response payload, never {@code null}
     * @throws MessageDispatchException if a field required to answer has an unusable value
     */
    public JSONObject dispatch(InboundMessage message, ConnectionSnapshot connection) {
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(connection, "connection must not be null");
        Instant now = clock.instant();
        return switch (message.type()) {
            case PING -> pong(message.body(), connection, now);
            case TEST -> testResponse(message.body(), connection, now);
            case HEARTBEAT -> heartbeatAck(connection, now);
            case AUDIO_STREAM -> audioReceived(message, now);
            case UNKNOWN -> echo(message, now);
        };
    }

    public JSONObject welcome(String connectionId) {
        return new JSONObject()
                .put("type", "system_ready")
                .put("message", "Connection established")
                .put("connection_id", connectionId)
                .put("server_time", TimeUtils.epochSeconds(clock.instant()));
    }

    /**
     * Reply for a frame that could not be decoded.
     *
     * @param detail parser error text, sent back to the client as {@code error}
     */
    public JSONObject invalidJson(String detail) {
        return new JSONObject()
                .put("type", "error")
                .put("message", INVALID_JSON_MESSAGE)
                .put("error", detail == null ? "" : detail)
                .put("timestamp", TimeUtils.epochSeconds(clock.instant()));
    }

    /** Generic reply for unexpected failures; carries no detail about the cause. */
    public JSONObject processingError() {
        return new JSONObject()
                .put("type", "error")
                .put("message", PROCESSING_ERROR_MESSAGE)
                .put("timestamp", TimeUtils.epochSeconds(clock.instant()));
    }

    private static JSONObject pong(JSONObject body, ConnectionSnapshot connection, Instant now) {
        return new JSONObject()
                .put("type", "pong")
                .put("timestamp", TimeUtils.epochSeconds(now))
                .put("original_timestamp", body.opt("timestamp") == null ? JSONObject.NULL : body.opt("timestamp"))
                .put("server_connection_time", connection.uptimeSeconds(now));
    }

    private static JSONObject testResponse(JSONObject body, ConnectionSnapshot connection, Instant now) {
        Object data = body.opt("data");
        JSONObject stats = new JSONObject()
                .put("id", connection.id())
                .put("messages_received", connection.messageCount())
                .put("uptime", connection.uptimeSeconds(now));
        return new JSONObject()
                .put("type", "test_response")
                .put("message", "Test successful!")
                .put("echo_data", data == null ? "" : data)
                .put("server_time", TimeUtils.epochSeconds(now))
                .put("connection_stats", stats);
    }

    private static JSONObject heartbeatAck(ConnectionSnapshot connection, Instant now) {
        return new JSONObject()
                .put("type", "heartbeat_ack")
                .put("timestamp", TimeUtils.epochSeconds(now))
                .put("connection_uptime", connection.uptimeSeconds(now));
    }

    private static JSONObject audioReceived(InboundMessage message, Instant now) {
        int size = payloadLength(message);
        return new JSONObject()
                .put("type", "audio_received")
                .put("message", "Audio chunk received (" + size + " bytes)")
                .put("size", size)
                .put("timestamp", TimeUtils.epochSeconds(now));
    }

    private static JSONObject echo(InboundMessage message, Instant now) {
        return new JSONObject()
                .put("type", "echo")
                .put("original_type", message.rawType())
                .put("message", "Echo: " + message.rawType())
                .put("original_message", message.body())
                .put("timestamp", TimeUtils.epochSeconds(now));
    }

    // Audio payloads are opaque; only their length is reported.
    private static int payloadLength(InboundMessage message) {
        Object data = message.body().opt("data");
        if (data == null) {
            return 0;
        }
        if (data instanceof String s) {
            return s.codePointCount(0, s.length());
        }
        if (data instanceof JSONArray array) {
            return array.length();
        }
        if (data instanceof JSONObject object) {
            return object.length();
        }
        throw new MessageDispatchException(
                "Field 'data' has no length: " + (JSONObject.NULL.equals(data) ? "null" : data.getClass().getSimpleName()),
                message.rawType());
    }
}
