package com.phillippitts.voicelink.service.transport;

import com.phillippitts.voicelink.service.metrics.ConnectionMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends JSON messages without letting any failure escape.
 *
 * <p>Serialization and write failures are logged and counted, and reported to the caller as
 * {@code false}. A {@code false} result means the connection can no longer be trusted to
 * carry responses; callers end the connection rather than retry.
 */
@Component
public class SafeMessageSender {

    private static final Logger LOG = LogManager.getLogger(SafeMessageSender.class);

    private final ConnectionMetrics metrics;

    public SafeMessageSender(ConnectionMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Serializes {@code payload} and writes it to {@code transport}.
     *
     * @param connectionId id used in log messages
     * @param transport    destination
     * @param payload      message to send
     * @return {@code true} if the message was written
     */
    public boolean send(String connectionId, MessageTransport transport, JSONObject payload) {
        String wire;
        try {
            wire = payload.toString(0);
        } catch (JSONException e) {
            LOG.error("Failed to serialize {} message for {}: {}",
                    payload.optString("type", "?"), connectionId, e.getMessage());
            metrics.incrementSendFailure();
            return false;
        }
        try {
            transport.send(wire);
            return true;
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to send message to {}: {}", connectionId, e.toString());
            metrics.incrementSendFailure();
            return false;
        }
    }
}
