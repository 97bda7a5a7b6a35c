package com.phillippitts.voicelink.domain;

import com.phillippitts.voicelink.util.TimeUtils;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable point-in-time view of one live connection.
 *
 * <p>Carries only the public fields of a connection record; the transport handle is never
 * part of a snapshot.
 *
 * @param id           connection identifier
 * @param connectedAt  when the connection was registered
 * @param lastActivity when the last inbound message was received (initially {@code connectedAt})
 * @param messageCount number of inbound messages received so far
 */
public record ConnectionSnapshot(
        String id,
        Instant connectedAt,
        Instant lastActivity,
        long messageCount
) {

    public ConnectionSnapshot {
        Objects.requireNonNull(id, "Connection id must not be null");
        Objects.requireNonNull(connectedAt, "connectedAt must not be null");
        Objects.requireNonNull(lastActivity, "lastActivity must not be null");
        if (messageCount < 0) {
            throw new IllegalArgumentException("messageCount must not be negative, got: " + messageCount);
        }
    }

    /**
     * Seconds this connection has been open as of {@code now}.
     */
    public double uptimeSeconds(Instant now) {
        return TimeUtils.secondsBetween(connectedAt, now);
    }
}
