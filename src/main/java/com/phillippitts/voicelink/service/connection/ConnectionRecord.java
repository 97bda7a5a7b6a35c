package com.phillippitts.voicelink.service.connection;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.service.transport.MessageTransport;

import java.time.Instant;
import java.util.Objects;

/**
 * Session state for one registered connection.
 *
 * <p>Not thread-safe on its own: mutable fields are only read or written while holding the
 * owning {@link ConnectionRegistry}'s lock.
 */
public final class ConnectionRecord {

    private final String id;
    private final MessageTransport transport;
    private final Instant connectedAt;
    private Instant lastActivity;
    private long messageCount;

    public ConnectionRecord(String id, MessageTransport transport, Instant connectedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.connectedAt = Objects.requireNonNull(connectedAt, "connectedAt must not be null");
        this.lastActivity = connectedAt;
    }

    public String getId() {
        return id;
    }

    MessageTransport getTransport() {
        return transport;
    }

    void recordActivity(Instant at) {
        messageCount++;
        lastActivity = at;
    }

    ConnectionSnapshot toSnapshot() {
        return new ConnectionSnapshot(id, connectedAt, lastActivity, messageCount);
    }
}
