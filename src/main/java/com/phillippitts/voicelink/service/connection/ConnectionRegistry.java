package com.phillippitts.voicelink.service.connection;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.exception.DuplicateConnectionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe store of all live connections.
 *
 * <p>One {@link ReentrantLock} guards both the map structure and every record's mutable
 * fields, so no operation ever observes a half-applied change made by another connection.
 * Callers only ever receive {@link ConnectionSnapshot} copies; the transport handle held by
 * a record never leaves this class.
 *
 * <p><b>Lifecycle:</b> a record is added by its handler loop after accept, touched on every
 * inbound message, and removed exactly once during that loop's cleanup.
 *
 * @since 1.0
 */
@Component
public class ConnectionRegistry {

    private static final Logger LOG = LogManager.getLogger(ConnectionRegistry.class);

    private final Lock lock = new ReentrantLock();
    private final Map<String, ConnectionRecord> connections = new HashMap<>();
    private final Clock clock;

    public ConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * Registers a new connection.
     *
     * @param id     connection id; must equal {@code record.getId()}
     * @param record freshly created record
     * @throws DuplicateConnectionException if {@code id} is already registered
     * @throws IllegalArgumentException if {@code id} does not match the record
     */
    public void add(String id, ConnectionRecord record) {
        if (!record.getId().equals(id)) {
            throw new IllegalArgumentException("Record id " + record.getId() + " does not match " + id);
        }
        int total;
        lock.lock();
        try {
            if (connections.containsKey(id)) {
                throw new DuplicateConnectionException(id);
            }
            connections.put(id, record);
            total = connections.size();
        } finally {
            lock.unlock();
        }
        LOG.info("Connection {} added. Total: {}", id, total);
    }

    /**
     * Removes a connection. Removing an unknown id is a no-op.
     *
     * @return final snapshot of the removed record, or empty if it was not registered
     */
    public Optional<ConnectionSnapshot> remove(String id) {
        ConnectionRecord record;
        ConnectionSnapshot removed;
        int total;
        lock.lock();
        try {
            record = connections.remove(id);
            if (record == null) {
                return Optional.empty();
            }
            removed = record.toSnapshot();
            total = connections.size();
        } finally {
            lock.unlock();
        }
        LOG.info("Connection {} removed (lived {}s, {} messages, transport {}). Total: {}",
                id,
                String.format("%.1f", removed.uptimeSeconds(clock.instant())),
                removed.messageCount(),
                record.getTransport().isOpen() ? "open" : "closed",
                total);
        return Optional.of(removed);
    }

    /**
     * Counts one inbound message: increments the message count and stamps last activity.
     *
     * @return the updated snapshot, or empty (and nothing changed) if {@code id} is not registered
     */
    public Optional<ConnectionSnapshot> touch(String id) {
        Instant now = clock.instant();
        lock.lock();
        try {
            ConnectionRecord record = connections.get(id);
            if (record == null) {
                return Optional.empty();
            }
            record.recordActivity(now);
            return Optional.of(record.toSnapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return snapshot of one connection, or empty if not registered
     */
    public Optional<ConnectionSnapshot> find(String id) {
        lock.lock();
        try {
            ConnectionRecord record = connections.get(id);
            return record == null ? Optional.empty() : Optional.of(record.toSnapshot());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time copy of every live connection, oldest first.
     */
    public List<ConnectionSnapshot> snapshot() {
        List<ConnectionSnapshot> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(connections.size());
            for (ConnectionRecord record : connections.values()) {
                copy.add(record.toSnapshot());
            }
        } finally {
            lock.unlock();
        }
        copy.sort(Comparator.comparing(ConnectionSnapshot::connectedAt)
                .thenComparing(ConnectionSnapshot::id));
        return List.copyOf(copy);
    }

    public int size() {
        lock.lock();
        try {
            return connections.size();
        } finally {
            lock.unlock();
        }
    }
}
