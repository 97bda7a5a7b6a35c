package com.phillippitts.voicelink.service.lifecycle;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Logs the final registry contents when the application shuts down (SIGINT/SIGTERM).
 *
 * <p>Runs on {@link ContextClosedEvent}, i.e. before the connection executor interrupts the
 * remaining handler loops, so the report lists every connection still open at shutdown.
 */
@Component
public class ShutdownReporter {

    private static final Logger LOG = LogManager.getLogger(ShutdownReporter.class);

    private final ConnectionRegistry registry;
    private final Clock clock;

    public ShutdownReporter(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @EventListener
    public void onContextClosed(ContextClosedEvent event) {
        report();
    }

    /**
     * @return the snapshot that was logged
     */
    List<ConnectionSnapshot> report() {
        List<ConnectionSnapshot> connections = registry.snapshot();
        Instant now = clock.instant();
        LOG.info("Server stopping. Final stats: total_connections={}", connections.size());
        for (ConnectionSnapshot c : connections) {
            LOG.info("  {} open {}s, {} messages", c.id(),
                    String.format("%.1f", c.uptimeSeconds(now)), c.messageCount());
        }
        return connections;
    }
}
