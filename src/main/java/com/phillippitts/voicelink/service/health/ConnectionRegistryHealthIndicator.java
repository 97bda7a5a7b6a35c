package com.phillippitts.voicelink.service.health;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Health indicator for the connection registry.
 *
 * <p>Always UP while the process can answer: the registry is in-memory and has no external
 * dependency to lose. Details report the live connection count and the age of the oldest
 * connection.
 *
 * <p>Exposed via /actuator/health as {@code connectionRegistry}.
 */
@Component
public class ConnectionRegistryHealthIndicator implements HealthIndicator {

    private final ConnectionRegistry registry;
    private final Clock clock;

    public ConnectionRegistryHealthIndicator(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @Override
    public Health health() {
        List<ConnectionSnapshot> connections = registry.snapshot();
        Health.Builder builder = Health.up().withDetail("activeConnections", connections.size());
        if (!connections.isEmpty()) {
            builder.withDetail("oldestConnectionSeconds", connections.get(0).uptimeSeconds(clock.instant()));
        }
        return builder.build();
    }
}
