package com.phillippitts.voicelink.service.metrics;

import com.phillippitts.voicelink.domain.MessageType;
import com.phillippitts.voicelink.service.session.CloseReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Centralized metrics for connection lifecycle and message traffic.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Connections opened and closed, tagged by close reason</li>
 *   <li>Inbound messages per classified type, and frames that failed to decode</li>
 *   <li>Outbound sends that failed</li>
 * </ul>
 *
 * <p>The live connection count is exposed separately as a gauge by
 * {@link com.phillippitts.voicelink.config.ConnectionPoolMetricsConfig}.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConnectionMetrics {

    private static final String METRIC_PREFIX = "voicelink";

    private final MeterRegistry registry;

    public ConnectionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementOpened() {
        Counter.builder(METRIC_PREFIX + ".connections.opened")
                .description("Number of connections registered")
                .register(registry)
                .increment();
    }

    /**
     * @param reason why the handler loop ended
     */
    public void incrementClosed(CloseReason reason) {
        Counter.builder(METRIC_PREFIX + ".connections.closed")
                .description("Number of connections closed")
                .tag("reason", reason.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * @param type classified type of a successfully decoded inbound message
     */
    public void incrementReceived(MessageType type) {
        Counter.builder(METRIC_PREFIX + ".messages.received")
                .description("Number of decoded inbound messages")
                .tag("type", type.metricTag())
                .register(registry)
                .increment();
    }

    public void incrementInvalid() {
        Counter.builder(METRIC_PREFIX + ".messages.invalid")
                .description("Number of inbound frames that were not valid JSON objects")
                .register(registry)
                .increment();
    }

    public void incrementSendFailure() {
        Counter.builder(METRIC_PREFIX + ".send.failures")
                .description("Number of outbound messages that could not be written")
                .register(registry)
                .increment();
    }
}
