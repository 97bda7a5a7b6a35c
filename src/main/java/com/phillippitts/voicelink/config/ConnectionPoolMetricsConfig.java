package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes connection pool and registry gauges via Micrometer.
 *
 * <p>Gauges:
 * <ul>
 *   <li>voicelink.connections.active - Connections currently registered</li>
 *   <li>connection.pool.size - Current number of handler threads</li>
 *   <li>connection.pool.active - Handler threads running a connection</li>
 *   <li>connection.pool.largest - Peak number of handler threads</li>
 *   <li>connection.pool.max.size - Configured maximum pool size</li>
 * </ul>
 *
 * <p>These metrics are available via {@code GET /actuator/metrics/<name>}.
 *
 * <p>Additionally logs a health summary every 5 minutes for operational visibility.
 */
@Configuration
public class ConnectionPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ConnectionPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> connectionExecutorProvider;
    private final ConnectionRegistry connectionRegistry;

    public ConnectionPoolMetricsConfig(
            @Qualifier("connectionExecutor") ObjectProvider<ThreadPoolTaskExecutor> connectionExecutorProvider,
            ConnectionRegistry connectionRegistry) {
        this.connectionExecutorProvider = connectionExecutorProvider;
        this.connectionRegistry = connectionRegistry;
    }

    /**
     * Binds connection gauges to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder connectionMetricsBinder() {
        return registry -> {
            ThreadPoolExecutor executor = this.connectionExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("voicelink.connections.active", connectionRegistry, ConnectionRegistry::size)
                    .description("Number of connections currently registered")
                    .register(registry);

            Gauge.builder("connection.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the connection pool")
                    .register(registry);

            Gauge.builder("connection.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running a connection handler loop")
                    .register(registry);

            Gauge.builder("connection.pool.largest", executor, ThreadPoolExecutor::getLargestPoolSize)
                    .description("Largest number of threads the connection pool has had")
                    .register(registry);

            Gauge.builder("connection.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                    .description("Configured maximum pool size for the connection executor")
                    .register(registry);

            LOG.info("Connection metrics registered: voicelink.connections.active, connection.pool.*");
        };
    }

    /**
     * Logs connection pool health summary every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logConnectionPoolHealth() {
        ThreadPoolExecutor executor = this.connectionExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Connection Pool Health: connections={}, threads={}/{}, active={}, largest={}",
                connectionRegistry.size(),
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getLargestPoolSize()
        );
    }
}
