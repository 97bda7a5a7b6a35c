package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs connection handler loops.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on expected concurrent connections.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the thread-per-connection executor.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.connection.*} properties:
     * <ul>
     *   <li>Core pool: default 8 - threads kept warm between connections</li>
     *   <li>Max pool: default 512 - hard ceiling on concurrently open connections</li>
     *   <li>Queue: none - every accepted connection gets its own thread or is rejected</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A handler loop blocks for
     * the lifetime of its connection, so queueing it or running it on the container thread
     * would stall the container; the WebSocket handler closes rejected sessions instead.
     *
     * <p>Shutdown: running loops are interrupted rather than awaited, since a connection may
     * stay open indefinitely. Each interrupted loop exits through its normal cleanup.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the accepting thread to the
     * worker thread.
     *
     * @return Configured executor for connection handler loops
     */
    @Bean(name = "connectionExecutor")
    public ThreadPoolTaskExecutor connectionExecutor() {
        ThreadPoolProperties.ConnectionPoolProperties props = threadPoolProperties.getConnection();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), props.getMaxPoolSize()));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(ThreadPoolConfig::propagateThreadContext);

        executor.initialize();
        return executor;
    }

    static Runnable propagateThreadContext(Runnable runnable) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                runnable.run();
            } finally {
                ThreadContext.clearAll();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
