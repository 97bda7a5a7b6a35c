package com.phillippitts.voicelink.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>The connection pool runs one blocking handler loop per open connection, so
 * {@code max-pool-size} is the ceiling on concurrent connections.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ConnectionPoolProperties connection = new ConnectionPoolProperties();

    public ConnectionPoolProperties getConnection() {
        return connection;
    }

    public void setConnection(ConnectionPoolProperties connection) {
        this.connection = connection;
    }

    /**
     * Connection executor pool configuration.
     */
    public static class ConnectionPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 512;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "conn-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
