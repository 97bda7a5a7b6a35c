package com.phillippitts.voicelink.config;

import com.phillippitts.voicelink.config.properties.WebSocketProperties;
import com.phillippitts.voicelink.presentation.websocket.VoiceLinkWebSocketHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Maps {@link VoiceLinkWebSocketHandler} to the configured path and sets container limits.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger LOG = LogManager.getLogger(WebSocketConfig.class);

    private final WebSocketProperties properties;
    private final VoiceLinkWebSocketHandler handler;

    public WebSocketConfig(WebSocketProperties properties, VoiceLinkWebSocketHandler handler) {
        this.properties = properties;
        this.handler = handler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, properties.getPath())
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
        LOG.info("WebSocket endpoint mapped at {} (allowed origins: {})",
                properties.getPath(), properties.getAllowedOrigins());
    }

    /**
     * Container settings for every WebSocket session.
     *
     * <p>The session idle timeout is 0 (never expire): a client may stay connected without
     * sending anything.
     *
     * @return container factory bean picked up by the embedded servlet container
     */
    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getMaxTextMessageBufferSize());
        container.setMaxBinaryMessageBufferSize(properties.getMaxBinaryMessageBufferSize());
        container.setMaxSessionIdleTimeout(0L);
        return container;
    }
}
