package com.phillippitts.voicelink.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for the WebSocket endpoint.
 *
 * <p>No idle or send timeouts are configurable: connections stay open until the client
 * disconnects or a write fails.
 */
@Validated
@ConfigurationProperties(prefix = "voicelink.websocket")
public class WebSocketProperties {

    /** Path the WebSocket handler is mapped to. */
    @NotBlank
    @Pattern(regexp = "^/.*", message = "must start with '/'")
    private final String path;

    /** Origins allowed to open a connection; {@code *} allows any. */
    @NotEmpty
    private final List<String> allowedOrigins;

    /** Largest text frame the container accepts, in bytes. */
    @Min(1024)
    @Max(64 * 1024 * 1024)
    private final int maxTextMessageBufferSize;

    /** Largest binary frame the container accepts, in bytes. */
    @Min(1024)
    @Max(64 * 1024 * 1024)
    private final int maxBinaryMessageBufferSize;

    @ConstructorBinding
    public WebSocketProperties(@DefaultValue("/ws") String path,
                               @DefaultValue("*") List<String> allowedOrigins,
                               @DefaultValue("1048576") int maxTextMessageBufferSize,
                               @DefaultValue("1048576") int maxBinaryMessageBufferSize) {
        this.path = path;
        this.allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
        this.maxTextMessageBufferSize = maxTextMessageBufferSize;
        this.maxBinaryMessageBufferSize = maxBinaryMessageBufferSize;
    }

    public String getPath() { return path; }
    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public int getMaxTextMessageBufferSize() { return maxTextMessageBufferSize; }
    public int getMaxBinaryMessageBufferSize() { return maxBinaryMessageBufferSize; }
}
