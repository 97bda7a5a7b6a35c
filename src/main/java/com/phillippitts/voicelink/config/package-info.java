/**
 * Spring configuration: WebSocket endpoint mapping, the connection thread pool, its metrics,
 * and the shared clock.
 *
 * <p>Typed properties live in {@code config.properties}:
 * <ul>
 *   <li>{@code voicelink.websocket.*} - {@link com.phillippitts.voicelink.config.properties.WebSocketProperties}</li>
 *   <li>{@code threadpool.connection.*} - {@link com.phillippitts.voicelink.config.properties.ThreadPoolProperties}</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.config;
