/**
 * Presentation layer: the WebSocket endpoint and the HTTP status surface.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.websocket} - Spring WebSocket handler and session transport adapter</li>
 *   <li>{@code presentation.controller} - {@code GET /status}</li>
 *   <li>{@code presentation.exception} - Error mapping for HTTP responses</li>
 * </ul>
 *
 * <p>Presentation depends on services; services never depend on presentation.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.presentation;
