/**
 * Spring WebSocket adapter.
 *
 * <p>Bridges the servlet container's callback model onto the blocking
 * {@link com.phillippitts.voicelink.service.transport.MessageTransport} consumed by
 * {@link com.phillippitts.voicelink.service.session.ConnectionHandlerLoop}. Protocol logic does
 * not live here.
 *
 * @since 1.0
 */
package com.phillippitts.voicelink.presentation.websocket;
