package com.phillippitts.voicelink.service.session;

/**
 * Lifecycle states of one connection.
 *
 * <pre>
 * CONNECTING → REGISTERED → RECEIVING ⇄ RESPONDING
 *      any state → CLOSED
 * </pre>
 */
public enum ConnectionState {
    CONNECTING,
    REGISTERED,
    RECEIVING,
    RESPONDING,
    CLOSED
}
