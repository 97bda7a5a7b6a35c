package com.phillippitts.voicelink.service.session;

/**
 * Why a connection handler loop ended.
 */
public enum CloseReason {
    /** Peer closed the connection in an orderly way. */
    CLEAN,
    /** Receive failed at the transport level. */
    ABRUPT,
    /** A response could not be written. */
    SEND_FAILED,
    /** The {@code system_ready} message could not be written. */
    WELCOME_FAILED,
    /** The connection could not be registered. */
    REJECTED,
    /** An unexpected failure escaped message handling. */
    ERROR
}
