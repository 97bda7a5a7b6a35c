package com.phillippitts.voicelink.exception;

/**
 * Base exception for all VoiceLink application-specific errors.
 */
public class VoiceLinkException extends RuntimeException {

    public VoiceLinkException(String message) {
        super(message);
    }

    public VoiceLinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
