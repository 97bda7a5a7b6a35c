package com.phillippitts.voicelink.exception;

/**
 * Thrown when an inbound frame is not a JSON object.
 *
 * <p>Recoverable: the client receives an {@code error} message and the connection stays open.
 * {@link #getDetail()} carries the parser's own description of the problem.
 */
public class MessageDecodeException extends VoiceLinkException {

    private final String detail;

    public MessageDecodeException(String detail) {
        super("Invalid message envelope: " + detail);
        this.detail = detail;
    }

    public MessageDecodeException(String detail, Throwable cause) {
        super("Invalid message envelope: " + detail, cause);
        this.detail = detail;
    }

    public String getDetail() {
        return detail;
    }
}
