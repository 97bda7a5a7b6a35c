package com.phillippitts.voicelink.exception;

/**
 * Thrown when a well-formed message cannot be answered, e.g. a field has a type the
 * handler for that message cannot work with.
 */
public class MessageDispatchException extends VoiceLinkException {

    private final String messageType;

    public MessageDispatchException(String message, String messageType) {
        super(message + " (type: " + messageType + ")");
        this.messageType = messageType;
    }

    public String getMessageType() {
        return messageType;
    }
}
