package com.phillippitts.voicelink.exception;

/**
 * Thrown when a connection id is registered twice. Ids are generated to be unique for the
 * lifetime of the process, so this indicates a broken invariant.
 */
public class DuplicateConnectionException extends VoiceLinkException {

    private final String connectionId;

    public DuplicateConnectionException(String connectionId) {
        super("Connection id already registered: " + connectionId);
        this.connectionId = connectionId;
    }

    public String getConnectionId() {
        return connectionId;
    }
}
