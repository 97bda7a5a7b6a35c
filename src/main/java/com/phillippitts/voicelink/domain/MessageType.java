package com.phillippitts.voicelink.domain;

import java.util.Locale;

/**
 * Closed set of inbound message types understood by the server.
 *
 * <p>Anything not listed here decodes as {@link #UNKNOWN} and is echoed back.
 */
public enum MessageType {
    PING("ping"),
    TEST("test"),
    HEARTBEAT("heartbeat"),
    AUDIO_STREAM("audio_stream"),
    UNKNOWN("unknown");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Maps a wire tag to its type. Matching is exact; {@code null} and unrecognized tags map
     * to {@link #UNKNOWN}.
     */
    public static MessageType fromWire(String tag) {
        if (tag == null) {
            return UNKNOWN;
        }
        for (MessageType t : values()) {
            if (t != UNKNOWN && t.wireName.equals(tag)) {
                return t;
            }
        }
        return UNKNOWN;
    }

    /** Lower-case tag value used for metric tags. */
    public String metricTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
