package com.phillippitts.voicelink.service.connection;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates connection ids of the form {@code conn_<epochMillis>_<sequence>}.
 *
 * <p>The sequence is process-wide and strictly increasing, so two ids never collide even
 * when the clock stands still or steps backwards.
 */
@Component
public class ConnectionIdGenerator {

    static final String PREFIX = "conn_";

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public ConnectionIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String nextId() {
        return PREFIX + clock.millis() + '_' + sequence.incrementAndGet();
    }
}
