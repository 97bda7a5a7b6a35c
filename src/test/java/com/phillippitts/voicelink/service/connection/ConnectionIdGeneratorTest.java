package com.phillippitts.voicelink.service.connection;

import com.phillippitts.voicelink.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ConnectionIdGeneratorTest {

    @Test
    void idCarriesPrefixAndClockMillis() {
        Instant now = Instant.parse("2026-01-01T00:00:00.123Z");
        ConnectionIdGenerator generator = new ConnectionIdGenerator(new MutableClock(now));

        String id = generator.nextId();

        assertThat(id).startsWith("conn_" + now.toEpochMilli() + "_");
    }

    @Test
    void idsAreUniqueWhenClockStandsStill() {
        ConnectionIdGenerator generator = new ConnectionIdGenerator(new MutableClock(Instant.EPOCH));

        assertThat(generator.nextId()).isNotEqualTo(generator.nextId());
    }

    @Test
    void idsAreUniqueAcrossThreads() throws InterruptedException {
        ConnectionIdGenerator generator = new ConnectionIdGenerator(new MutableClock(Instant.EPOCH));
        Set<String> ids = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(4);

        for (int i = 0; i < 4_000; i++) {
            pool.execute(() -> ids.add(generator.nextId()));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(ids).hasSize(4_000);
    }
}
