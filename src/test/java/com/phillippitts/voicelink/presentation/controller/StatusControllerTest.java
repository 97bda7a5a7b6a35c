package com.phillippitts.voicelink.presentation.controller;

import com.phillippitts.voicelink.service.connection.ConnectionRecord;
import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import com.phillippitts.voicelink.testutil.MutableClock;
import com.phillippitts.voicelink.testutil.ScriptedTransport;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StatusControllerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @SuppressWarnings("unchecked")
    void reportsEveryConnectionWithCounters() {
        // Arrange
        MutableClock clock = new MutableClock(T0);
        ConnectionRegistry registry = new ConnectionRegistry(clock);
        registry.add("conn_a", new ConnectionRecord("conn_a", new ScriptedTransport(), clock.instant()));
        clock.advance(Duration.ofSeconds(4));
        registry.touch("conn_a");
        clock.advance(Duration.ofSeconds(2));
        StatusController controller = new StatusController(registry, clock);

        // Act
        ResponseEntity<Map<String, Object>> response = controller.status();

        // Assert
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = response.getBody();
        assertThat(body).containsEntry("status", "healthy")
                .containsEntry("total_connections", 1)
                .containsEntry("server_time", T0.getEpochSecond() + 6);
        Map<String, Object> connections = (Map<String, Object>) body.get("connections");
        Map<String, Object> entry = (Map<String, Object>) connections.get("conn_a");
        assertThat(entry).containsEntry("connected_at", T0.getEpochSecond())
                .containsEntry("last_activity", T0.getEpochSecond() + 4)
                .containsEntry("duration", 6.0)
                .containsEntry("message_count", 1L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportsEmptyRegistry() {
        MutableClock clock = new MutableClock(T0);
        StatusController controller = new StatusController(new ConnectionRegistry(clock), clock);

        Map<String, Object> body = controller.status().getBody();

        assertThat(body).containsEntry("total_connections", 0);
        assertThat((Map<String, Object>) body.get("connections")).isEmpty();
    }
}
