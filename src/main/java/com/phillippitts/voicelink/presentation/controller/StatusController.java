package com.phillippitts.voicelink.presentation.controller;

import com.phillippitts.voicelink.domain.ConnectionSnapshot;
import com.phillippitts.voicelink.service.connection.ConnectionRegistry;
import com.phillippitts.voicelink.util.TimeUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process status with per-connection counters, built from a registry snapshot.
 */
@RestController
class StatusController {

    private final ConnectionRegistry registry;
    private final Clock clock;

    StatusController(ConnectionRegistry registry, Clock clock) {
        this.registry = registry;
        this.clock = clock;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        List<ConnectionSnapshot> snapshot = registry.snapshot();
        Instant now = clock.instant();

        Map<String, Object> connections = new LinkedHashMap<>();
        for (ConnectionSnapshot c : snapshot) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("connected_at", TimeUtils.epochSeconds(c.connectedAt()));
            entry.put("last_activity", TimeUtils.epochSeconds(c.lastActivity()));
            entry.put("duration", c.uptimeSeconds(now));
            entry.put("message_count", c.messageCount());
            connections.put(c.id(), entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("server_time", TimeUtils.epochSeconds(now));
        body.put("total_connections", snapshot.size());
        body.put("connections", connections);
        return ResponseEntity.ok(body);
    }
}
