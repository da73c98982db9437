package com.flagship.swap_coordinator.health;

import com.flagship.swap_coordinator.session.SessionStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Plain liveness/readiness probe. Unlike the actuator health endpoint, this
 * does not require authorization.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final SessionStore sessionStore;

    public HealthController(DataSource dataSource, SessionStore sessionStore) {
        this.dataSource = dataSource;
        this.sessionStore = sessionStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        response.put("activeSessions", sessionStore.countActive());
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            return false;
        }
    }
}
