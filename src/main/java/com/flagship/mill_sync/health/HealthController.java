package com.flagship.mill_sync.health;

import com.flagship.mill_sync.remote.ConnectivityMonitor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check for the shell. Being offline does not make the engine
 * unhealthy; only an unusable local store does.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final ConnectivityMonitor connectivity;
    private final Clock clock;

    public HealthController(DataSource dataSource, ConnectivityMonitor connectivity, Clock clock) {
        this.dataSource = dataSource;
        this.connectivity = connectivity;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", clock.instant().toString());
        response.put("connectivity", connectivity.isOnline() ? "ONLINE" : "OFFLINE");

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Local database check failed: {}", e.getMessage());
            return false;
        }
    }
}
