package com.flagship.margin_ledger.health;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint. The database is only checked when the ledger runs on JDBC stores.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final String storeType;

    public HealthController(DataSource dataSource, @Value("${ledger.store.type:memory}") String storeType) {
        this.dataSource = dataSource;
        this.storeType = storeType;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("ledgerStore", storeType);

        if ("jdbc".equals(storeType)) {
            boolean dbHealthy = checkDatabase();
            response.put("database", dbHealthy ? "UP" : "DOWN");
            if (!dbHealthy) {
                response.put("status", "DOWN");
                return ResponseEntity.status(503).body(response);
            }
        }

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
