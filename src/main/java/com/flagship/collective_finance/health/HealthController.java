package com.flagship.collective_finance.health;

import com.flagship.collective_finance.config.FinanceProperties;
import com.flagship.collective_finance.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated health check for load balancers.
 *
 * <p>Mutations cannot run without the database, so a failed connection check
 * turns the whole response into 503. A missing open-source host only
 * disables one branch of virtual card issuance and is reported as DEGRADED.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxService outboxService;
    private final FinanceProperties financeProperties;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now(clock).toString());

        if (!databaseReachable()) {
            body.put("status", "DOWN");
            body.put("database", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }

        boolean openSourceHostConfigured = financeProperties.getOpenSourceHostId() != null;
        body.put("status", openSourceHostConfigured ? "UP" : "DEGRADED");
        body.put("database", "UP");
        body.put("pendingNotifications", outboxService.countUnpublished());
        body.put("openSourceHostConfigured", openSourceHostConfigured);
        body.put("processorMode", financeProperties.getProcessor().getMode());
        return ResponseEntity.ok(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Health check could not reach the database: {}", e.getMessage());
            return false;
        }
    }
}
