package com.flagship.pledge_ledger.health;

import com.flagship.pledge_ledger.observability.LedgerMetrics;
import com.flagship.pledge_ledger.observability.OutboxBacklogGauges;
import com.flagship.pledge_ledger.outbox.OutboxBacklog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Probe for load balancers and on-call.
 *
 * Only the database decides the status: without it no payment or receipt can
 * be issued. Notification backlog and receipt fallbacks are reported for
 * information.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 2;

    private final DataSource dataSource;
    private final OutboxBacklogGauges backlogGauges;
    private final LedgerMetrics metrics;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseReachable();
        OutboxBacklog backlog = backlogGauges.current();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("timestamp", Instant.now().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("pendingNotifications", backlog.getPending());
        body.put("abandonedNotifications", backlog.getAbandoned());
        body.put("receiptFallbacks", (long) metrics.receiptFallbackCount());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
