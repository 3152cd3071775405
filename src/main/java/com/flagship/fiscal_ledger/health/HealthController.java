package com.flagship.fiscal_ledger.health;

import com.flagship.fiscal_ledger.calendar.CalendarConverter;
import com.flagship.fiscal_ledger.exception.ValidationException;
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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness probe. Checks the database, and reports today's date in
 * the fiscal calendar so operators can see when the month table runs out.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final CalendarConverter calendar;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        boolean databaseUp = databaseReachable();

        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("timestamp", clock.instant().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("calendarToday", calendarToday());

        return ResponseEntity.status(databaseUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private String calendarToday() {
        try {
            return calendar.today().toString();
        } catch (ValidationException e) {
            return "unsupported";
        }
    }
}
