package com.catalogmcp.mcpserver.health;

import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class McpHealthCheckerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private McpHealthChecker checker(HealthIndicator... indicators) {
        Map<String, HealthIndicator> checks = new LinkedHashMap<>();
        for (int i = 0; i < indicators.length; i++) {
            checks.put("check" + i, indicators[i]);
        }
        return new McpHealthChecker(checks, clock);
    }

    @Test
    void allUpIsUp() {
        McpHealthChecker.HealthReport report = checker(() -> Health.up().build(), () -> Health.up().build()).check();

        assertEquals(Status.UP, report.getStatus());
        assertTrue(report.isServing());
        assertEquals(List.of("check0", "check1"), List.copyOf(report.getChecks().keySet()));
    }

    @Test
    void degradedStillServes() {
        McpHealthChecker.HealthReport report = checker(
            () -> Health.up().build(),
            () -> Health.status(McpHealthChecker.DEGRADED).build()).check();

        assertEquals(McpHealthChecker.DEGRADED, report.getStatus());
        assertTrue(report.isServing());
    }

    @Test
    void anyDownWins() {
        McpHealthChecker.HealthReport report = checker(
            () -> Health.status(McpHealthChecker.DEGRADED).build(),
            () -> Health.down().build(),
            () -> Health.up().build()).check();

        assertEquals(Status.DOWN, report.getStatus());
        assertFalse(report.isServing());
    }

    @Test
    void throwingCheckIsReportedDown() {
        McpHealthChecker.HealthReport report = checker(() -> {
            throw new IllegalStateException("indicator exploded");
        }).check();

        assertEquals(Status.DOWN, report.getStatus());
        assertTrue(String.valueOf(report.getChecks().get("check0").getDetails().get("error"))
            .contains("indicator exploded"));
    }

    @Test
    void noChecksIsUp() {
        McpHealthChecker.HealthReport report = checker().check();

        assertEquals(Status.UP, report.getStatus());
        assertEquals(0, report.getUptimeSeconds());
    }
}
