package com.catalogmcp.mcpserver.health;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.SimpleStatusAggregator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.actuate.health.StatusAggregator;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs the server's own health checks and folds them into one status for {@code /mcp/health}
 * and {@code /mcp/ready}. The same indicators are also published through the actuator
 * health endpoint.
 */
@Component
@Slf4j
public class McpHealthChecker {

    /** Serving, but with reduced capability */
    public static final Status DEGRADED = new Status("DEGRADED");

    private static final StatusAggregator AGGREGATOR = new SimpleStatusAggregator(
        Status.DOWN, Status.OUT_OF_SERVICE, DEGRADED, Status.UP, Status.UNKNOWN);

    private final Map<String, HealthIndicator> checks;
    private final Clock clock;
    private final Instant startedAt;

    @Autowired
    public McpHealthChecker(CatalogHealthIndicator catalog, ToolRegistryHealthIndicator toolRegistry,
                            MemoryHealthIndicator memory) {
        this(orderedChecks(catalog, toolRegistry, memory), Clock.systemUTC());
    }

    public McpHealthChecker(Map<String, HealthIndicator> checks, Clock clock) {
        this.checks = new LinkedHashMap<>(checks);
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    private static Map<String, HealthIndicator> orderedChecks(HealthIndicator catalog, HealthIndicator toolRegistry,
                                                              HealthIndicator memory) {
        Map<String, HealthIndicator> checks = new LinkedHashMap<>();
        checks.put("catalog", catalog);
        checks.put("toolRegistry", toolRegistry);
        checks.put("memory", memory);
        return checks;
    }

    public HealthReport check() {
        Map<String, Health> results = new LinkedHashMap<>();
        checks.forEach((name, indicator) -> results.put(name, run(name, indicator)));
        Set<Status> statuses = results.values().stream().map(Health::getStatus).collect(Collectors.toSet());
        Status status = statuses.isEmpty() ? Status.UP : AGGREGATOR.getAggregateStatus(statuses);
        Instant now = clock.instant();
        return new HealthReport(status, results, now, Duration.between(startedAt, now).getSeconds());
    }

    private static Health run(String name, HealthIndicator indicator) {
        try {
            Health health = indicator.health();
            return health != null ? health : Health.unknown().build();
        } catch (RuntimeException e) {
            log.error("Health check failed: {}", name, e);
            return Health.down(e).build();
        }
    }

    @Value
    public static class HealthReport {
        Status status;
        Map<String, Health> checks;
        Instant timestamp;
        long uptimeSeconds;

        /**
         * Whether the server can take traffic; DEGRADED still serves
         */
        public boolean isServing() {
            return !Status.DOWN.equals(status) && !Status.OUT_OF_SERVICE.equals(status);
        }
    }
}
