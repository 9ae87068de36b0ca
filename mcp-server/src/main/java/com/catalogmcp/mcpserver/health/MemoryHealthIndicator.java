package com.catalogmcp.mcpserver.health;

import com.catalogmcp.mcpserver.config.properties.McpServerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.util.function.Supplier;

/**
 * Heap usage against the configured thresholds. Usage is measured against the maximum heap,
 * or the committed heap when no maximum is defined.
 */
@Component
public class MemoryHealthIndicator implements HealthIndicator {

    private static final long MB = 1024 * 1024;

    private final Supplier<MemoryUsage> heapUsage;
    private final McpServerProperties.HealthConfig healthConfig;

    @Autowired
    public MemoryHealthIndicator(McpServerProperties properties) {
        this(() -> ManagementFactory.getMemoryMXBean().getHeapMemoryUsage(), properties);
    }

    MemoryHealthIndicator(Supplier<MemoryUsage> heapUsage, McpServerProperties properties) {
        this.heapUsage = heapUsage;
        this.healthConfig = properties.getHealth();
    }

    @Override
    public Health health() {
        MemoryUsage usage = heapUsage.get();
        long limit = usage.getMax() > 0 ? usage.getMax() : usage.getCommitted();
        long percent = limit > 0 ? Math.round(usage.getUsed() * 100.0 / limit) : 0;

        Health.Builder builder;
        if (percent > healthConfig.getMemoryDownPercent()) {
            builder = Health.down();
        } else if (percent > healthConfig.getMemoryDegradedPercent()) {
            builder = Health.status(McpHealthChecker.DEGRADED);
        } else {
            builder = Health.up();
        }
        return builder
            .withDetail("message", String.format("Heap usage: %dMB/%dMB (%d%%)",
                usage.getUsed() / MB, limit / MB, percent))
            .withDetail("heapUsedMb", usage.getUsed() / MB)
            .withDetail("heapLimitMb", limit / MB)
            .withDetail("usagePercent", percent)
            .build();
    }
}
