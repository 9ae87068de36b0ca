package com.catalogmcp.mcpserver.health;

import com.catalogmcp.mcpserver.mcp.discovery.ToolBootstrap;
import com.catalogmcp.mcpserver.mcp.discovery.ToolLoadReport;
import com.catalogmcp.mcpserver.mcp.registry.ToolRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * DOWN until the startup load has registered at least one tool; DEGRADED when candidates
 * were skipped for bad metadata.
 */
@Component
public class ToolRegistryHealthIndicator implements HealthIndicator {

    private final ToolBootstrap toolBootstrap;
    private final ToolRegistry toolRegistry;

    public ToolRegistryHealthIndicator(ToolBootstrap toolBootstrap, ToolRegistry toolRegistry) {
        this.toolBootstrap = toolBootstrap;
        this.toolRegistry = toolRegistry;
    }

    @Override
    public Health health() {
        ToolLoadReport report = toolBootstrap.getLastReport();
        if (report == null) {
            return Health.down().withDetail("message", "Tools not loaded yet").build();
        }
        int registered = toolRegistry.getToolCount();
        if (registered == 0) {
            return Health.down()
                .withDetail("message", "No tools registered")
                .withDetail("processed", report.getProcessed())
                .build();
        }
        Health.Builder builder = report.getSkipped().isEmpty()
            ? Health.up()
            : Health.status(McpHealthChecker.DEGRADED).withDetail("skipped", report.getSkipped());
        return builder
            .withDetail("registered", registered)
            .withDetail("processed", report.getProcessed())
            .build();
    }
}
