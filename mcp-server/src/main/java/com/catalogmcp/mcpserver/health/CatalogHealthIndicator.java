package com.catalogmcp.mcpserver.health;

import com.catalogmcp.mcpserver.config.properties.CatalogProperties;
import com.catalogmcp.mcpserver.config.properties.McpServerProperties;
import com.catalogmcp.shared.catalog.CatalogClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Catalog connectivity: the base URL must be a valid URL and, unless probing is disabled,
 * a one-entity listing must answer within the configured timeout.
 */
@Component
@Slf4j
public class CatalogHealthIndicator implements HealthIndicator {

    private final CatalogClient catalogClient;
    private final CatalogProperties catalogProperties;
    private final McpServerProperties.HealthConfig healthConfig;

    public CatalogHealthIndicator(CatalogClient catalogClient, CatalogProperties catalogProperties,
                                  McpServerProperties properties) {
        this.catalogClient = catalogClient;
        this.catalogProperties = catalogProperties;
        this.healthConfig = properties.getHealth();
    }

    @Override
    public Health health() {
        String baseUrl = catalogProperties.getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            return Health.down().withDetail("message", "catalog.base-url is not set").build();
        }
        try {
            URI.create(baseUrl).toURL();
        } catch (IllegalArgumentException | MalformedURLException e) {
            return Health.down()
                .withDetail("message", "catalog.base-url is not a valid URL")
                .withDetail("baseUrl", baseUrl)
                .build();
        }
        if (!healthConfig.isCheckCatalog()) {
            return Health.up()
                .withDetail("message", "Catalog configuration is valid")
                .withDetail("baseUrl", baseUrl)
                .build();
        }
        return listOneEntity(baseUrl);
    }

    private Health listOneEntity(String baseUrl) {
        Duration timeout = healthConfig.getCatalogTimeout();
        long start = System.nanoTime();
        try {
            catalogClient.getEntities(List.of(), List.of("metadata.name"), 1, null)
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return Health.up()
                .withDetail("baseUrl", baseUrl)
                .withDetail("latencyMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                .build();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Catalog health check failed: {}", cause.getMessage());
            return Health.down(asException(cause)).withDetail("baseUrl", baseUrl).build();
        } catch (TimeoutException e) {
            log.warn("Catalog health check timed out after {}", timeout);
            return Health.down()
                .withDetail("message", "No catalog response within " + timeout)
                .withDetail("baseUrl", baseUrl)
                .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down(e).withDetail("baseUrl", baseUrl).build();
        }
    }

    private static Exception asException(Throwable cause) {
        return cause instanceof Exception ? (Exception) cause : new IllegalStateException(cause);
    }
}
