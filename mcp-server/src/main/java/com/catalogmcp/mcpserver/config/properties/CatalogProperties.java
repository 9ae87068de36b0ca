package com.catalogmcp.mcpserver.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@ConfigurationProperties(prefix = "catalog")
@Component
@Data
public class CatalogProperties {
    private String baseUrl = "http://localhost:7007";
    private String apiPath = "/api/catalog";

    /**
     * Static bearer token sent with every request; no header when blank
     */
    private String token;

    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);
    private int ioThreads = 8;
}
