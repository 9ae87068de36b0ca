package com.catalogmcp.mcpserver.config.beans;

import com.catalogmcp.mcpserver.catalog.RestCatalogClient;
import com.catalogmcp.mcpserver.config.properties.CatalogProperties;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@Slf4j
public class CatalogClientConfig {

    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, CatalogProperties properties) {
        return builder
            .setConnectTimeout(properties.getConnectTimeout())
            .setReadTimeout(properties.getReadTimeout())
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService catalogIoExecutor(CatalogProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("catalog-io-");
        threadFactory.setDaemon(true);
        log.info("Catalog I/O pool with {} threads", properties.getIoThreads());
        return Executors.newFixedThreadPool(properties.getIoThreads(), threadFactory);
    }

    @Bean
    public CatalogClient catalogClient(@Qualifier("catalogRestTemplate") RestTemplate restTemplate,
                                       ObjectMapper objectMapper, CatalogProperties properties,
                                       @Qualifier("catalogIoExecutor") ExecutorService catalogIoExecutor) {
        return new RestCatalogClient(restTemplate, objectMapper, properties, catalogIoExecutor);
    }
}
