package com.catalogmcp.mcpserver.config.beans;

import com.catalogmcp.mcpserver.config.properties.McpServerProperties;
import com.catalogmcp.mcpserver.mcp.discovery.ClasspathToolDiscovery;
import com.catalogmcp.mcpserver.mcp.discovery.StaticToolDiscovery;
import com.catalogmcp.mcpserver.mcp.discovery.ToolDiscovery;
import com.catalogmcp.mcpserver.mcp.discovery.ToolLoader;
import com.catalogmcp.mcpserver.mcp.error.ToolErrorClassifier;
import com.catalogmcp.mcpserver.mcp.error.ToolErrorHandler;
import com.catalogmcp.mcpserver.mcp.error.ToolResponseFormatter;
import com.catalogmcp.mcpserver.mcp.execution.AdaptiveExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.execution.BatchedExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.execution.CachedExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.execution.DirectExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.execution.ToolExecutionStrategy;
import com.catalogmcp.mcpserver.mcp.manifest.ToolManifest;
import com.catalogmcp.mcpserver.mcp.middleware.AuthenticationMiddleware;
import com.catalogmcp.mcpserver.mcp.middleware.AuthorizationMiddleware;
import com.catalogmcp.mcpserver.mcp.middleware.LoggingMiddleware;
import com.catalogmcp.mcpserver.mcp.middleware.ToolMiddlewarePipeline;
import com.catalogmcp.mcpserver.mcp.middleware.ValidationMiddleware;
import com.catalogmcp.mcpserver.mcp.registry.DefaultToolRegistrar;
import com.catalogmcp.mcpserver.mcp.registry.DefaultToolValidator;
import com.catalogmcp.mcpserver.mcp.registry.RegistryToolMetadataProvider;
import com.catalogmcp.mcpserver.mcp.registry.ToolMetadataProvider;
import com.catalogmcp.mcpserver.mcp.registry.ToolRegistrar;
import com.catalogmcp.mcpserver.mcp.registry.ToolRegistry;
import com.catalogmcp.mcpserver.mcp.registry.ToolValidator;
import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.stream.Collectors;

/**
 * Wires the tool dispatch framework: metadata resolution, validation, middleware,
 * execution strategy, error handling, registration and discovery.
 */
@Configuration
@Slf4j
public class ToolDispatchConfig {

    @Bean
    public ToolMetadataRegistry toolMetadataRegistry() {
        return ToolMetadataRegistry.getInstance();
    }

    @Bean
    public ToolMetadataProvider toolMetadataProvider(ToolMetadataRegistry toolMetadataRegistry) {
        return new RegistryToolMetadataProvider(toolMetadataRegistry);
    }

    @Bean
    public ToolValidator toolValidator() {
        return new DefaultToolValidator();
    }

    @Bean
    public ToolMiddlewarePipeline toolMiddlewarePipeline(McpServerProperties properties) {
        McpServerProperties.SecurityConfig security = properties.getSecurity();
        ToolMiddlewarePipeline pipeline = new ToolMiddlewarePipeline();
        pipeline.use(new LoggingMiddleware());
        pipeline.use(new AuthenticationMiddleware(security.isRequireAuth()));
        pipeline.use(new AuthorizationMiddleware(security.isEnforceScopes()));
        pipeline.use(new ValidationMiddleware());
        log.info("Tool middleware pipeline: {}", pipeline.getMiddlewareNames());
        return pipeline;
    }

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService toolBatchScheduler(McpServerProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("tool-batch-");
        threadFactory.setDaemon(true);
        return Executors.newScheduledThreadPool(properties.getTools().getExecution().getSchedulerThreads(), threadFactory);
    }

    @Bean
    public ToolExecutionStrategy toolExecutionStrategy(McpServerProperties properties, ObjectMapper objectMapper,
                                                       ScheduledExecutorService toolBatchScheduler) {
        McpServerProperties.ToolsConfig.ExecutionConfig execution = properties.getTools().getExecution();
        ToolExecutionStrategy strategy;
        switch (execution.getStrategy()) {
            case DIRECT:
                strategy = new DirectExecutionStrategy();
                break;
            case CACHED:
                strategy = cachedStrategy(execution, objectMapper);
                break;
            case BATCHED:
                strategy = new BatchedExecutionStrategy(toolBatchScheduler, execution.toBatchFlushPolicy());
                break;
            case AUTO:
            default:
                strategy = new AdaptiveExecutionStrategy(
                    new DirectExecutionStrategy(),
                    cachedStrategy(execution, objectMapper),
                    new BatchedExecutionStrategy(toolBatchScheduler, execution.toBatchFlushPolicy()));
                break;
        }
        log.info("Tool execution strategy: {}", strategy.getName());
        return strategy;
    }

    @Bean
    public ToolErrorHandler toolErrorHandler(ToolErrorClassifier classifier, ToolResponseFormatter formatter,
                                             ObjectMapper objectMapper, McpServerProperties properties) {
        return new ToolErrorHandler(classifier, formatter, objectMapper, properties.getTools().getErrorFormat());
    }

    @Bean
    public ToolExecutionContext toolExecutionContext(CatalogClient catalogClient, ToolRegistry toolRegistry) {
        return ToolExecutionContext.builder()
            .catalogClient(catalogClient)
            .server(toolRegistry)
            .build();
    }

    @Bean
    public ToolRegistrar toolRegistrar(ToolRegistry toolRegistry, ToolExecutionContext toolExecutionContext,
                                       ToolMiddlewarePipeline toolMiddlewarePipeline,
                                       ToolExecutionStrategy toolExecutionStrategy,
                                       ToolErrorHandler toolErrorHandler) {
        return new DefaultToolRegistrar(toolRegistry, toolExecutionContext, toolMiddlewarePipeline,
            toolExecutionStrategy, toolErrorHandler);
    }

    @Bean
    public ToolDiscovery toolDiscovery(McpServerProperties properties, ObjectProvider<McpTool> toolBeans) {
        McpServerProperties.ToolsConfig.DiscoveryConfig discovery = properties.getTools().getDiscovery();
        switch (discovery.getMode()) {
            case CLASSPATH:
                return new ClasspathToolDiscovery(discovery.getScanPackage(), discovery.getClassSuffix());
            case STATIC:
            default:
                return new StaticToolDiscovery(toolBeans.orderedStream().collect(Collectors.toList()));
        }
    }

    @Bean
    public ToolManifest toolManifest(ObjectMapper objectMapper) {
        return new ToolManifest(objectMapper);
    }

    @Bean
    public ToolLoader toolLoader(ToolDiscovery toolDiscovery, ToolMetadataProvider toolMetadataProvider,
                                 ToolValidator toolValidator, ToolRegistrar toolRegistrar, ToolManifest toolManifest) {
        return new ToolLoader(toolDiscovery, toolMetadataProvider, toolValidator, toolRegistrar, toolManifest);
    }

    private static CachedExecutionStrategy cachedStrategy(McpServerProperties.ToolsConfig.ExecutionConfig execution,
                                                          ObjectMapper objectMapper) {
        return new CachedExecutionStrategy(objectMapper, execution.getCacheTtl(), execution.getCacheMaxEntries(),
            Ticker.systemTicker());
    }
}
