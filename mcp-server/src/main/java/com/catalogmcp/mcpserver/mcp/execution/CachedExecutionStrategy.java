package com.catalogmcp.mcpserver.mcp.execution;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Serves repeated calls of cacheable tools from a time-boxed cache.
 *
 * <p>Entries are keyed by tool name plus the arguments serialised as JSON with map keys sorted,
 * and expire once their age reaches the TTL. The cache belongs to this strategy instance and is
 * bounded in size; least recently used entries are evicted first. Only successful results are
 * stored. Tools not flagged {@code cacheable} are executed directly.
 */
@Slf4j
public class CachedExecutionStrategy implements ToolExecutionStrategy {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    public static final long DEFAULT_MAX_ENTRIES = 10_000;

    private final Cache<String, ToolResult> cache;
    private final ObjectMapper keyMapper;
    private final Duration ttl;

    public CachedExecutionStrategy(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_TTL, DEFAULT_MAX_ENTRIES, Ticker.systemTicker());
    }

    public CachedExecutionStrategy(ObjectMapper objectMapper, Duration ttl, long maxEntries, Ticker ticker) {
        this.ttl = ttl;
        this.keyMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.cache = Caffeine.newBuilder()
            .expireAfterWrite(ttl)
            .maximumSize(maxEntries)
            .ticker(ticker)
            .recordStats()
            .build();
        log.info("CachedExecutionStrategy initialized: ttl={}, maxEntries={}", ttl, maxEntries);
    }

    @Override
    public CompletableFuture<ToolResult> execute(McpTool tool, Map<String, Object> arguments,
                                                 ToolExecutionContext context, ToolMetadata metadata) {
        if (!metadata.isCacheable()) {
            return tool.execute(arguments, context);
        }

        String cacheKey;
        try {
            cacheKey = generateCacheKey(metadata.getName(), arguments);
        } catch (JsonProcessingException e) {
            log.warn("Arguments of tool '{}' are not serializable, bypassing cache", metadata.getName(), e);
            return tool.execute(arguments, context);
        }

        ToolResult cached = cache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Cache hit for tool '{}'", metadata.getName());
            return CompletableFuture.completedFuture(cached);
        }

        return tool.execute(arguments, context).thenApply(result -> {
            if (result != null) {
                cache.put(cacheKey, result);
            }
            return result;
        });
    }

    @Override
    public String getName() {
        return "cached";
    }

    public void clearCache() {
        cache.invalidateAll();
        log.debug("Execution cache cleared");
    }

    public long cacheSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public long hitCount() {
        return cache.stats().hitCount();
    }

    public Duration getTtl() {
        return ttl;
    }

    String generateCacheKey(String toolName, Map<String, Object> arguments) throws JsonProcessingException {
        return toolName + ":" + keyMapper.writeValueAsString(arguments);
    }
}
