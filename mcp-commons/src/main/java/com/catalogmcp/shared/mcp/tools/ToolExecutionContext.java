package com.catalogmcp.shared.mcp.tools;

import com.catalogmcp.shared.catalog.CatalogClient;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything a tool may use while executing.
 *
 * <p>The catalog client and host handle are fixed at startup. Each call derives its own copy
 * through {@link #forCall(Map, ToolMetadata)} carrying the transport extras (request id,
 * auth info, scopes...) and the metadata of the invoked tool. Instances are immutable.
 */
@Getter
@ToString(exclude = {"catalogClient", "server"})
public final class ToolExecutionContext {

    private final CatalogClient catalogClient;
    private final ToolDispatchSurface server;
    private final Map<String, Object> extras;
    private final ToolMetadata metadata;

    @Builder(toBuilder = true)
    private ToolExecutionContext(CatalogClient catalogClient, ToolDispatchSurface server,
                                 Map<String, Object> extras, ToolMetadata metadata) {
        this.catalogClient = catalogClient;
        this.server = server;
        this.extras = extras == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
        this.metadata = metadata;
    }

    public ToolExecutionContext forCall(Map<String, Object> callExtras, ToolMetadata toolMetadata) {
        return toBuilder().extras(callExtras).metadata(toolMetadata).build();
    }

    /**
     * Copy with one extra added or replaced; lets middleware enrich the context for inner layers.
     */
    public ToolExecutionContext withExtra(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(extras);
        copy.put(key, value);
        return toBuilder().extras(copy).build();
    }

    public Object getExtra(String key) {
        return extras.get(key);
    }

    public String getToolName() {
        return metadata != null ? metadata.getName() : null;
    }
}
