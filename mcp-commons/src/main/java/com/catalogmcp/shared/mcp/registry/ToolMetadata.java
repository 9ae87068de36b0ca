package com.catalogmcp.shared.mcp.registry;

import com.catalogmcp.shared.mcp.schema.ParameterSchema;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.List;

/**
 * Declarative description of an MCP tool: identity, parameter shape and policy flags.
 *
 * <p>Instances are immutable. The builder performs no checks; invariants on name,
 * description and batch size are enforced when the tool is validated for registration.
 */
@Value
@Builder(toBuilder = true)
public class ToolMetadata {

    /**
     * Tool name (unique among registered tools)
     */
    String name;

    /**
     * Tool description shown to the calling agent
     */
    String description;

    /**
     * Parameter shape, may be null for parameterless tools
     */
    ParameterSchema parameterSchema;

    String category;

    @Singular
    List<String> tags;

    String version;

    boolean deprecated;

    /**
     * Results may be served from the execution cache
     */
    boolean cacheable;

    /**
     * Callers must explicitly confirm before the tool runs
     */
    boolean requiresConfirmation;

    @Singular
    List<String> requiredScopes;

    /**
     * Upper bound of calls coalesced into one flush; null or 1 disables batching
     */
    Integer maxBatchSize;

    public boolean hasParameterSchema() {
        return parameterSchema != null;
    }

    /**
     * Top-level parameter names when the schema is introspectable, otherwise empty
     */
    public List<String> parameterNames() {
        if (parameterSchema == null || !parameterSchema.isIntrospectable()) {
            return Collections.emptyList();
        }
        return parameterSchema.fieldNames();
    }

    public boolean isBatchable() {
        return maxBatchSize != null && maxBatchSize > 1;
    }

    public boolean hasRequiredScopes() {
        return requiredScopes != null && !requiredScopes.isEmpty();
    }
}
