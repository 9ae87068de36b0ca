package com.catalogmcp.mcpserver.mcp.registry;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.registry.ToolMetadataRegistry;
import org.springframework.util.ClassUtils;

import java.util.Optional;

/**
 * Looks metadata up in a {@link ToolMetadataRegistry}. Instances resolve to their user class,
 * so CGLIB proxies created by Spring find the metadata of the class they proxy.
 */
public class RegistryToolMetadataProvider implements ToolMetadataProvider {

    private final ToolMetadataRegistry registry;

    public RegistryToolMetadataProvider(ToolMetadataRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Optional<ToolMetadata> resolve(Object implementationOrInstance) {
        if (implementationOrInstance == null) {
            return Optional.empty();
        }
        if (implementationOrInstance instanceof Class) {
            return registry.lookup(ClassUtils.getUserClass((Class<?>) implementationOrInstance));
        }
        return registry.lookup(ClassUtils.getUserClass(implementationOrInstance));
    }
}
