package com.catalogmcp.shared.mcp.registry;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Associates tool implementation classes with their metadata.
 *
 * <p>Entries are keyed by class identity, not by tool name: two classes may declare the
 * same name and only collide when both are bound to the dispatch surface. Tool classes
 * populate the shared instance at class initialisation:
 *
 * <pre>
 * public static final ToolMetadata METADATA = ToolMetadataRegistry.getInstance()
 *     .define(GetEntityByRefTool.class, ToolMetadata.builder()...build());
 * </pre>
 */
public final class ToolMetadataRegistry {

    private static final ToolMetadataRegistry INSTANCE = new ToolMetadataRegistry();

    private final Map<Class<?>, ToolMetadata> byImplementation = new ConcurrentHashMap<>();

    public static ToolMetadataRegistry getInstance() {
        return INSTANCE;
    }

    /**
     * Creates an isolated registry (mainly for tests); production code uses {@link #getInstance()}.
     */
    public ToolMetadataRegistry() {
    }

    /**
     * Attach metadata to an implementation class, replacing any previous entry for that class.
     */
    public void register(Class<?> implementation, ToolMetadata metadata) {
        Objects.requireNonNull(implementation, "implementation");
        Objects.requireNonNull(metadata, "metadata");
        byImplementation.put(implementation, metadata);
    }

    /**
     * Same as {@link #register(Class, ToolMetadata)} but returns the metadata, for use in field initialisers.
     */
    public ToolMetadata define(Class<?> implementation, ToolMetadata metadata) {
        register(implementation, metadata);
        return metadata;
    }

    public Optional<ToolMetadata> lookup(Class<?> implementation) {
        if (implementation == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byImplementation.get(implementation));
    }

    public boolean contains(Class<?> implementation) {
        return implementation != null && byImplementation.containsKey(implementation);
    }

    public Map<Class<?>, ToolMetadata> getAll() {
        return Collections.unmodifiableMap(byImplementation);
    }

    public int size() {
        return byImplementation.size();
    }

    /**
     * Clears all entries (mainly for tests).
     */
    public void clear() {
        byImplementation.clear();
    }
}
