package com.catalogmcp.mcpserver.mcp.manifest;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary of the tools registered during a load pass, exportable as a JSON array:
 *
 * <pre>
 * [ { "name": "get_entity_by_ref", "description": "...", "params": ["entityRef"] } ]
 * </pre>
 */
@Slf4j
public class ToolManifest {

    private static final TypeReference<List<ToolManifestEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final List<ToolManifestEntry> entries = new ArrayList<>();

    public ToolManifest(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public synchronized ToolManifestEntry add(ToolMetadata metadata) {
        ToolManifestEntry entry = ToolManifestEntry.from(metadata);
        entries.add(entry);
        return entry;
    }

    public synchronized List<ToolManifestEntry> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Write the entries as pretty-printed JSON, creating parent directories as needed.
     */
    public void exportTo(Path path) throws IOException {
        List<ToolManifestEntry> snapshot = getEntries();
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
        log.info("Tool manifest with {} entries exported to {}", snapshot.size(), path);
    }

    public List<ToolManifestEntry> readFrom(Path path) throws IOException {
        return objectMapper.readValue(path.toFile(), ENTRY_LIST);
    }
}
