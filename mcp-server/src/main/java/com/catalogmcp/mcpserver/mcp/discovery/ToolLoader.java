package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.mcpserver.mcp.manifest.ToolManifest;
import com.catalogmcp.mcpserver.mcp.registry.ToolMetadataProvider;
import com.catalogmcp.mcpserver.mcp.registry.ToolRegistrar;
import com.catalogmcp.mcpserver.mcp.registry.ToolValidator;
import com.catalogmcp.shared.mcp.errors.InvalidToolMetadataException;
import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs one registration pass over the discovered candidates.
 *
 * <p>For each candidate, in discovery order: resolve its metadata, validate it, register the
 * tool and add it to the manifest. Candidates without metadata or with invalid metadata are
 * logged and skipped. Registrar failures are not caught and abort the pass.
 */
@Slf4j
public class ToolLoader {

    private final ToolDiscovery discovery;
    private final ToolMetadataProvider metadataProvider;
    private final ToolValidator validator;
    private final ToolRegistrar registrar;
    private final ToolManifest manifest;

    public ToolLoader(ToolDiscovery discovery, ToolMetadataProvider metadataProvider, ToolValidator validator,
                      ToolRegistrar registrar, ToolManifest manifest) {
        this.discovery = discovery;
        this.metadataProvider = metadataProvider;
        this.validator = validator;
        this.registrar = registrar;
        this.manifest = manifest;
    }

    public ToolLoadReport registerAll() {
        List<ToolCandidate> candidates = discovery.discover();
        log.info("Loading tools: {} candidate(s) from {} discovery", candidates.size(), discovery.getName());

        int registered = 0;
        List<String> skipped = new ArrayList<>();
        for (ToolCandidate candidate : candidates) {
            String source = candidate.getSourceLabel();

            Optional<ToolMetadata> resolved = metadataProvider.resolve(candidate.getTool());
            if (resolved.isEmpty()) {
                log.warn("No tool metadata attached to {}, skipping", source);
                skipped.add(source);
                continue;
            }
            ToolMetadata metadata = resolved.get();

            try {
                validator.validate(metadata, source);
            } catch (InvalidToolMetadataException e) {
                log.warn("Skipping {}: {}", source, e.getMessage());
                skipped.add(source);
                continue;
            }

            registrar.register(candidate.getTool(), metadata);
            manifest.add(metadata);
            registered++;
        }

        log.info("Tool loading complete: {} processed, {} registered", candidates.size(), registered);
        return new ToolLoadReport(candidates.size(), registered, List.copyOf(skipped));
    }

    /**
     * Write the manifest to {@code path}. I/O failures are logged and reported as {@code false}.
     */
    public boolean exportManifest(Path path) {
        try {
            manifest.exportTo(path);
            return true;
        } catch (IOException e) {
            log.error("Failed to export tool manifest to {}", path, e);
            return false;
        }
    }

    public ToolManifest getManifest() {
        return manifest;
    }
}
