package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.mcpserver.config.properties.McpServerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Loads the tools once the context is up and exports the manifest when a path is configured.
 * A registration failure propagates and stops the application.
 */
@Component
@Slf4j
public class ToolBootstrap implements ApplicationRunner {

    private final ToolLoader toolLoader;
    private final McpServerProperties properties;

    private volatile ToolLoadReport lastReport;

    public ToolBootstrap(ToolLoader toolLoader, McpServerProperties properties) {
        this.toolLoader = toolLoader;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        lastReport = toolLoader.registerAll();
        if (!lastReport.getSkipped().isEmpty()) {
            log.warn("Skipped tool candidates: {}", lastReport.getSkipped());
        }

        String manifestPath = properties.getTools().getManifestPath();
        if (manifestPath != null && !manifestPath.isBlank()) {
            toolLoader.exportManifest(Path.of(manifestPath));
        }
    }

    /**
     * Report of the startup load, null before it ran
     */
    public ToolLoadReport getLastReport() {
        return lastReport;
    }
}
