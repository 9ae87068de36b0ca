package com.catalogmcp.mcpserver.config.properties;

import com.catalogmcp.mcpserver.mcp.discovery.DiscoveryMode;
import com.catalogmcp.mcpserver.mcp.error.ErrorFormat;
import com.catalogmcp.mcpserver.mcp.execution.BatchFlushPolicy;
import com.catalogmcp.mcpserver.mcp.execution.ExecutionStrategyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@ConfigurationProperties(prefix = "mcp")
@Component
@Data
public class McpServerProperties {
    private ServerConfig server = new ServerConfig();
    private ToolsConfig tools = new ToolsConfig();
    private SecurityConfig security = new SecurityConfig();
    private HealthConfig health = new HealthConfig();

    @Data
    public static class ServerConfig {
        private String name = "Catalog MCP Server";
        private String version = "1.0.0";
        private String description = "MCP tools over the software catalog";
    }

    @Data
    public static class ToolsConfig {
        private DiscoveryConfig discovery = new DiscoveryConfig();
        private ExecutionConfig execution = new ExecutionConfig();
        private ErrorFormat errorFormat = ErrorFormat.STANDARD;

        /**
         * Where to write the tool manifest after loading; blank disables the export
         */
        private String manifestPath;

        @Data
        public static class DiscoveryConfig {
            private DiscoveryMode mode = DiscoveryMode.STATIC;
            private String scanPackage = "com.catalogmcp.mcpserver.catalog.tools";
            private String classSuffix = "Tool";
        }

        @Data
        public static class ExecutionConfig {
            private ExecutionStrategyType strategy = ExecutionStrategyType.AUTO;
            private Duration cacheTtl = Duration.ofMinutes(5);
            private long cacheMaxEntries = 10_000;
            private BatchFlushPolicy.Mode batchFlush = BatchFlushPolicy.Mode.DEFERRED;
            private Duration batchWindow = Duration.ZERO;
            private int schedulerThreads = 1;

            public BatchFlushPolicy toBatchFlushPolicy() {
                return batchFlush == BatchFlushPolicy.Mode.IMMEDIATE
                    ? BatchFlushPolicy.immediate()
                    : BatchFlushPolicy.deferred(batchWindow);
            }
        }
    }

    /**
     * Caller identity and scopes are taken from the transport as given: any {@code Authorization}
     * header marks the call authenticated (the credential is never verified here) and
     * {@code X-MCP-Scopes} is trusted verbatim. These checks only hold behind a gateway that
     * authenticates the caller and sets or strips both headers itself.
     */
    @Data
    public static class SecurityConfig {
        /**
         * Reject tool calls whose transport extras carry no authInfo
         */
        private boolean requireAuth = false;

        /**
         * Check tool requiredScopes against the caller's scopes extra
         */
        private boolean enforceScopes = false;
    }

    @Data
    public static class HealthConfig {
        /**
         * Issue a one-entity catalog request on every health check; when off only the
         * configured URL is checked
         */
        private boolean checkCatalog = true;
        private Duration catalogTimeout = Duration.ofSeconds(5);

        /**
         * Heap usage, in percent of the maximum, above which memory is reported DEGRADED
         */
        private int memoryDegradedPercent = 90;

        /**
         * Heap usage, in percent of the maximum, above which memory is reported DOWN
         */
        private int memoryDownPercent = 95;
    }
}
