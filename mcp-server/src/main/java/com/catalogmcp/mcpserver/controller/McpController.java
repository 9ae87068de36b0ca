package com.catalogmcp.mcpserver.controller;

import com.catalogmcp.mcpserver.health.McpHealthChecker;
import com.catalogmcp.mcpserver.mcp.discovery.ToolBootstrap;
import com.catalogmcp.mcpserver.mcp.discovery.ToolLoadReport;
import com.catalogmcp.mcpserver.mcp.manifest.ToolManifest;
import com.catalogmcp.mcpserver.mcp.manifest.ToolManifestEntry;
import com.catalogmcp.mcpserver.mcp.middleware.AuthenticationMiddleware;
import com.catalogmcp.mcpserver.mcp.middleware.AuthorizationMiddleware;
import com.catalogmcp.mcpserver.mcp.protocol.McpProtocolHandler;
import com.catalogmcp.shared.mcp.protocol.McpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * JSON-RPC over plain HTTP request/response.
 */
@RestController
@RequestMapping("/mcp")
@Slf4j
public class McpController {

    public static final String SCOPES_HEADER = "X-MCP-Scopes";

    private final McpProtocolHandler mcpProtocolHandler;
    private final ToolManifest toolManifest;
    private final ToolBootstrap toolBootstrap;
    private final McpHealthChecker healthChecker;

    public McpController(McpProtocolHandler mcpProtocolHandler, ToolManifest toolManifest,
                         ToolBootstrap toolBootstrap, McpHealthChecker healthChecker) {
        this.mcpProtocolHandler = mcpProtocolHandler;
        this.toolManifest = toolManifest;
        this.toolBootstrap = toolBootstrap;
        this.healthChecker = healthChecker;
    }

    /**
     * Handle MCP JSON-RPC messages
     * POST /mcp/message
     */
    @PostMapping("/message")
    public CompletableFuture<ResponseEntity<McpResponse>> handleMcpMessage(
            @RequestBody String jsonMessage,
            @RequestParam(name = "connectionId", required = false) String connectionId,
            @RequestHeader(name = "Authorization", required = false) String authorization,
            @RequestHeader(name = SCOPES_HEADER, required = false) String scopes) {

        String connection = connectionId != null ? connectionId : UUID.randomUUID().toString();
        log.debug("Received MCP message on connection {}", connection);

        return mcpProtocolHandler.handleMessage(jsonMessage, connection, transportExtras(authorization, scopes))
            .thenApply(response -> response == null
                ? ResponseEntity.accepted().<McpResponse>build()
                : ResponseEntity.ok(response));
    }

    /**
     * Health check endpoint: every check with its details, 503 when the server cannot serve
     * GET /mcp/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        McpHealthChecker.HealthReport healthReport = healthChecker.check();
        Map<String, Object> health = new LinkedHashMap<>(mcpProtocolHandler.describe());
        health.put("status", healthReport.getStatus().getCode());
        health.put("uptime_seconds", healthReport.getUptimeSeconds());
        ToolLoadReport report = toolBootstrap.getLastReport();
        if (report != null) {
            health.put("tools_processed", report.getProcessed());
            health.put("tools_registered", report.getRegistered());
            health.put("tools_skipped", report.getSkipped());
        }
        health.put("checks", healthReport.getChecks());
        return ResponseEntity.status(healthReport.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
            .body(health);
    }

    /**
     * Readiness for load balancers
     * GET /mcp/ready
     */
    @GetMapping("/ready")
    public ResponseEntity<Map<String, Object>> ready() {
        McpHealthChecker.HealthReport healthReport = healthChecker.check();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthReport.isServing() ? "ready" : "not_ready");
        body.put("timestamp", healthReport.getTimestamp().toString());
        if (!healthReport.isServing()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
        body.put("uptime_seconds", healthReport.getUptimeSeconds());
        return ResponseEntity.ok(body);
    }

    /**
     * Manifest of the registered tools
     * GET /mcp/manifest
     */
    @GetMapping("/manifest")
    public ResponseEntity<List<ToolManifestEntry>> manifest() {
        return ResponseEntity.ok(toolManifest.getEntries());
    }

    /**
     * Both headers are taken as sent; see {@code McpServerProperties.SecurityConfig} for the
     * trust this places in the fronting gateway.
     */
    private static Map<String, Object> transportExtras(String authorization, String scopes) {
        Map<String, Object> extras = new HashMap<>();
        if (authorization != null && !authorization.isBlank()) {
            int space = authorization.indexOf(' ');
            String scheme = space > 0 ? authorization.substring(0, space) : authorization;
            // the credential itself never enters the tool context
            extras.put(AuthenticationMiddleware.AUTH_INFO_EXTRA, Map.of("scheme", scheme, "authenticated", true));
        }
        if (scopes != null && !scopes.isBlank()) {
            extras.put(AuthorizationMiddleware.SCOPES_EXTRA, scopes);
        }
        return extras;
    }
}
