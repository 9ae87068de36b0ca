package com.catalogmcp.mcpserver.mcp.discovery;

import java.util.List;

/**
 * Strategy enumerating tool candidates. The order of the returned list is the registration order.
 */
public interface ToolDiscovery {

    List<ToolCandidate> discover();

    String getName();
}
