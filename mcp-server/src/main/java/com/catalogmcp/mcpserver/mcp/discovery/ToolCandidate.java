package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.shared.mcp.tools.McpTool;
import lombok.Value;

/**
 * A tool implementation found by discovery, with a label naming where it came from.
 */
@Value
public class ToolCandidate {
    McpTool tool;
    String sourceLabel;
}
