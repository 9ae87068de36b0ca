package com.catalogmcp.mcpserver.mcp.discovery;

import lombok.Value;

import java.util.List;

@Value
public class ToolLoadReport {
    int processed;
    int registered;
    /** Source labels of candidates skipped for missing or invalid metadata */
    List<String> skipped;
}
