package com.catalogmcp.mcpserver.mcp.error;

/**
 * Shape of the error payload produced when a tool call fails.
 */
public enum ErrorFormat {
    /** {@link StandardErrorResponse} with taxonomy code, status and metadata */
    STANDARD,
    /** {@link SimpleErrorResponse}, message only */
    SIMPLE
}
