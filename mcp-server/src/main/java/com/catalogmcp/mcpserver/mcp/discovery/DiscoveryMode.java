package com.catalogmcp.mcpserver.mcp.discovery;

public enum DiscoveryMode {
    /** Tools already instantiated as application beans */
    STATIC,
    /** Tool classes found by scanning a package on the classpath */
    CLASSPATH
}
