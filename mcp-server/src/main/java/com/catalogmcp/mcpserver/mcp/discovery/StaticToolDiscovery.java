package com.catalogmcp.mcpserver.mcp.discovery;

import com.catalogmcp.shared.mcp.tools.McpTool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Filters pre-instantiated objects, typically Spring beans, down to tool implementations.
 */
@Slf4j
public class StaticToolDiscovery implements ToolDiscovery {

    private final Collection<?> candidates;

    public StaticToolDiscovery(Collection<?> candidates) {
        this.candidates = candidates;
    }

    @Override
    public List<ToolCandidate> discover() {
        List<ToolCandidate> tools = new ArrayList<>();
        for (Object candidate : candidates) {
            if (candidate instanceof McpTool) {
                tools.add(new ToolCandidate((McpTool) candidate, ClassUtils.getUserClass(candidate).getName()));
            } else if (candidate != null) {
                log.debug("Ignoring {}: not an McpTool", candidate.getClass().getName());
            }
        }
        return tools;
    }

    @Override
    public String getName() {
        return "static";
    }
}
