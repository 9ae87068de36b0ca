package com.catalogmcp.mcpserver.support;

import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Tool double recording every invocation.
 */
public class StubTool implements McpTool {

    private final Function<Map<String, Object>, CompletableFuture<ToolResult>> behaviour;
    private final List<Map<String, Object>> invocations = new CopyOnWriteArrayList<>();
    private final List<ToolExecutionContext> contexts = new CopyOnWriteArrayList<>();

    public StubTool(Function<Map<String, Object>, CompletableFuture<ToolResult>> behaviour) {
        this.behaviour = behaviour;
    }

    /**
     * Answers with the arguments echoed as text
     */
    public static StubTool echo() {
        return new StubTool(args -> CompletableFuture.completedFuture(ToolResult.text("echo " + args)));
    }

    public static StubTool failing(RuntimeException error) {
        return new StubTool(args -> CompletableFuture.failedFuture(error));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> arguments, ToolExecutionContext context) {
        invocations.add(arguments);
        contexts.add(context);
        return behaviour.apply(arguments);
    }

    public int invocationCount() {
        return invocations.size();
    }

    public List<Map<String, Object>> getInvocations() {
        return invocations;
    }

    public ToolExecutionContext lastContext() {
        return contexts.isEmpty() ? null : contexts.get(contexts.size() - 1);
    }
}
