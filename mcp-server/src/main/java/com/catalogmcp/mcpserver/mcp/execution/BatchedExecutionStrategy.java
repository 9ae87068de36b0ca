package com.catalogmcp.mcpserver.mcp.execution;

import com.catalogmcp.shared.mcp.registry.ToolMetadata;
import com.catalogmcp.shared.mcp.tools.McpTool;
import com.catalogmcp.shared.mcp.tools.ToolExecutionContext;
import com.catalogmcp.shared.mcp.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coalesces concurrent calls to the same batchable tool.
 *
 * <p>Calls are queued per tool name. A queue is flushed when it reaches the tool's
 * {@code maxBatchSize} or when the {@link BatchFlushPolicy} window elapses, whichever comes
 * first. Each queued call is still executed on its own and completes its own future, so one
 * failing call never fails the rest of its batch. Tools without batching metadata are executed
 * directly.
 */
@Slf4j
public class BatchedExecutionStrategy implements ToolExecutionStrategy {

    private final ScheduledExecutorService scheduler;
    private final BatchFlushPolicy flushPolicy;
    private final Map<String, List<PendingCall>> batchQueue = new HashMap<>();
    private final Object lock = new Object();

    public BatchedExecutionStrategy(ScheduledExecutorService scheduler, BatchFlushPolicy flushPolicy) {
        this.scheduler = scheduler;
        this.flushPolicy = flushPolicy;
        log.info("BatchedExecutionStrategy initialized: mode={}, window={}",
            flushPolicy.getMode(), flushPolicy.getWindow());
    }

    @Override
    public CompletableFuture<ToolResult> execute(McpTool tool, Map<String, Object> arguments,
                                                 ToolExecutionContext context, ToolMetadata metadata) {
        if (!metadata.isBatchable()) {
            return tool.execute(arguments, context);
        }

        String batchKey = metadata.getName();
        PendingCall call = new PendingCall(arguments, context, new CompletableFuture<>());
        List<PendingCall> full = null;
        List<PendingCall> started = null;

        synchronized (lock) {
            List<PendingCall> queue = batchQueue.get(batchKey);
            if (queue == null) {
                queue = new ArrayList<>();
                batchQueue.put(batchKey, queue);
                started = queue;
            }
            queue.add(call);
            if (flushPolicy.isImmediate() || queue.size() >= metadata.getMaxBatchSize()) {
                batchQueue.remove(batchKey);
                full = queue;
            }
        }

        if (full != null) {
            flush(batchKey, tool, full);
        } else if (started != null) {
            scheduleFlush(batchKey, tool, started);
        }
        return call.future;
    }

    @Override
    public String getName() {
        return "batched";
    }

    /**
     * Number of calls currently waiting for a flush, across all tools.
     */
    public int pendingCount() {
        synchronized (lock) {
            return batchQueue.values().stream().mapToInt(List::size).sum();
        }
    }

    private void scheduleFlush(String batchKey, McpTool tool, List<PendingCall> queue) {
        Runnable task = () -> {
            synchronized (lock) {
                // already flushed because it filled up
                if (batchQueue.get(batchKey) != queue) {
                    return;
                }
                batchQueue.remove(batchKey);
            }
            flush(batchKey, tool, queue);
        };
        try {
            scheduler.schedule(task, flushPolicy.getWindow().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Batch scheduler rejected flush for '{}', flushing inline", batchKey);
            task.run();
        }
    }

    private void flush(String batchKey, McpTool tool, List<PendingCall> calls) {
        log.debug("Flushing batch of {} call(s) for tool '{}'", calls.size(), batchKey);
        List<CompletableFuture<ToolResult>> results = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            PendingCall call = calls.get(i);
            CompletableFuture<ToolResult> result = invokeIsolated(tool, call);
            result.whenComplete((value, error) -> {
                if (error != null) {
                    call.future.completeExceptionally(error);
                } else {
                    call.future.complete(value);
                }
            });
            results.add(result);
        }
        CompletableFuture.allOf(results.toArray(new CompletableFuture[0]))
            .whenComplete((ignored, error) ->
                log.debug("Batch for tool '{}' settled ({} call(s))", batchKey, calls.size()));
    }

    private static CompletableFuture<ToolResult> invokeIsolated(McpTool tool, PendingCall call) {
        try {
            CompletableFuture<ToolResult> result = tool.execute(call.arguments, call.context);
            if (result == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException("Tool returned no result future"));
            }
            return result;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static final class PendingCall {
        private final Map<String, Object> arguments;
        private final ToolExecutionContext context;
        private final CompletableFuture<ToolResult> future;

        private PendingCall(Map<String, Object> arguments, ToolExecutionContext context,
                            CompletableFuture<ToolResult> future) {
            this.arguments = arguments;
            this.context = context;
            this.future = future;
        }
    }
}
