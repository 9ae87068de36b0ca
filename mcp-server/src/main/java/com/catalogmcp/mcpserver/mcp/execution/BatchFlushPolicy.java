package com.catalogmcp.mcpserver.mcp.execution;

import lombok.Value;

import java.time.Duration;

/**
 * When a pending batch is flushed if it has not filled up first.
 */
@Value
public class BatchFlushPolicy {

    public enum Mode {
        /** Flush each call as soon as it is queued; no coalescing */
        IMMEDIATE,
        /** Collect calls for {@link #getWindow()} before flushing */
        DEFERRED
    }

    Mode mode;
    Duration window;

    public static BatchFlushPolicy immediate() {
        return new BatchFlushPolicy(Mode.IMMEDIATE, Duration.ZERO);
    }

    /**
     * Flush on the next scheduler tick, collecting whatever arrived in the meantime.
     */
    public static BatchFlushPolicy nextTick() {
        return new BatchFlushPolicy(Mode.DEFERRED, Duration.ZERO);
    }

    public static BatchFlushPolicy deferred(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("Batch window must not be negative: " + window);
        }
        return new BatchFlushPolicy(Mode.DEFERRED, window);
    }

    public boolean isImmediate() {
        return mode == Mode.IMMEDIATE;
    }
}
