package com.agentcrew.orchestrator.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/** Cooperative cancellation flag, checked by the pipeline at stage boundaries. */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
