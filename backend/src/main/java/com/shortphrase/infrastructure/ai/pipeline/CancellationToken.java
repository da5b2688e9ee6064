package com.shortphrase.infrastructure.ai.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for a run. May be cancelled from any thread.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
