package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.model.RewriteProgressEvent;

/**
 * Receives progress events from the thread driving a run.
 * Implementations must not block for long; exceptions are logged and ignored by the run.
 */
@FunctionalInterface
public interface ProgressChannel {

    void publish(RewriteProgressEvent event);

    static ProgressChannel discarding() {
        return event -> { };
    }
}
