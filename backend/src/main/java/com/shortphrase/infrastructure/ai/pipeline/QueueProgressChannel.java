package com.shortphrase.infrastructure.ai.pipeline;

import com.shortphrase.domain.rewrite.model.RewriteProgressEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Buffers progress events for a consumer on another thread.
 */
public class QueueProgressChannel implements ProgressChannel {

    private final BlockingQueue<RewriteProgressEvent> events = new LinkedBlockingQueue<>();

    @Override
    public void publish(RewriteProgressEvent event) {
        events.offer(event);
    }

    /**
     * @return the next event, or null if none arrived within the timeout
     */
    public RewriteProgressEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    public List<RewriteProgressEvent> drain() {
        List<RewriteProgressEvent> drained = new ArrayList<>();
        events.drainTo(drained);
        return drained;
    }
}
