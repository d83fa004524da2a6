package dev.devanks.hlsarchive.aggregator.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal. Checked before each day and each link is admitted; work already
 * admitted runs to completion.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
