package io.cronkeeper.cron;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag for manual runs. A cancelled run still lets the executor return,
 * then records the run as {@code cancelled}.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
