package com.gradientcast.detection.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a batch evaluation. The caller owns the
 * signal and its timeout; the batch service checks it before each dimension.
 */
public final class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
