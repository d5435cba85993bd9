package com.osservatorio.common.concurrent;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed through long operations. Checked between
 * retry attempts and before each store call. Thread interruption counts as
 * cancellation too.
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    public static CancellationSignal create() {
        return new CancellationSignal();
    }

    /**
     * Signal that can never be cancelled explicitly; still honours interruption.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel(String reason) {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op signal cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
        }
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void throwIfCancelled(String stage) {
        if (isCancelled()) {
            String why = reason != null ? reason : "interrupted";
            throw new CancellationException("Cancelled before " + stage + ": " + why);
        }
    }
}
