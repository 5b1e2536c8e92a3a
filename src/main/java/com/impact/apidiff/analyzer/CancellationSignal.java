package com.impact.apidiff.analyzer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag shared by one analysis run. Raising it prevents new per-file work from starting;
 * work already running completes.
 */
public final class CancellationSignal {

    private static final CancellationSignal NEVER = new CancellationSignal();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * A signal nobody holds a reference to raise.
     */
    public static CancellationSignal none() {
        return NEVER;
    }

    public void cancel() {
        if (this == NEVER) {
            throw new IllegalStateException("The shared no-op signal cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
