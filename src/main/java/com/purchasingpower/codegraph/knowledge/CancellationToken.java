package com.purchasingpower.codegraph.knowledge;

import com.google.common.base.Preconditions;
import com.purchasingpower.codegraph.exception.BuildCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for an in-flight build, checked in every phase loop.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Shared token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Fresh token the caller can cancel from another thread.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * @throws IllegalStateException on the token returned by {@link #none()}
     */
    public void cancel() {
        Preconditions.checkState(cancellable, "The shared no-op token cannot be cancelled");
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @param phase phase name reported in the exception
     * @throws BuildCancelledException if {@link #cancel()} was called
     */
    public void throwIfCancellationRequested(String phase) {
        if (cancelled.get()) {
            throw new BuildCancelledException(phase);
        }
    }
}
