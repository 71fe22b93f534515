/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation signal for a single run. Safe to cancel from any thread.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) return;
        for (Runnable r : listeners) r.run();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback run once on cancel. Runs immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (cancelled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }
}
