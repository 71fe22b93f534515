/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.model.QueryPayload;
import com.intuitivedesigns.querykernel.model.TableSchema;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adapter that fails with queued errors first, then returns fixed rows.
 */
final class ScriptedAdapter implements SourceAdapter {

    private final List<Map<String, Object>> rows;
    private final Deque<SourceAdapterException> failures = new ArrayDeque<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger active;
    private final AtomicInteger peak;
    private long delayMs;
    private CountDownLatch started;

    ScriptedAdapter(List<Map<String, Object>> rows) {
        this(rows, new AtomicInteger(), new AtomicInteger());
    }

    /**
     * @param active shared count of calls currently inside {@link #execute}
     * @param peak   shared high-water mark of {@code active}
     */
    ScriptedAdapter(List<Map<String, Object>> rows, AtomicInteger active, AtomicInteger peak) {
        this.rows = rows;
        this.active = active;
        this.peak = peak;
    }

    ScriptedAdapter failWith(SourceAdapterException e) {
        failures.add(e);
        return this;
    }

    ScriptedAdapter delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    ScriptedAdapter signal(CountDownLatch latch) {
        this.started = latch;
        return this;
    }

    int calls() {
        return calls.get();
    }

    @Override
    public void connect() {
    }

    @Override
    public List<TableSchema> introspect() {
        return List.of();
    }

    @Override
    public List<Map<String, Object>> execute(QueryPayload payload, Duration timeout) throws SourceAdapterException {
        calls.incrementAndGet();
        int now = active.incrementAndGet();
        peak.accumulateAndGet(now, Math::max);
        try {
            if (started != null) started.countDown();
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SourceAdapterException(SourceAdapterException.Reason.CANCELLED, "interrupted");
                }
            }
            SourceAdapterException next;
            synchronized (failures) {
                next = failures.poll();
            }
            if (next != null) throw next;
            return rows;
        } finally {
            active.decrementAndGet();
        }
    }
}
