/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.plan.Operation;
import com.intuitivedesigns.querykernel.plan.Plan;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-run execution state, one slot per plan operation.
 *
 * <p>Each slot has its own lock. Transitions follow
 * {@code PENDING -> RUNNING -> SUCCEEDED|FAILED}, or straight from {@code PENDING} to a terminal
 * state for local operations, skips and dispatch-time failures. Once terminal a slot never
 * changes again; late transitions are ignored and reported as {@code false}.</p>
 *
 * <p>The mutators are driven by {@link PlanExecutor}. Readers only ever see
 * {@link OperationOutcome} snapshots.</p>
 */
public final class ExecutionRecord {

    private final String planId;
    private final Map<String, Slot> slots;
    private final List<String> runWarnings = new CopyOnWriteArrayList<>();

    public ExecutionRecord(Plan plan) {
        Objects.requireNonNull(plan, "plan");
        this.planId = plan.id();
        Map<String, Slot> tmp = new LinkedHashMap<>();
        for (Operation op : plan.operations()) {
            tmp.put(op.id(), new Slot(op.id()));
        }
        this.slots = Collections.unmodifiableMap(tmp);
    }

    public String planId() {
        return planId;
    }

    public List<String> operationIds() {
        return List.copyOf(slots.keySet());
    }

    public OperationOutcome outcome(String opId) {
        return slot(opId).snapshot();
    }

    public OperationStatus status(String opId) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            return s.status;
        } finally {
            s.lock.unlock();
        }
    }

    /**
     * Snapshots of every operation, in plan order.
     */
    public Map<String, OperationOutcome> outcomes() {
        Map<String, OperationOutcome> out = new LinkedHashMap<>();
        for (Slot s : slots.values()) out.put(s.opId, s.snapshot());
        return Collections.unmodifiableMap(out);
    }

    public boolean allTerminal() {
        for (String id : slots.keySet()) {
            if (!status(id).isTerminal()) return false;
        }
        return true;
    }

    /**
     * Run-level warnings followed by per-operation warnings in plan order.
     */
    public List<String> warnings() {
        List<String> out = new ArrayList<>(runWarnings);
        for (Slot s : slots.values()) out.addAll(s.snapshot().warnings());
        return Collections.unmodifiableList(out);
    }

    // --- transitions ---

    public boolean start(String opId, Instant now) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            if (s.status != OperationStatus.PENDING) return false;
            s.status = OperationStatus.RUNNING;
            s.startedAt = now;
            return true;
        } finally {
            s.lock.unlock();
        }
    }

    public void countAttempt(String opId) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            if (!s.status.isTerminal()) s.attempts++;
        } finally {
            s.lock.unlock();
        }
    }

    public boolean succeed(String opId, List<Map<String, Object>> rows, Instant now) {
        return finish(opId, OperationStatus.SUCCEEDED, freezeRows(rows), null, now);
    }

    public boolean fail(String opId, OperationError error, Instant now) {
        return finish(opId, OperationStatus.FAILED, List.of(), Objects.requireNonNull(error, "error"), now);
    }

    public boolean skip(String opId, String reason, Instant now) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            if (s.status != OperationStatus.PENDING) return false;
            s.status = OperationStatus.SKIPPED;
            s.finishedAt = now;
            if (reason != null) s.warnings.add(reason);
            return true;
        } finally {
            s.lock.unlock();
        }
    }

    public void warn(String opId, String message) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            s.warnings.add(message);
        } finally {
            s.lock.unlock();
        }
    }

    public void warnRun(String message) {
        runWarnings.add(Objects.requireNonNull(message, "message"));
    }

    private boolean finish(String opId, OperationStatus to, List<Map<String, Object>> rows, OperationError error, Instant now) {
        Slot s = slot(opId);
        s.lock.lock();
        try {
            if (s.status.isTerminal()) return false;
            if (s.startedAt == null) s.startedAt = now;
            s.status = to;
            s.rows = rows;
            s.error = error;
            s.finishedAt = now;
            return true;
        } finally {
            s.lock.unlock();
        }
    }

    private Slot slot(String opId) {
        Slot s = slots.get(opId);
        if (s == null) throw new IllegalArgumentException("Unknown operation '" + opId + "' in record of plan " + planId);
        return s;
    }

    private static List<Map<String, Object>> freezeRows(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) return List.of();
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Map<String, Object> r : rows) {
            // values may be null, so Map.copyOf is not an option
            out.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
        }
        return Collections.unmodifiableList(out);
    }

    private static final class Slot {
        final String opId;
        final ReentrantLock lock = new ReentrantLock();
        OperationStatus status = OperationStatus.PENDING;
        List<Map<String, Object>> rows = List.of();
        OperationError error;
        int attempts;
        Instant startedAt;
        Instant finishedAt;
        final List<String> warnings = new ArrayList<>();

        Slot(String opId) {
            this.opId = opId;
        }

        OperationOutcome snapshot() {
            lock.lock();
            try {
                return new OperationOutcome(opId, status, rows, error, attempts, startedAt, finishedAt, warnings);
            } finally {
                lock.unlock();
            }
        }
    }
}
