/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.executor;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.error.PlanExecutionException;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.SourceKind;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.Operation;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.PlanDag;
import com.intuitivedesigns.querykernel.plan.UnionOperation;
import com.intuitivedesigns.querykernel.registry.FieldContract;
import com.intuitivedesigns.querykernel.registry.SchemaDriftDetector;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import com.intuitivedesigns.querykernel.spi.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.LongAdder;

/**
 * Runs a {@link Plan} against the registered source adapters.
 *
 * <p>Scheduling is continuous admission over in-degrees: a coordinator loop on the calling
 * thread keeps a ready queue, dispatches fetches to a worker pool as soon as their permits are
 * free and reacts to completions one at a time. There are no layer barriers. Concurrency is
 * bounded twice: a global {@link Semaphore} sized by {@code maxParallelism}, and one semaphore
 * per {@link SourceKind}. Permits are taken with {@code tryAcquire} so a saturated kind never
 * blocks dispatch of another kind.</p>
 *
 * <p>JOIN, UNION and AGGREGATE carry no I/O. They succeed as soon as their inputs allow and
 * the {@code ResultAggregator} does their data work afterwards.</p>
 *
 * <p>One instance can serve many runs; each run gets its own {@link ExecutionRecord}.</p>
 */
public final class PlanExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final SchemaRegistry registry;
    private final SourceAdapters adapters;
    private final ExecutorSettings settings;
    private final MetricsRuntime metrics;
    private final Cache<String, List<Map<String, Object>>> cache;
    private final SchemaDriftDetector driftDetector;
    private final Clock clock;

    private final ExecutorService workers;
    private final ExecutorService calls;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // Counters
    private final LongAdder runs = new LongAdder();
    private final LongAdder retries = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder skips = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();

    public PlanExecutor(SchemaRegistry registry, SourceAdapters adapters, ExecutorSettings settings, MetricsRuntime metrics) {
        this(registry, adapters, settings, metrics, null, Clock.systemUTC());
    }

    /**
     * @param cache optional fetch result cache; null disables caching
     */
    public PlanExecutor(SchemaRegistry registry,
                        SourceAdapters adapters,
                        ExecutorSettings settings,
                        MetricsRuntime metrics,
                        Cache<String, List<Map<String, Object>>> cache,
                        Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapters = Objects.requireNonNull(adapters, "adapters");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.cache = cache;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.driftDetector = new SchemaDriftDetector(registry);

        this.workers = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("qk-fetch"));
        this.calls = Executors.newCachedThreadPool(new NamedDaemonThreadFactory("qk-call"));
    }

    public ExecutorSettings settings() {
        return settings;
    }

    public ExecutionRecord executePlan(Plan plan) {
        return executePlan(plan, settings.maxParallelism(), new CancellationToken());
    }

    public ExecutionRecord executePlan(Plan plan, int maxParallelism) {
        return executePlan(plan, maxParallelism, new CancellationToken());
    }

    /**
     * Executes every operation until all are terminal.
     *
     * @return the record when the final output succeeded; failures outside the final output's
     *         required set are attached to it as warnings
     * @throws PlanExecutionException when the final output failed, was skipped or the run was cancelled
     */
    public ExecutionRecord executePlan(Plan plan, int maxParallelism, CancellationToken token) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(token, "token");
        if (maxParallelism < 1) throw new IllegalArgumentException("maxParallelism must be >= 1");
        if (closed.get()) throw new IllegalStateException("Executor is closed");

        runs.increment();
        metrics.counter("qk.executor.runs");
        long startNanos = System.nanoTime();

        ExecutionRecord record = new ExecutionRecord(plan);
        new Run(plan, record, maxParallelism, token).execute();

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        metrics.timer("qk.executor.run.latency", tookMs);
        finish(plan, record, token);
        log.info("Plan {} finished in {}ms ({} operations, warnings={})", plan.id(), tookMs, plan.size(), record.warnings().size());
        return record;
    }

    private void finish(Plan plan, ExecutionRecord record, CancellationToken token) {
        PlanDag dag = plan.dag();
        String finalId = plan.finalOutput();
        OperationOutcome last = record.outcome(finalId);

        if (last.succeeded()) {
            for (String opId : dag.topologicalOrder()) {
                OperationOutcome o = record.outcome(opId);
                if (o.status() == OperationStatus.FAILED && !dag.isRequired(opId)) {
                    record.warnRun("Operation " + opId + " failed (" + o.error().kind() + "): "
                            + o.error().message() + "; result is partial");
                }
            }
            return;
        }

        String rootId = finalId;
        OperationError rootError = last.error();
        if (last.status() != OperationStatus.FAILED) {
            for (String opId : dag.topologicalOrder()) {
                OperationOutcome o = record.outcome(opId);
                if (o.status() == OperationStatus.FAILED && dag.isRequired(opId)) {
                    rootId = opId;
                    rootError = o.error();
                    break;
                }
            }
        }
        if (rootError == null) {
            for (String opId : dag.ancestors(plan, finalId)) {
                OperationOutcome o = record.outcome(opId);
                if (o.status() == OperationStatus.FAILED) {
                    rootId = opId;
                    rootError = o.error();
                    break;
                }
            }
        }

        ErrorKind kind;
        String message;
        if (rootError != null) {
            kind = rootError.kind();
            message = "Operation " + rootId + " failed: " + rootError.message();
            if (!rootId.equals(finalId)) {
                message += "; final output " + finalId + " ended " + last.status();
            }
        } else if (token.isCancelled()) {
            kind = ErrorKind.CANCELLED;
            message = "Run of plan " + plan.id() + " was cancelled";
        } else {
            kind = ErrorKind.UPSTREAM_FAILED;
            message = "Final output " + finalId + " ended " + last.status();
        }
        log.warn("Plan {} failed at {}: {}", plan.id(), rootId, message);
        throw new PlanExecutionException(rootId, finalId, kind, message, record);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        workers.shutdownNow();
        calls.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
            calls.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        log.info("Executor closed. runs={} retries={} failed={} skipped={} cacheHits={}",
                runs.sum(), retries.sum(), failures.sum(), skips.sum(), cacheHits.sum());
    }

    // --- one run ---

    private final class Run {
        private final Plan plan;
        private final PlanDag dag;
        private final ExecutionRecord record;
        private final CancellationToken token;

        private final Semaphore global;
        private final Map<SourceKind, Semaphore> perKind = new EnumMap<>(SourceKind.class);

        private final Map<String, Integer> remaining;
        private final Deque<String> ready = new ArrayDeque<>();
        private final Map<String, InFlight> inFlight = new LinkedHashMap<>();
        private final Set<String> driftChecked = new HashSet<>();
        private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();

        Run(Plan plan, ExecutionRecord record, int maxParallelism, CancellationToken token) {
            this.plan = plan;
            this.dag = plan.dag();
            this.record = record;
            this.token = token;
            this.global = new Semaphore(maxParallelism);
            for (SourceKind k : SourceKind.values()) {
                perKind.put(k, new Semaphore(settings.kindLimit(k)));
            }
            this.remaining = new HashMap<>(dag.inDegrees());
            for (Operation op : plan.operations()) {
                if (op.inputs().isEmpty()) ready.add(op.id());
            }
        }

        void execute() {
            token.onCancel(() -> completions.offer(Completion.WAKE));

            while (true) {
                if (token.isCancelled()) {
                    abort();
                    return;
                }

                dispatchReady();

                if (inFlight.isEmpty() && ready.isEmpty()) {
                    return;
                }

                Completion c;
                try {
                    c = completions.take();
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    continue;
                }
                if (c == Completion.WAKE) continue;
                apply(c);
            }
        }

        private void dispatchReady() {
            Deque<String> blocked = new ArrayDeque<>();
            while (!ready.isEmpty()) {
                String opId = ready.poll();
                Operation op = plan.require(opId);
                if (op instanceof FetchOperation f) {
                    if (!tryDispatch(f)) blocked.add(opId);
                } else {
                    resolveLocal(op);
                }
            }
            ready.addAll(blocked);
        }

        /**
         * @return false when no permit is free right now
         */
        private boolean tryDispatch(FetchOperation f) {
            Instant now = clock.instant();
            Optional<SourceDescriptor> source = registry.source(f.sourceId());
            Optional<SourceAdapter> adapter = adapters.get(f.sourceId());
            if (source.isEmpty() || adapter.isEmpty()) {
                String why = source.isEmpty() ? "source is not registered" : "no adapter is connected";
                record.fail(f.id(), OperationError.of(ErrorKind.ADAPTER_UNAVAILABLE,
                        "Cannot dispatch to '" + f.sourceId() + "': " + why), now);
                failures.increment();
                metrics.counter("qk.executor.failed");
                onTerminal(f.id());
                return true;
            }

            if (driftChecked.add(f.id())) {
                driftDetector.check(plan, f).ifPresent(drift -> {
                    log.warn(drift.describe());
                    record.warn(f.id(), drift.describe());
                    metrics.counter("qk.executor.drift");
                });
            }

            String cacheKey = cacheKey(f);
            if (cacheKey != null) {
                Optional<List<Map<String, Object>>> hit = safeCacheGet(cacheKey);
                if (hit.isPresent()) {
                    cacheHits.increment();
                    metrics.counter("qk.executor.cache.hit");
                    record.start(f.id(), now);
                    record.succeed(f.id(), hit.get(), now);
                    onTerminal(f.id());
                    return true;
                }
            }

            Semaphore kindLimit = perKind.get(source.get().kind());
            if (!kindLimit.tryAcquire()) return false;
            if (!global.tryAcquire()) {
                kindLimit.release();
                return false;
            }

            record.start(f.id(), now);
            Future<?> future = workers.submit(() -> completions.offer(runFetch(f, adapter.get(), cacheKey)));
            inFlight.put(f.id(), new InFlight(future, kindLimit));
            metrics.gauge("qk.executor.inflight", inFlight.size());
            return true;
        }

        private void resolveLocal(Operation op) {
            Instant now = clock.instant();
            int succeeded = 0;
            String failedInput = null;
            for (String in : op.inputs()) {
                if (record.status(in) == OperationStatus.SUCCEEDED) {
                    succeeded++;
                } else if (failedInput == null) {
                    failedInput = in;
                }
            }

            boolean tolerant = op instanceof UnionOperation u && u.tolerateFailedInputs();
            if (failedInput == null || (tolerant && succeeded > 0)) {
                record.start(op.id(), now);
                record.succeed(op.id(), List.of(), now);
            } else {
                record.skip(op.id(), null, now);
                skips.increment();
                metrics.counter("qk.executor.skipped");
                log.debug("Skipped {}: input {} ended {}", op.id(), failedInput, record.status(failedInput));
            }
            onTerminal(op.id());
        }

        private void apply(Completion c) {
            InFlight f = inFlight.remove(c.opId);
            if (f == null) return;
            f.kindLimit.release();
            global.release();

            Instant now = clock.instant();
            String sourceId = ((FetchOperation) plan.require(c.opId)).sourceId();
            metrics.timer("qk.executor.op.latency", c.tookMs,
                    Map.of("source", sourceId, "outcome", c.error == null ? "ok" : c.error.kind().name()));
            metrics.gauge("qk.executor.inflight", inFlight.size());
            if (c.error == null) {
                record.succeed(c.opId, c.rows, now);
                if (c.cacheKey != null) safeCachePut(c.cacheKey, c.rows);
            } else {
                record.fail(c.opId, c.error, now);
                failures.increment();
                metrics.counter("qk.executor.failed", Map.of("source", sourceId, "kind", c.error.kind().name()));
                log.warn("Operation {} failed after {} attempt(s): {} {}", c.opId, record.outcome(c.opId).attempts(), c.error.kind(), c.error.message());
            }
            onTerminal(c.opId);
        }

        private void onTerminal(String opId) {
            for (String dep : dag.dependents(opId)) {
                if (remaining.merge(dep, -1, Integer::sum) == 0) {
                    ready.add(dep);
                }
            }
        }

        private void abort() {
            Instant now = clock.instant();
            for (Map.Entry<String, InFlight> e : inFlight.entrySet()) {
                e.getValue().future.cancel(true);
                e.getValue().kindLimit.release();
                global.release();
                record.fail(e.getKey(), OperationError.of(ErrorKind.CANCELLED, "Cancelled while running"), now);
            }
            inFlight.clear();
            ready.clear();
            for (String opId : record.operationIds()) {
                if (record.skip(opId, null, now)) {
                    skips.increment();
                    metrics.counter("qk.executor.skipped");
                }
            }
            log.info("Plan {} cancelled", plan.id());
        }

        // --- worker side ---

        private Completion runFetch(FetchOperation f, SourceAdapter adapter, String cacheKey) {
            RetryPolicy retry = settings.retryPolicy();
            Duration timeout = settings.attemptTimeout();
            long start = System.nanoTime();
            int attempt = 0;

            while (true) {
                if (token.isCancelled()) {
                    return Completion.failed(f.id(), OperationError.of(ErrorKind.CANCELLED, "Cancelled before attempt"), start);
                }
                attempt++;
                record.countAttempt(f.id());
                try {
                    List<Map<String, Object>> rows = callWithTimeout(adapter, f, timeout);
                    return Completion.succeeded(f.id(), rows, cacheKey, start);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return Completion.failed(f.id(), OperationError.of(ErrorKind.CANCELLED, "Interrupted"), start);
                } catch (SourceAdapterException e) {
                    OperationError err = new OperationError(ErrorKind.from(e.reason()), e.getMessage(), e.retryable());
                    if (!retry.shouldRetry(attempt, e.retryable())) {
                        return Completion.failed(f.id(), err, start);
                    }
                    Duration pause = retry.backoff(attempt, () -> ThreadLocalRandom.current().nextDouble());
                    retries.increment();
                    metrics.counter("qk.executor.retries");
                    log.debug("Retrying {} in {}ms after attempt {}: {}", f.id(), pause.toMillis(), attempt, e.getMessage());
                    try {
                        Thread.sleep(pause.toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        return Completion.failed(f.id(), OperationError.of(ErrorKind.CANCELLED, "Interrupted during backoff"), start);
                    }
                }
            }
        }

        private List<Map<String, Object>> callWithTimeout(SourceAdapter adapter, FetchOperation f, Duration timeout)
                throws SourceAdapterException, InterruptedException {
            Future<List<Map<String, Object>>> call = calls.submit(() -> adapter.execute(f.payload(), timeout));
            try {
                List<Map<String, Object>> rows = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
                return (rows == null) ? List.of() : rows;
            } catch (TimeoutException te) {
                call.cancel(true);
                throw new SourceAdapterException(SourceAdapterException.Reason.TIMEOUT,
                        "Attempt on '" + f.sourceId() + "' exceeded " + timeout.toMillis() + "ms", te);
            } catch (InterruptedException ie) {
                call.cancel(true);
                throw ie;
            } catch (ExecutionException ee) {
                Throwable cause = ee.getCause();
                if (cause instanceof SourceAdapterException sae) throw sae;
                throw new SourceAdapterException(SourceAdapterException.Reason.UNKNOWN, false,
                        "Adapter for '" + f.sourceId() + "' failed: " + cause, cause);
            }
        }
    }

    // --- cache ---

    private String cacheKey(FetchOperation f) {
        if (cache == null) return null;
        long version = registry.listFields(f.sourceId(), f.table()).map(FieldContract::version).orElse(0L);
        return f.sourceId() + "/" + f.table() + "@" + version + "#" + f.payload().fingerprint();
    }

    private Optional<List<Map<String, Object>>> safeCacheGet(String key) {
        try {
            return cache.get(key);
        } catch (Exception e) {
            log.warn("Cache lookup failed for {}", key, e);
            return Optional.empty();
        }
    }

    private void safeCachePut(String key, List<Map<String, Object>> rows) {
        try {
            cache.put(key, rows);
        } catch (Exception e) {
            log.warn("Cache write failed for {}", key, e);
        }
    }

    private static final class InFlight {
        final Future<?> future;
        final Semaphore kindLimit;

        InFlight(Future<?> future, Semaphore kindLimit) {
            this.future = future;
            this.kindLimit = kindLimit;
        }
    }

    private static final class Completion {
        static final Completion WAKE = new Completion(null, null, null, null, 0L);

        final String opId;
        final List<Map<String, Object>> rows;
        final OperationError error;
        final String cacheKey;
        final long tookMs;

        private Completion(String opId, List<Map<String, Object>> rows, OperationError error, String cacheKey, long tookMs) {
            this.opId = opId;
            this.rows = rows;
            this.error = error;
            this.cacheKey = cacheKey;
            this.tookMs = tookMs;
        }

        static Completion succeeded(String opId, List<Map<String, Object>> rows, String cacheKey, long startNanos) {
            return new Completion(opId, rows, null, cacheKey, elapsedMs(startNanos));
        }

        static Completion failed(String opId, OperationError error, long startNanos) {
            return new Completion(opId, List.of(), error, null, elapsedMs(startNanos));
        }

        private static long elapsedMs(long startNanos) {
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
    }
}
