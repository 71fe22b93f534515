/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.core;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.aggregate.AggregationResult;
import com.intuitivedesigns.querykernel.aggregate.ResultAggregator;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.config.KernelFactory;
import com.intuitivedesigns.querykernel.config.SourceCatalogLoader;
import com.intuitivedesigns.querykernel.config.SourceCatalogLoader.SourceEntry;
import com.intuitivedesigns.querykernel.error.ValidationException;
import com.intuitivedesigns.querykernel.executor.CancellationToken;
import com.intuitivedesigns.querykernel.executor.ExecutionRecord;
import com.intuitivedesigns.querykernel.executor.ExecutorSettings;
import com.intuitivedesigns.querykernel.executor.PlanExecutor;
import com.intuitivedesigns.querykernel.executor.SourceAdapters;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.planner.KeywordSourceClassifier;
import com.intuitivedesigns.querykernel.planner.PlannerSettings;
import com.intuitivedesigns.querykernel.planner.PlanningResult;
import com.intuitivedesigns.querykernel.planner.QueryPlanner;
import com.intuitivedesigns.querykernel.planner.SourceClassifier;
import com.intuitivedesigns.querykernel.registry.InMemorySchemaRegistry;
import com.intuitivedesigns.querykernel.registry.IntrospectionWorker;
import com.intuitivedesigns.querykernel.registry.RegistrySnapshotStore;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import com.intuitivedesigns.querykernel.registry.ValidationReport;
import com.intuitivedesigns.querykernel.spi.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Question in, rows out: classifier, planner, executor and aggregator in sequence.
 *
 * <p>Failures surface as {@link com.intuitivedesigns.querykernel.error.QueryKernelException}
 * subtypes; {@code toError()} turns any of them into a structured
 * {@link com.intuitivedesigns.querykernel.error.QueryError}.</p>
 */
public final class QueryOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrator.class);

    public static final String KEY_SNAPSHOT_PATH = "registry.snapshot.path";
    public static final String KEY_INTROSPECT_ON_START = "registry.introspect.on.start";

    private final SchemaRegistry registry;
    private final SourceClassifier classifier;
    private final QueryPlanner planner;
    private final PlanExecutor executor;
    private final ResultAggregator aggregator;
    private final List<AutoCloseable> owned;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public QueryOrchestrator(SchemaRegistry registry,
                             SourceClassifier classifier,
                             QueryPlanner planner,
                             PlanExecutor executor,
                             ResultAggregator aggregator) {
        this(registry, classifier, planner, executor, aggregator, List.of(executor));
    }

    private QueryOrchestrator(SchemaRegistry registry,
                              SourceClassifier classifier,
                              QueryPlanner planner,
                              PlanExecutor executor,
                              ResultAggregator aggregator,
                              List<AutoCloseable> owned) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.owned = List.copyOf(owned);
    }

    /**
     * Wires a complete kernel from configuration: sources, adapters, introspection, the
     * generator and cache plugins, planner and executor.
     */
    public static QueryOrchestrator fromConfig(KernelConfig config, MetricsRuntime metrics) throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        KernelFactory.logAvailablePlugins();

        Clock clock = Clock.systemUTC();
        String snapshotPath = config.getString(KEY_SNAPSHOT_PATH, "").trim();
        RegistrySnapshotStore store = snapshotPath.isEmpty() ? null : new RegistrySnapshotStore(Path.of(snapshotPath));
        InMemorySchemaRegistry registry = (store == null) ? new InMemorySchemaRegistry(clock) : store.load(clock);

        List<SourceEntry> entries = SourceCatalogLoader.load(config);
        SourceCatalogLoader.register(registry, entries);

        List<AutoCloseable> owned = new ArrayList<>();
        SourceAdapters adapters = new SourceAdapters();
        QueryGenerator generator = null;
        Cache<String, List<Map<String, Object>>> cache = null;
        try {
            boolean introspect = config.getBoolean(KEY_INTROSPECT_ON_START, true);
            IntrospectionWorker worker = new IntrospectionWorker(registry);
            for (SourceEntry e : entries) {
                SourceDescriptor d = e.descriptor();
                if (!d.enabled()) continue;
                SourceAdapter adapter = KernelFactory.createAdapter(d, e.adapterConfig(), metrics);
                try {
                    adapters.register(d.id(), adapter);
                } catch (SourceAdapterException ex) {
                    // the source stays registered; its fetches fail as ADAPTER_UNAVAILABLE
                    log.warn("Source '{}' unavailable at startup: {}", d.id(), ex.getMessage());
                    safeClose(adapter, d.id());
                    continue;
                }
                if (!introspect) continue;
                try {
                    worker.introspect(d, adapter);
                } catch (SourceAdapterException ex) {
                    log.warn("Introspection of '{}' failed; keeping known contracts: {}", d.id(), ex.getMessage());
                }
            }
            if (store != null) store.save(registry);

            generator = KernelFactory.createGenerator(config, metrics);
            cache = KernelFactory.createCache(config, metrics);

            PlannerSettings plannerSettings = PlannerSettings.from(config);
            ExecutorSettings executorSettings = ExecutorSettings.from(config);
            log.info("Planner: {}", plannerSettings);
            log.info("Executor: {}", executorSettings);

            QueryPlanner planner = new QueryPlanner(registry, generator, plannerSettings, metrics, clock);
            PlanExecutor executor = new PlanExecutor(registry, adapters, executorSettings, metrics, cache, clock);
            SourceClassifier classifier = new KeywordSourceClassifier(registry, plannerSettings.maxCandidates());

            owned.add(executor);
            owned.add(cache);
            owned.add(generator);
            owned.add(adapters);
            return new QueryOrchestrator(registry, classifier, planner, executor, new ResultAggregator(), owned);
        } catch (RuntimeException | IOException e) {
            safeClose(cache, "cache");
            safeClose(generator, "generator");
            safeClose(adapters, "adapters");
            throw e;
        }
    }

    public SchemaRegistry registry() {
        return registry;
    }

    public QueryResponse ask(String question) {
        return ask(question, new CancellationToken());
    }

    public QueryResponse ask(String question, CancellationToken token) {
        PlanningResult planned = plan(question);
        return execute(planned.plan(), planned.diagnostics(), token);
    }

    public PlanningResult plan(String question) {
        Objects.requireNonNull(question, "question");
        List<SourceDescriptor> candidates = classifier.candidates(question);
        return planner.createPlan(question, candidates);
    }

    /**
     * Runs an existing plan, e.g. one read back with {@code PlanCodec}. The plan is
     * validated against the current contracts first.
     *
     * @throws ValidationException if the plan no longer fits the registry
     */
    public QueryResponse execute(Plan plan, CancellationToken token) {
        Objects.requireNonNull(plan, "plan");
        ValidationReport report = registry.validate(plan);
        if (!report.valid()) throw new ValidationException(report.violations());
        return execute(plan, List.of(), token);
    }

    private QueryResponse execute(Plan plan, List<String> diagnostics, CancellationToken token) {
        ExecutionRecord record = executor.executePlan(plan, executor.settings().maxParallelism(), token);
        AggregationResult result = aggregator.aggregate(record, plan);
        return new QueryResponse(plan.id(), result.columns(), result.rows(), result.warnings(), diagnostics);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        for (AutoCloseable c : owned) safeClose(c, c.getClass().getSimpleName());
    }

    private static void safeClose(AutoCloseable c, String name) {
        if (c == null) return;
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {}", name, e);
        }
    }
}
