/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.planner;

import com.intuitivedesigns.querykernel.error.ErrorKind;
import com.intuitivedesigns.querykernel.error.PlanningException;
import com.intuitivedesigns.querykernel.generation.AggregateSpec;
import com.intuitivedesigns.querykernel.generation.GeneratedQuery;
import com.intuitivedesigns.querykernel.generation.GenerationException;
import com.intuitivedesigns.querykernel.generation.GenerationRequest;
import com.intuitivedesigns.querykernel.generation.QueryGenerator;
import com.intuitivedesigns.querykernel.generation.SchemaContext;
import com.intuitivedesigns.querykernel.metrics.MetricsRuntime;
import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SemanticType;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.plan.AggregateOperation;
import com.intuitivedesigns.querykernel.plan.ContractStamp;
import com.intuitivedesigns.querykernel.plan.FetchOperation;
import com.intuitivedesigns.querykernel.plan.JoinOperation;
import com.intuitivedesigns.querykernel.plan.Operation;
import com.intuitivedesigns.querykernel.plan.Plan;
import com.intuitivedesigns.querykernel.plan.PlanDag;
import com.intuitivedesigns.querykernel.plan.PlanMetadata;
import com.intuitivedesigns.querykernel.plan.Shape;
import com.intuitivedesigns.querykernel.plan.ShapeResolver;
import com.intuitivedesigns.querykernel.plan.UnionOperation;
import com.intuitivedesigns.querykernel.registry.FieldContract;
import com.intuitivedesigns.querykernel.registry.SchemaRegistry;
import com.intuitivedesigns.querykernel.registry.ValidationReport;
import com.intuitivedesigns.querykernel.registry.Violation;
import com.intuitivedesigns.querykernel.types.TypeCoercion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;

/**
 * Builds a validated {@link Plan} for a question.
 *
 * <ol>
 *   <li>one generator call per candidate source, against a bounded schema context;</li>
 *   <li>DAG assembly: fetches in priority order folded left-deep into joins where a shared key
 *       exists, everything else gathered by a union that tolerates failed inputs;</li>
 *   <li>validation against the registry;</li>
 *   <li>a single repair pass, then either a valid plan or a {@link PlanningException}.</li>
 * </ol>
 */
public final class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    static final String UNION_ID = "union_all";
    static final String SUMMARY_ID = "summary";

    private static final Comparator<SourceDescriptor> BY_PRIORITY =
            Comparator.comparingInt(SourceDescriptor::priority).thenComparing(SourceDescriptor::id);

    private final SchemaRegistry registry;
    private final QueryGenerator generator;
    private final PlannerSettings settings;
    private final MetricsRuntime metrics;
    private final SchemaContextBuilder contexts;
    private final Clock clock;

    public QueryPlanner(SchemaRegistry registry, QueryGenerator generator, PlannerSettings settings, MetricsRuntime metrics) {
        this(registry, generator, settings, metrics, Clock.systemUTC());
    }

    public QueryPlanner(SchemaRegistry registry, QueryGenerator generator, PlannerSettings settings, MetricsRuntime metrics, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.contexts = new SchemaContextBuilder(registry, settings);
    }

    /**
     * @throws PlanningException when there are no usable candidates, every generation failed,
     *                           or violations survive the repair pass
     */
    public PlanningResult createPlan(String question, List<SourceDescriptor> candidateSources) {
        Objects.requireNonNull(question, "question");
        long start = System.nanoTime();
        List<String> diagnostics = new ArrayList<>();

        List<SourceDescriptor> sources = usable(candidateSources, diagnostics);
        if (sources.isEmpty()) {
            metrics.counter("qk.planner.failures");
            throw new PlanningException(ErrorKind.NO_CANDIDATE_SOURCES, "No candidate sources to plan against", diagnostics);
        }

        Map<String, String> fetchIds = fetchIds(sources);
        Map<String, Draft> drafts = new LinkedHashMap<>();
        for (SourceDescriptor s : sources) {
            draft(question, s, fetchIds.get(s.id()), List.of(), diagnostics).ifPresent(d -> drafts.put(s.id(), d));
        }
        if (drafts.isEmpty()) {
            metrics.counter("qk.planner.failures");
            throw new PlanningException(ErrorKind.GENERATION_FAILED,
                    "Query generation failed for every candidate source", diagnostics);
        }

        Plan base = assemble(question, drafts.values(), Optional.empty());
        Optional<AggregateSpec> summary = summarize(question, base, diagnostics);
        Plan plan = summary.isPresent() ? assemble(question, drafts.values(), summary) : base;

        ValidationReport report = registry.validate(plan);
        if (!report.valid()) {
            metrics.counter("qk.planner.repairs");
            log.info("Plan for '{}' has {} violation(s); repairing", question, report.violations().size());
            boolean keepSummary = repair(question, plan, report, drafts, fetchIds, diagnostics);
            if (drafts.isEmpty()) {
                metrics.counter("qk.planner.failures");
                throw new PlanningException(ErrorKind.VALIDATION_FAILED,
                        "No source survived plan repair", diagnostics, report.violations(), null);
            }
            plan = assemble(question, drafts.values(), keepSummary ? summary : Optional.empty());
            report = registry.validate(plan);
            if (!report.valid()) {
                metrics.counter("qk.planner.failures");
                throw new PlanningException(ErrorKind.VALIDATION_FAILED,
                        "Plan still has " + report.violations().size() + " violation(s) after repair: "
                                + report.violations().get(0).message(),
                        diagnostics, report.violations(), null);
            }
        }

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        metrics.timer("qk.planner.latency", tookMs);
        metrics.counter("qk.planner.plans");
        log.info("Planned {} ({} operations over {} source(s)) in {}ms", plan.id(), plan.size(), drafts.size(), tookMs);
        return new PlanningResult(plan, diagnostics);
    }

    // --- generation ---

    private List<SourceDescriptor> usable(List<SourceDescriptor> candidates, List<String> diagnostics) {
        Map<String, SourceDescriptor> byId = new LinkedHashMap<>();
        if (candidates != null) {
            for (SourceDescriptor s : candidates) {
                if (s == null || byId.containsKey(s.id())) continue;
                if (!s.enabled()) {
                    diagnostics.add("Source " + s.id() + " is disabled; not planned");
                    continue;
                }
                byId.put(s.id(), s);
            }
        }
        List<SourceDescriptor> out = new ArrayList<>(byId.values());
        out.sort(BY_PRIORITY);
        return out;
    }

    private static Map<String, String> fetchIds(List<SourceDescriptor> sources) {
        Map<String, String> out = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (SourceDescriptor s : sources) {
            String base = "fetch_" + s.id().replaceAll("[^A-Za-z0-9_.:-]", "_");
            String id = base;
            int n = 2;
            while (!taken.add(id)) id = base + "_" + n++;
            out.put(s.id(), id);
        }
        return out;
    }

    private Optional<Draft> draft(String question, SourceDescriptor source, String fetchId, List<String> feedback, List<String> diagnostics) {
        SchemaContext context = contexts.build(source, question);
        try {
            GeneratedQuery q = generator.generate(new GenerationRequest(question, context, source, feedback));
            if (q == null) {
                throw new GenerationException(source.id(), "Generator returned nothing");
            }
            return Optional.of(new Draft(source, toFetch(fetchId, source, q)));
        } catch (GenerationException e) {
            diagnostics.add("Generation failed for " + source.id() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            diagnostics.add("Generation failed for " + source.id() + ": " + e);
        }
        metrics.counter("qk.planner.generation.failures");
        log.warn("Dropping source '{}' from plan: generation failed", source.id());
        return Optional.empty();
    }

    private FetchOperation toFetch(String fetchId, SourceDescriptor source, GeneratedQuery q) throws GenerationException {
        if (q.table() == null || q.table().isBlank()) {
            throw new GenerationException(source.id(), "Generated query names no table");
        }
        String table = q.table().trim();
        Optional<FieldContract> contract = registry.listFields(source.id(), table);

        List<FieldSpec> fields = new ArrayList<>();
        if (q.fields().isEmpty()) {
            contract.ifPresent(c -> fields.addAll(c.fields()));
        } else {
            for (String name : new LinkedHashSet<>(q.fields())) {
                // unknown names keep a placeholder type so validation can report them
                fields.add(contract.flatMap(c -> c.field(name)).orElse(FieldSpec.value(name, SemanticType.TEXT)));
            }
        }
        if (fields.isEmpty()) {
            fields.add(FieldSpec.value("*", SemanticType.TEXT));
        }

        try {
            return FetchOperation.builder(fetchId)
                    .source(source.id())
                    .table(table)
                    .payload(q.payload())
                    .fields(fields)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new GenerationException(source.id(), "Generated query is malformed: " + e.getMessage(), e);
        }
    }

    private Optional<AggregateSpec> summarize(String question, Plan base, List<String> diagnostics) {
        if (!settings.summarize() || base.fetches().size() < 2) return Optional.empty();
        List<String> available = ShapeResolver.resolve(base).shape(base.finalOutput()).names();
        try {
            Optional<AggregateSpec> spec = generator.summarize(question, available);
            return (spec == null) ? Optional.empty() : spec;
        } catch (RuntimeException e) {
            diagnostics.add("Summary step skipped: " + e.getMessage());
            return Optional.empty();
        }
    }

    // --- repair ---

    /**
     * Applies the one repair pass to {@code drafts} in place. A required fetch whose
     * regeneration fails ends planning.
     *
     * @return whether the summary step should be kept
     */
    private boolean repair(String question, Plan plan, ValidationReport report, Map<String, Draft> drafts,
                           Map<String, String> fetchIds, List<String> diagnostics) {
        PlanDag dag = plan.dag();
        boolean keepSummary = true;

        for (Map.Entry<String, List<Violation>> e : report.byOperation().entrySet()) {
            String opId = e.getKey();
            List<String> messages = new ArrayList<>();
            for (Violation v : e.getValue()) messages.add(v.message());
            Operation op = plan.operation(opId).orElse(null);

            if (op instanceof FetchOperation f) {
                Draft current = drafts.get(f.sourceId());
                if (current == null) continue;
                if (dag.isRequired(opId)) {
                    diagnostics.add("Regenerating " + f.sourceId() + " after: " + String.join("; ", messages));
                    drafts.remove(f.sourceId());
                    Optional<Draft> regenerated = draft(question, current.source(), fetchIds.get(f.sourceId()), messages, diagnostics);
                    if (regenerated.isEmpty()) {
                        // the final output depends on this source; never plan around it
                        metrics.counter("qk.planner.failures");
                        throw new PlanningException(ErrorKind.GENERATION_FAILED,
                                "Required source " + f.sourceId() + " could not be regenerated after: " + messages.get(0),
                                diagnostics, report.violations(), null);
                    }
                    drafts.put(f.sourceId(), regenerated.get());
                } else {
                    diagnostics.add("Dropped optional source " + f.sourceId() + ": " + String.join("; ", messages));
                    drafts.remove(f.sourceId());
                }
            } else if (op instanceof AggregateOperation) {
                diagnostics.add("Dropped summary step: " + String.join("; ", messages));
                keepSummary = false;
            } else {
                // joins and unions are rebuilt from the surviving fetches' contracts
                diagnostics.add("Re-keying " + opId + ": " + String.join("; ", messages));
            }
        }
        return keepSummary;
    }

    // --- assembly ---

    private Plan assemble(String question, Iterable<Draft> drafts, Optional<AggregateSpec> summary) {
        List<Draft> ordered = new ArrayList<>();
        for (Draft d : drafts) ordered.add(d);
        ordered.sort(Comparator.comparing(Draft::source, BY_PRIORITY));

        Plan.Builder b = Plan.builder();
        Map<String, ContractStamp> stamps = new TreeMap<>();
        for (Draft d : ordered) {
            FetchOperation f = d.fetch();
            b.add(f);
            registry.listFields(f.sourceId(), f.table())
                    .ifPresent(c -> stamps.put(ContractStamp.key(f.sourceId(), f.table()), c.stamp()));
        }

        String finalId;
        if (ordered.size() == 1) {
            finalId = ordered.get(0).fetch().id();
        } else {
            FetchOperation first = ordered.get(0).fetch();
            String chain = first.id();
            Shape chainShape = new Shape(first.fields());
            List<String> loose = new ArrayList<>();
            int joins = 0;

            for (Draft d : ordered.subList(1, ordered.size())) {
                FetchOperation f = d.fetch();
                Optional<String> key = sharedKey(chainShape, f.fields());
                if (key.isEmpty()) {
                    loose.add(f.id());
                    continue;
                }
                JoinOperation j = JoinOperation.builder("join_" + (++joins))
                        .left(chain)
                        .right(f.id())
                        .on(key.get())
                        .mode(settings.joinMode())
                        .build();
                chainShape = ShapeResolver.join(j, chainShape, new Shape(f.fields()), f.sourceId(), v -> { }).output();
                chain = j.id();
                b.add(j);
            }

            if (loose.isEmpty()) {
                finalId = chain;
            } else {
                UnionOperation u = UnionOperation.builder(UNION_ID)
                        .input(chain)
                        .inputs(loose)
                        .tolerateFailedInputs(true)
                        .build();
                b.add(u);
                finalId = u.id();
            }

            if (summary.isPresent()) {
                AggregateOperation a = AggregateOperation.builder(SUMMARY_ID)
                        .input(finalId)
                        .groupBy(summary.get().groupBy())
                        .terms(summary.get().terms())
                        .build();
                b.add(a);
                finalId = a.id();
            }
        }

        return b.finalOutput(finalId)
                .metadata(new PlanMetadata(question, clock.instant(), stamps))
                .build();
    }

    /**
     * A field both sides produce under the same name with compatible types, where at least one
     * side declares it a key. Keys of the incoming fetch are tried first.
     */
    static Optional<String> sharedKey(Shape chain, List<FieldSpec> incoming) {
        Shape right = new Shape(incoming);
        for (FieldSpec f : incoming) {
            if (f.isKey() && compatible(chain.field(f.name()), f)) return Optional.of(f.name());
        }
        for (FieldSpec c : chain.fields()) {
            if (c.isKey() && compatible(right.field(c.name()), c)) return Optional.of(c.name());
        }
        return Optional.empty();
    }

    private static boolean compatible(Optional<FieldSpec> other, FieldSpec f) {
        return other.isPresent() && TypeCoercion.joinKeyType(other.get().type(), f.type()).isPresent();
    }

    private record Draft(SourceDescriptor source, FetchOperation fetch) {}
}
