/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.plan.Plan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Heap-backed registry.
 *
 * <p>Contracts are immutable values in a concurrent map, so reads never lock. Each
 * (source, table) pair has its own write lock; the compare-hash-then-swap in
 * {@link #upsertFields} runs under it. Durability is provided by {@link RegistrySnapshotStore}.</p>
 */
public final class InMemorySchemaRegistry implements SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemorySchemaRegistry.class);

    private static final Comparator<SourceDescriptor> BY_PRIORITY =
            Comparator.comparingInt(SourceDescriptor::priority).thenComparing(SourceDescriptor::id);

    private final Clock clock;
    private final ConcurrentMap<String, SourceDescriptor> sources = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, FieldContract> contracts = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Long> versionFloor = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> writeLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<TableRef>> ontology = new ConcurrentHashMap<>();
    private final PlanValidator validator;

    public InMemorySchemaRegistry() {
        this(Clock.systemUTC());
    }

    public InMemorySchemaRegistry(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.validator = new PlanValidator(this);
    }

    // --- sources ---

    @Override
    public List<SourceDescriptor> listSources() {
        List<SourceDescriptor> out = new ArrayList<>(sources.values());
        out.sort(BY_PRIORITY);
        return Collections.unmodifiableList(out);
    }

    @Override
    public Optional<SourceDescriptor> source(String sourceId) {
        return (sourceId == null) ? Optional.empty() : Optional.ofNullable(sources.get(sourceId));
    }

    @Override
    public void upsertSource(SourceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        SourceDescriptor prev = sources.put(descriptor.id(), descriptor);
        if (prev == null) {
            log.info("Registered source '{}' kind={} adapter={}", descriptor.id(), descriptor.kind(), descriptor.adapterType());
        } else if (!prev.equals(descriptor)) {
            log.info("Updated source '{}'", descriptor.id());
        }
    }

    @Override
    public boolean removeSource(String sourceId) {
        if (sources.remove(sourceId) == null) return false;
        String prefix = sourceId + "/";
        for (String key : new ArrayList<>(contracts.keySet())) {
            if (key.startsWith(prefix)) {
                withLock(key, () -> contracts.remove(key));
            }
        }
        for (Set<TableRef> refs : ontology.values()) {
            refs.removeIf(r -> r.sourceId().equals(sourceId));
        }
        log.info("Removed source '{}'", sourceId);
        return true;
    }

    // --- contracts ---

    @Override
    public List<String> listTables(String sourceId) {
        List<String> out = new ArrayList<>();
        for (FieldContract c : contracts.values()) {
            if (c.sourceId().equals(sourceId)) out.add(c.table());
        }
        Collections.sort(out);
        return out;
    }

    @Override
    public Optional<FieldContract> listFields(String sourceId, String table) {
        if (sourceId == null || table == null) return Optional.empty();
        return Optional.ofNullable(contracts.get(key(sourceId, table)));
    }

    @Override
    public FieldContract upsertFields(String sourceId, String table, List<FieldSpec> fields) {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(fields, "fields");
        if (!sources.containsKey(sourceId)) {
            throw new IllegalArgumentException("Cannot store fields for unregistered source '" + sourceId + "'");
        }
        final String key = key(sourceId, table);
        final String hash = FieldContract.hash(fields);

        return withLock(key, () -> {
            FieldContract current = contracts.get(key);
            if (current != null && current.contentHash().equals(hash)) {
                return current;
            }
            long next = Math.max(current == null ? 0L : current.version(), versionFloor.getOrDefault(key, 0L)) + 1;
            FieldContract updated = new FieldContract(sourceId, table, fields, next, hash, clock.instant());
            contracts.put(key, updated);
            versionFloor.put(key, next);
            log.info("Contract {} -> v{} ({} fields)", key, next, fields.size());
            return updated;
        });
    }

    @Override
    public ValidationReport validate(Plan plan) {
        return validator.validate(Objects.requireNonNull(plan, "plan"));
    }

    // --- ontology ---

    @Override
    public void mapEntity(String entity, String sourceId, String table) {
        String e = normalizeEntity(entity);
        ontology.computeIfAbsent(e, k -> new CopyOnWriteArraySet<>()).add(new TableRef(sourceId, table));
    }

    @Override
    public Set<String> entities() {
        Set<String> out = new TreeSet<>();
        ontology.forEach((k, v) -> {
            if (!v.isEmpty()) out.add(k);
        });
        return out;
    }

    @Override
    public List<TableRef> tablesForEntity(String entity) {
        Set<TableRef> refs = ontology.get(normalizeEntity(entity));
        if (refs == null) return List.of();
        List<TableRef> out = new ArrayList<>(refs);
        Collections.sort(out);
        return out;
    }

    @Override
    public List<String> entitiesFor(String sourceId, String table) {
        TableRef ref = new TableRef(sourceId, table);
        List<String> out = new ArrayList<>();
        ontology.forEach((entity, refs) -> {
            if (refs.contains(ref)) out.add(entity);
        });
        Collections.sort(out);
        return out;
    }

    @Override
    public List<TableRef> searchTables(String text) {
        if (text == null || text.isBlank()) return List.of();
        String needle = text.trim().toLowerCase(Locale.ROOT);
        Set<TableRef> hits = new TreeSet<>();
        for (FieldContract c : contracts.values()) {
            if (c.table().toLowerCase(Locale.ROOT).contains(needle)) {
                hits.add(new TableRef(c.sourceId(), c.table()));
            }
        }
        ontology.forEach((entity, refs) -> {
            if (entity.contains(needle)) hits.addAll(refs);
        });
        return new ArrayList<>(hits);
    }

    // --- snapshots ---

    public RegistrySnapshot snapshot() {
        Map<String, List<String>> onto = new TreeMap<>();
        ontology.forEach((entity, refs) -> {
            List<String> keys = new ArrayList<>();
            for (TableRef r : refs) keys.add(r.key());
            Collections.sort(keys);
            if (!keys.isEmpty()) onto.put(entity, keys);
        });
        List<FieldContract> all = new ArrayList<>(contracts.values());
        all.sort(Comparator.comparing(FieldContract::sourceId).thenComparing(FieldContract::table));
        return new RegistrySnapshot(listSources(), all, onto);
    }

    /**
     * Rebuilds a registry, keeping recorded versions and hashes as-is.
     */
    public static InMemorySchemaRegistry restore(RegistrySnapshot snapshot, Clock clock) {
        InMemorySchemaRegistry r = new InMemorySchemaRegistry(clock);
        for (SourceDescriptor d : snapshot.sources()) r.sources.put(d.id(), d);
        for (FieldContract c : snapshot.contracts()) {
            String key = key(c.sourceId(), c.table());
            r.contracts.put(key, c);
            r.versionFloor.put(key, c.version());
        }
        snapshot.ontology().forEach((entity, keys) -> {
            for (String k : keys) {
                TableRef ref = TableRef.parse(k);
                r.mapEntity(entity, ref.sourceId(), ref.table());
            }
        });
        return r;
    }

    private <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = writeLocks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static String key(String sourceId, String table) {
        return sourceId + "/" + table;
    }

    private static String normalizeEntity(String entity) {
        if (entity == null || entity.isBlank()) {
            throw new IllegalArgumentException("Entity name must not be blank");
        }
        return entity.trim().toLowerCase(Locale.ROOT);
    }
}
