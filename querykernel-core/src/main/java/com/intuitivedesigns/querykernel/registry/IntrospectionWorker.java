/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.adapter.SourceAdapter;
import com.intuitivedesigns.querykernel.adapter.SourceAdapterException;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls table layouts from an adapter and writes them into the registry.
 * The only writer of field contracts besides explicit configuration.
 */
public final class IntrospectionWorker {

    private static final Logger log = LoggerFactory.getLogger(IntrospectionWorker.class);

    private final SchemaRegistry registry;

    public IntrospectionWorker(SchemaRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return contracts whose version changed during this pass
     */
    public List<FieldContract> introspect(SourceDescriptor source, SourceAdapter adapter) throws SourceAdapterException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(adapter, "adapter");

        registry.upsertSource(source);
        List<TableSchema> tables = adapter.introspect();
        List<FieldContract> changed = new ArrayList<>();

        for (TableSchema t : tables) {
            long before = registry.listFields(source.id(), t.table()).map(FieldContract::version).orElse(0L);
            FieldContract after = registry.upsertFields(source.id(), t.table(), t.fields());
            if (after.version() != before) {
                changed.add(after);
            }
        }

        log.info("Introspected source '{}': {} tables, {} changed", source.id(), tables.size(), changed.size());
        return changed;
    }
}
