/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.model.SourceDescriptor;
import com.intuitivedesigns.querykernel.plan.Plan;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative catalog of sources, field contracts and the entity ontology.
 *
 * <p>Reads are safe without external synchronization. Contract writes are serialized per
 * (source, table); readers always see a whole contract, never a partial update.</p>
 */
public interface SchemaRegistry {

    List<SourceDescriptor> listSources();

    Optional<SourceDescriptor> source(String sourceId);

    void upsertSource(SourceDescriptor descriptor);

    /**
     * Removes the source and its contracts. Versions stay monotonic if it is re-added.
     */
    boolean removeSource(String sourceId);

    List<String> listTables(String sourceId);

    /**
     * @return the current contract, or empty when the pair is unknown
     */
    Optional<FieldContract> listFields(String sourceId, String table);

    /**
     * Stores a field list. An identical list keeps the current version; a different one
     * bumps it. Called by introspection, never by the planning or execution read path.
     */
    FieldContract upsertFields(String sourceId, String table, List<FieldSpec> fields);

    /**
     * Checks every operation of {@code plan} against current contracts. Read-only.
     */
    ValidationReport validate(Plan plan);

    /**
     * Associates a business entity ("customer", "order") with a table.
     */
    void mapEntity(String entity, String sourceId, String table);

    Set<String> entities();

    List<TableRef> tablesForEntity(String entity);

    List<String> entitiesFor(String sourceId, String table);

    /**
     * Case-insensitive search over table names and mapped entity names.
     */
    List<TableRef> searchTables(String text);
}
