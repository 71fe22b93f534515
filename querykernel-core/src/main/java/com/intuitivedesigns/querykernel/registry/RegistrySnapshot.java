/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.SourceDescriptor;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a registry.
 *
 * @param ontology entity name to "source/table" keys
 */
public record RegistrySnapshot(List<SourceDescriptor> sources, List<FieldContract> contracts, Map<String, List<String>> ontology) {

    public RegistrySnapshot {
        sources = (sources == null) ? List.of() : List.copyOf(sources);
        contracts = (contracts == null) ? List.of() : List.copyOf(contracts);
        ontology = (ontology == null) ? Map.of() : Map.copyOf(ontology);
    }
}
