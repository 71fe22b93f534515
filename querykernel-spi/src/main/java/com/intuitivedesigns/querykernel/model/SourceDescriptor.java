/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.util.Objects;

/**
 * A registered data source.
 *
 * @param id            Unique source id, referenced by operations.
 * @param connectionRef Opaque connection reference handed to the adapter (URL, URI, broker list, fixture path).
 * @param kind          Storage family.
 * @param adapterType   Plugin id of the adapter serving this source (e.g. JDBC, MONGO).
 * @param priority      Lower values are planned first.
 * @param enabled       Disabled sources are never planned against.
 * @param description   Human description, fed into schema context.
 */
public record SourceDescriptor(
        String id,
        String connectionRef,
        SourceKind kind,
        String adapterType,
        int priority,
        boolean enabled,
        String description
) {

    public SourceDescriptor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        id = id.trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Source id must not be blank");
        }
        if (id.contains("/")) {
            throw new IllegalArgumentException("Source id must not contain '/': " + id);
        }
        connectionRef = (connectionRef == null) ? "" : connectionRef;
        adapterType = (adapterType == null || adapterType.isBlank()) ? "MEMORY" : adapterType.trim();
        description = (description == null) ? "" : description;
    }

    public SourceDescriptor withEnabled(boolean value) {
        return new SourceDescriptor(id, connectionRef, kind, adapterType, priority, value, description);
    }
}
