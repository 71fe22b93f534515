/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.registry;

import com.intuitivedesigns.querykernel.model.FieldSpec;
import com.intuitivedesigns.querykernel.plan.ContractStamp;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned field list of one (source, table) pair. Immutable; the registry swaps whole
 * instances on update.
 *
 * @param version     monotonically increasing per (source, table); bumps only when the hash changes
 * @param contentHash SHA-256 over the canonical field list
 */
public record FieldContract(
        String sourceId,
        String table,
        List<FieldSpec> fields,
        long version,
        String contentHash,
        Instant updatedAt
) {

    public FieldContract {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(table, "table");
        fields = (fields == null) ? List.of() : List.copyOf(fields);
        if (version < 1) throw new IllegalArgumentException("Contract version must be >= 1");
        if (contentHash == null || contentHash.isBlank()) contentHash = hash(fields);
        if (updatedAt == null) updatedAt = Instant.now();
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec f : fields) {
            if (f.name().equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public ContractStamp stamp() {
        return new ContractStamp(version, contentHash);
    }

    public static String hash(List<FieldSpec> fields) {
        StringBuilder canonical = new StringBuilder(fields.size() * 24);
        for (FieldSpec f : fields) {
            canonical.append(f.name()).append('|')
                    .append(f.type().name()).append('|')
                    .append(f.nullable()).append('|')
                    .append(f.role().name()).append('\n');
        }
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JVM
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
