/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KernelConfigTest {

    @Test
    void testTypedGettersFallBackOnInvalidValues() {
        KernelConfig config = KernelConfig.of(Map.of(
                "executor.max.parallelism", " 8 ",
                "executor.attempt.timeout.ms", "soon",
                "executor.retry.multiplier", "1.5",
                "registry.introspect.on.start", "false"));

        assertEquals(8, config.getInt("executor.max.parallelism", 4));
        assertEquals(30_000L, config.getLong("executor.attempt.timeout.ms", 30_000L));
        assertEquals(1.5, config.getDouble("executor.retry.multiplier", 2.0));
        assertFalse(config.getBoolean("registry.introspect.on.start", true));
        assertTrue(config.getBoolean("missing", true));
        assertEquals("x", config.getString("missing", "x"));
        assertTrue(config.hasPath("executor.retry.multiplier"));
    }

    @Test
    void testSubsetStripsPrefix() {
        KernelConfig config = KernelConfig.of(Map.of(
                "sources.crm.kind", "RELATIONAL",
                "sources.crm.jdbc.pool.size", "4",
                "sources.shop.kind", "DOCUMENT",
                "sources.crm.", "ignored"));

        KernelConfig crm = config.subset("sources.crm.");

        assertEquals(Set.of("kind", "jdbc.pool.size"), crm.keys());
        assertEquals("RELATIONAL", crm.getString("kind", null));
        assertEquals(Map.of("kind", "RELATIONAL", "jdbc.pool.size", "4"), crm.asMap());
    }

    @Test
    void testCopiesAreIndependentOfSource() {
        Properties props = new Properties();
        props.setProperty("cache.type", "LOCAL");
        KernelConfig config = KernelConfig.of(props);

        props.setProperty("cache.type", "NOOP");

        assertEquals("LOCAL", config.getString("cache.type", null));
    }

    @Test
    void testLoadReadsPropertiesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("querykernel.properties");
        Files.writeString(file, "generator.type=MOCK\n# comment\nexecutor.max.parallelism=2\n");

        KernelConfig config = KernelConfig.load(file);

        assertEquals("MOCK", config.getString("generator.type", null));
        assertEquals(2, config.getInt("executor.max.parallelism", 4));
        assertTrue(KernelConfig.empty().keys().isEmpty());
    }
}
