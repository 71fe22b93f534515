/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import com.intuitivedesigns.querykernel.config.KernelConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetricsSettingsTest {

    @Test
    void testParsesProviderTagsAndStep() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.of(Map.of(
                "metrics.provider", " micrometer ",
                "metrics.step.seconds", "99999",
                "metrics.tag.env", "dev",
                "metrics.tag.blank", "  ",
                "metrics.jvm.enabled", "true")));

        assertEquals("MICROMETER", s.providerId);
        assertEquals(Duration.ofSeconds(3_600), s.step);
        assertEquals(Map.of("env", "dev"), s.commonTags);
        assertTrue(s.jvmBinders);
    }

    @Test
    void testDefaults() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.empty());

        assertEquals("NONE", s.providerId);
        assertEquals(Duration.ofSeconds(10), s.step);
        assertTrue(s.commonTags.isEmpty());
        assertFalse(s.jvmBinders);
    }

    @Test
    void testFactoryFallsBackToNoop() {
        MetricsRuntime rt = MetricsFactory.init(MetricsSettings.from(KernelConfig.empty()));

        assertSame(MetricsFactory.noop(), rt);
        assertFalse(rt.enabled());
        assertNotNull(rt.registry());
        rt.counter("qk.test");
    }
}
