/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.metrics;

import com.intuitivedesigns.querykernel.config.KernelConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for the metrics runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_STEP_SECONDS = "metrics.step.seconds";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_JVM_BINDERS = "metrics.jvm.enabled";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 10;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;
    public final boolean jvmBinders;

    private MetricsSettings(String providerId, Map<String, String> commonTags, Duration step, boolean jvmBinders) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
        this.jvmBinders = jvmBinders;
    }

    public static MetricsSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, DEFAULT_PROVIDER));
        final int stepSec = clampInt(config.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600);

        final Map<String, String> tags = new HashMap<>();
        for (Map.Entry<String, Object> entry : config.asMap().entrySet()) {
            final String k = entry.getKey();
            if (k == null || !k.startsWith(KEY_TAG_PREFIX)) continue;

            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            if (tagKey.isEmpty()) continue;

            final Object valObj = entry.getValue();
            if (valObj == null) continue;

            final String valStr = String.valueOf(valObj).trim();
            if (valStr.isEmpty()) continue;

            tags.put(tagKey, valStr);
        }

        return new MetricsSettings(
                provider,
                Collections.unmodifiableMap(tags),
                Duration.ofSeconds(stepSec),
                config.getBoolean(KEY_JVM_BINDERS, false)
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                ", jvmBinders=" + jvmBinders +
                '}';
    }

    private static String normalizeUpper(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t.toUpperCase(Locale.ROOT);
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
