/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Properties-backed configuration.
 * The process-wide instance loads from -Dqk.config.path or ENV 'QK_CONFIG_PATH'.
 * Instances are read-only once constructed.
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    public static final String SYS_PROP_PATH = "qk.config.path";
    public static final String ENV_PATH = "QK_CONFIG_PATH";

    private static volatile KernelConfig instance;

    private final Properties props;

    private KernelConfig(Properties props) {
        this.props = props;
    }

    public static KernelConfig get() {
        KernelConfig local = instance;
        if (local == null) {
            synchronized (KernelConfig.class) {
                local = instance;
                if (local == null) {
                    local = loadDefault();
                    instance = local;
                }
            }
        }
        return local;
    }

    public static KernelConfig of(Properties source) {
        Objects.requireNonNull(source, "source");
        Properties copy = new Properties();
        for (String name : source.stringPropertyNames()) {
            copy.setProperty(name, source.getProperty(name));
        }
        return new KernelConfig(copy);
    }

    public static KernelConfig of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        Properties p = new Properties();
        values.forEach((k, v) -> {
            if (k != null && v != null) p.setProperty(k, v);
        });
        return new KernelConfig(p);
    }

    public static KernelConfig empty() {
        return new KernelConfig(new Properties());
    }

    public static KernelConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Properties p = new Properties();
        try (InputStream is = Files.newInputStream(path)) {
            p.load(is);
        }
        log.info("Loaded {} properties from {}", p.size(), path);
        return new KernelConfig(p);
    }

    private static KernelConfig loadDefault() {
        // 1. System property first, then the environment
        String path = System.getProperty(SYS_PROP_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_PATH);
        }

        if (path == null || path.isBlank()) {
            log.warn("No configuration file specified. Usage: -D{}=/path/to/querykernel.properties", SYS_PROP_PATH);
            return empty();
        }

        try {
            return load(Path.of(path));
        } catch (IOException e) {
            log.error("Failed to load config file: {}", path, e);
            return empty();
        }
    }

    public String getString(String key, String defaultValue) {
        return props.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for '{}': '{}', using {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}', using {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid double for '{}': '{}', using {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = props.getProperty(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val.trim());
    }

    public boolean hasPath(String key) {
        return props.containsKey(key);
    }

    /**
     * Keys under {@code prefix}, with the prefix stripped.
     * {@code subset("sources.orders.")} turns {@code sources.orders.url} into {@code url}.
     */
    public KernelConfig subset(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        Properties p = new Properties();
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                p.setProperty(name.substring(prefix.length()), props.getProperty(name));
            }
        }
        return new KernelConfig(p);
    }

    public Map<String, Object> asMap() {
        Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return map;
    }

    public Set<String> keys() {
        return new TreeSet<>(props.stringPropertyNames());
    }
}
