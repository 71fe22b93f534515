/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Source-specific query body. Opaque to the kernel: only the matching adapter interprets it.
 *
 * Values are restricted to JSON-like shapes (null, String, Number, Boolean, List, Map)
 * and are deep-copied into unmodifiable collections on construction. Integral numbers
 * are widened to Long and floats to Double, so equal documents compare equal.
 */
public record QueryPayload(Map<String, Object> values) {

    public QueryPayload {
        Objects.requireNonNull(values, "values");
        values = freezeMap(values);
    }

    public static QueryPayload of(Map<String, ?> values) {
        return new QueryPayload(new LinkedHashMap<>(values));
    }

    public static QueryPayload empty() {
        return new QueryPayload(Map.of());
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        return (v == null) ? defaultValue : String.valueOf(v);
    }

    public long getLong(String key, long defaultValue) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String key) {
        Object v = values.get(key);
        return (v instanceof List<?> l) ? (List<Object>) l : List.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String key) {
        Object v = values.get(key);
        return (v instanceof Map<?, ?> m) ? (Map<String, Object>) m : Map.of();
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    /**
     * Order-insensitive rendering used as a cache and equality key.
     */
    public String fingerprint() {
        StringBuilder sb = new StringBuilder(64);
        appendCanonical(sb, values);
        return sb.toString();
    }

    private static void appendCanonical(StringBuilder sb, Object v) {
        if (v instanceof Map<?, ?> m) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, Object> e : new TreeMap<>(castMap(m)).entrySet()) {
                if (!first) sb.append(',');
                first = false;
                sb.append(e.getKey()).append('=');
                appendCanonical(sb, e.getValue());
            }
            sb.append('}');
        } else if (v instanceof List<?> l) {
            sb.append('[');
            for (int i = 0; i < l.size(); i++) {
                if (i > 0) sb.append(',');
                appendCanonical(sb, l.get(i));
            }
            sb.append(']');
        } else if (v instanceof String s) {
            sb.append('"').append(s).append('"');
        } else {
            sb.append(v);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Map<?, ?> m) {
        return (Map<String, Object>) m;
    }

    private static Map<String, Object> freezeMap(Map<?, ?> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : in.entrySet()) {
            if (e.getKey() == null) {
                throw new IllegalArgumentException("Payload keys must not be null");
            }
            out.put(String.valueOf(e.getKey()), freeze(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Object freeze(Object v) {
        if (v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof Float f) {
            return f.doubleValue();
        }
        if (v == null || v instanceof String || v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof Map<?, ?> m) {
            return freezeMap(m);
        }
        if (v instanceof List<?> l) {
            List<Object> out = new ArrayList<>(l.size());
            for (Object o : l) out.add(freeze(o));
            return Collections.unmodifiableList(out);
        }
        throw new IllegalArgumentException("Unsupported payload value type: " + v.getClass().getName());
    }
}
