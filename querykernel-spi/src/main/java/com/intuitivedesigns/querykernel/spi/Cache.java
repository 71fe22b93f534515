/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.spi;

import java.util.Optional;

/**
 * Bounded key/value cache. Located in SPI so plugins can provide implementations.
 */
public interface Cache<K, V> extends AutoCloseable {
    Optional<V> get(K key);
    void put(K key, V value);
    void invalidate(K key);

    @Override
    default void close() {
        // no-op by default
    }
}
