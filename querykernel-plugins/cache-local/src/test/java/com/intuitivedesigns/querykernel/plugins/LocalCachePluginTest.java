/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.querykernel.plugins;

import com.intuitivedesigns.querykernel.cache.CaffeineResultCache;
import com.intuitivedesigns.querykernel.config.KernelConfig;
import com.intuitivedesigns.querykernel.spi.Cache;
import com.intuitivedesigns.querykernel.spi.CachePlugin;
import com.intuitivedesigns.querykernel.spi.PluginKind;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.ServiceLoader;

import static org.junit.jupiter.api.Assertions.*;

class LocalCachePluginTest {

    @Test
    void testCreatesCaffeineCache() {
        LocalCachePlugin plugin = new LocalCachePlugin();
        Cache<?, ?> cache = plugin.create(KernelConfig.of(Map.of(
                LocalCachePlugin.KEY_MAX_SIZE, "0",
                LocalCachePlugin.KEY_TTL_SECONDS, "abc")), () -> null);

        assertInstanceOf(CaffeineResultCache.class, cache);
        assertEquals(PluginKind.CACHE, plugin.kind());
        assertEquals("LOCAL_CAFFEINE", plugin.id());
        cache.close();
    }

    @Test
    void testPluginIsRegisteredAsService() {
        boolean found = false;
        for (CachePlugin p : ServiceLoader.load(CachePlugin.class)) {
            if (p instanceof LocalCachePlugin) found = true;
        }
        assertTrue(found);
    }
}
