package com.example.officepdf.service;

import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the template caches plus targeted eviction by template path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheInspectionService {
    private final CacheManager cacheManager;

    public Optional<Map<String, Object>> inspectCache(String cacheName) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return Optional.empty();
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("cacheName", cacheName);
        if (cache instanceof CaffeineCache) {
            com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache = ((CaffeineCache) cache).getNativeCache();
            out.put("estimatedSize", nativeCache.estimatedSize());
            out.put("keys", new ArrayList<>(nativeCache.asMap().keySet()));

            CacheStats stats = nativeCache.stats();
            Map<String, Object> statsMap = new LinkedHashMap<>();
            statsMap.put("hitCount", stats.hitCount());
            statsMap.put("missCount", stats.missCount());
            statsMap.put("loadSuccessCount", stats.loadSuccessCount());
            statsMap.put("loadFailureCount", stats.loadFailureCount());
            statsMap.put("evictionCount", stats.evictionCount());
            statsMap.put("hitRate", stats.hitRate());
            out.put("stats", statsMap);
        } else {
            out.put("message", "Not a Caffeine cache; entry listing unavailable");
        }
        return Optional.of(out);
    }

    public List<Map<String, Object>> inspectAllCaches() {
        List<Map<String, Object>> list = new ArrayList<>();
        for (String name : cacheManager.getCacheNames()) {
            inspectCache(name).ifPresent(list::add);
        }
        return list;
    }

    /**
     * Drop every cached scan or conversion of the given template, whatever version.
     *
     * @return number of entries removed
     */
    public int evictTemplate(String templatePath) {
        String prefix = Path.of(templatePath).toAbsolutePath().normalize() + "|";
        int removed = 0;
        for (String name : cacheManager.getCacheNames()) {
            Cache cache = cacheManager.getCache(name);
            if (!(cache instanceof CaffeineCache)) {
                continue;
            }
            com.github.benmanes.caffeine.cache.Cache<Object, Object> nativeCache = ((CaffeineCache) cache).getNativeCache();
            List<Object> keys = new ArrayList<>();
            for (Object key : nativeCache.asMap().keySet()) {
                if (key.toString().startsWith(prefix)) {
                    keys.add(key);
                }
            }
            nativeCache.invalidateAll(keys);
            removed += keys.size();
        }
        log.info("Evicted {} cache entries for {}", removed, templatePath);
        return removed;
    }

    public boolean clear(String cacheName) {
        Cache cache = cacheManager.getCache(cacheName);
        if (cache == null) {
            return false;
        }
        cache.clear();
        return true;
    }

    public void clearAll() {
        for (String name : cacheManager.getCacheNames()) {
            Cache cache = cacheManager.getCache(name);
            if (cache != null) {
                cache.clear();
            }
        }
    }
}
