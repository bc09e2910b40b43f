package com.example.officepdf.controller;

import com.example.officepdf.service.CacheInspectionService;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.CacheManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Inspection and eviction of the template scan and conversion caches.
 */
@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class AdminCacheController {
    private final CacheInspectionService inspectionService;
    private final CacheManager cacheManager;

    @GetMapping
    public ResponseEntity<List<String>> listCaches() {
        return ResponseEntity.ok(List.copyOf(cacheManager.getCacheNames()));
    }

    @GetMapping("/{cacheName}")
    public ResponseEntity<?> inspectCache(@PathVariable String cacheName) {
        return inspectionService.inspectCache(cacheName)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/all")
    public ResponseEntity<?> inspectAll() {
        return ResponseEntity.ok(inspectionService.inspectAllCaches());
    }

    /**
     * Evict every cached entry of one template file, e.g. after replacing it in place
     * with the same timestamp.
     */
    @DeleteMapping("/templates")
    public ResponseEntity<Map<String, Object>> evictTemplate(@RequestParam String path) {
        int removed = inspectionService.evictTemplate(path);
        return ResponseEntity.ok(Map.of("path", path, "evicted", removed));
    }

    @DeleteMapping("/{cacheName}")
    public ResponseEntity<?> clearCache(@PathVariable String cacheName) {
        if (!inspectionService.clear(cacheName)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().build();
    }

    @DeleteMapping
    public ResponseEntity<?> clearAllCaches() {
        inspectionService.clearAll();
        return ResponseEntity.ok().build();
    }
}
