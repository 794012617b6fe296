package com.aegis.controller;

import com.aegis.model.dto.CacheStatistics;
import com.aegis.service.ResponseCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Cache management controller.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final ResponseCache cache;

    public CacheController(ResponseCache cache) {
        this.cache = cache;
    }

    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cache.statistics());
    }

    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        cache.clear();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared"
        ));
    }

    /**
     * Drop one entry by its fingerprint.
     */
    @DeleteMapping("/entries/{key}")
    public ResponseEntity<Void> invalidateEntry(@PathVariable String key) {
        log.info("Cache invalidation requested for {}", key);
        cache.invalidate(key);
        return ResponseEntity.noContent().build();
    }
}
