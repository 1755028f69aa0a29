package com.fractionax.propertyEngine.gateway.controller;

import com.fractionax.propertyEngine.cache.CacheStats;
import com.fractionax.propertyEngine.cache.ResponseCache;
import com.fractionax.propertyEngine.provider.ProviderResponseCaches;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.HashMap;
import java.util.Map;

/**
 * Cache inspection and eviction endpoints.
 *
 * Clearing drops resolved queries and the per-call provider caches; fingerprint eviction
 * touches only the query cache.
 */
@Slf4j
@RestController
@RequestMapping("/api/v2/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final ResponseCache responseCache;
    private final ProviderResponseCaches providerResponseCaches;

    @GetMapping("/stats")
    public ResponseEntity<CacheStats> stats() {
        return ResponseEntity.ok(responseCache.stats());
    }

    @DeleteMapping
    public ResponseEntity<Map<String, String>> clear() {
        responseCache.clear();
        providerResponseCaches.clear();
        log.info("Query and provider caches cleared");

        Map<String, String> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Cache cleared");
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{fingerprint}")
    public ResponseEntity<Map<String, String>> evict(@PathVariable String fingerprint) {
        Map<String, String> response = new HashMap<>();
        response.put("fingerprint", fingerprint);
        if (!responseCache.evict(fingerprint)) {
            response.put("status", "not_found");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
        }
        response.put("status", "evicted");
        return ResponseEntity.ok(response);
    }
}
