package com.example.jsoncatalog.controller;

import com.example.jsoncatalog.service.cache.CacheMaintenanceService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/admin/cache")
@RequiredArgsConstructor
public class CacheController {

    private final CacheMaintenanceService cacheMaintenanceService;

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> clearCache(@RequestParam(required = false) String pattern) {
        CacheMaintenanceService.ClearResult result = cacheMaintenanceService.clearMatching(pattern);
        return ResponseEntity.ok(Map.of("success", true, "caches", result.caches(), "evicted", result.evicted()));
    }
}
