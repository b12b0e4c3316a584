package com.example.jsoncatalog.service.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.cache.Cache;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;

import static org.assertj.core.api.Assertions.assertThat;

class CacheMaintenanceServiceTest {

    private ConcurrentMapCacheManager cacheManager;
    private CacheMaintenanceService service;

    @BeforeEach
    void setUp() {
        cacheManager = new ConcurrentMapCacheManager("datasets", "profiles");
        service = new CacheMaintenanceService(cacheManager);
        Cache datasets = cacheManager.getCache("datasets");
        datasets.put("abc-1", "a");
        datasets.put("abc-2", "b");
        datasets.put("xyz-1", "c");
        cacheManager.getCache("profiles").put("abc-1", "p");
    }

    @Test
    void clearAllEmptiesEveryCache() {
        CacheMaintenanceService.ClearResult result = service.clearAll();

        assertThat(result.evicted()).isEqualTo(4);
        assertThat(result.caches()).containsExactlyInAnyOrder("datasets", "profiles");
        assertThat(cacheManager.getCache("datasets").get("abc-1")).isNull();
        assertThat(cacheManager.getCache("profiles").get("abc-1")).isNull();
    }

    @Test
    void clearMatchingEvictsOnlyMatchingKeys() {
        CacheMaintenanceService.ClearResult result = service.clearMatching("datasets:abc-*");

        assertThat(result.evicted()).isEqualTo(2);
        assertThat(cacheManager.getCache("datasets").get("abc-1")).isNull();
        assertThat(cacheManager.getCache("datasets").get("xyz-1")).isNotNull();
        assertThat(cacheManager.getCache("profiles").get("abc-1")).isNotNull();
    }

    @Test
    void wildcardCacheNameMatchesAcrossCaches() {
        assertThat(service.clearMatching("*:abc-1").evicted()).isEqualTo(2);
    }

    @Test
    void blankPatternClearsEverything() {
        assertThat(service.clearMatching("  ").evicted()).isEqualTo(4);
    }

    @Test
    void globMetacharactersAreLiteralOtherwise() {
        assertThat(CacheMaintenanceService.globToRegex("a.b?").matcher("a.bc").matches()).isTrue();
        assertThat(CacheMaintenanceService.globToRegex("a.b?").matcher("axbc").matches()).isFalse();
    }
}
