package com.example.jsoncatalog.service.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;

/**
 * Manual invalidation of application caches. Keys are addressed as {@code cacheName:key}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CacheMaintenanceService {

    private final CacheManager cacheManager;

    /**
     * @param evicted entries removed, counted only for caches that can enumerate their keys
     */
    public record ClearResult(List<String> caches, int evicted) {
    }

    public ClearResult clearAll() {
        int evicted = 0;
        List<String> names = List.copyOf(cacheManager.getCacheNames());
        for (String name : names) {
            Cache cache = cacheManager.getCache(name);
            if (cache == null) {
                continue;
            }
            if (cache.getNativeCache() instanceof ConcurrentMap<?, ?> store) {
                evicted += store.size();
            }
            cache.clear();
        }
        log.info("Cleared all caches {} ({} entries)", names, evicted);
        return new ClearResult(names, evicted);
    }

    /**
     * Evicts entries whose {@code cacheName:key} matches a glob ({@code *} and {@code ?}).
     * A blank pattern clears everything.
     */
    public ClearResult clearMatching(String globPattern) {
        if (!StringUtils.hasText(globPattern)) {
            return clearAll();
        }
        Pattern pattern = globToRegex(globPattern.trim());
        int evicted = 0;
        List<String> names = List.copyOf(cacheManager.getCacheNames());
        for (String name : names) {
            Cache cache = cacheManager.getCache(name);
            if (cache == null) {
                continue;
            }
            if (cache.getNativeCache() instanceof ConcurrentMap<?, ?> store) {
                for (Object key : List.copyOf(store.keySet())) {
                    if (pattern.matcher(name + ":" + key).matches()) {
                        cache.evict(key);
                        evicted++;
                    }
                }
            } else if (pattern.matcher(name + ":").lookingAt()) {
                log.debug("Cache {} cannot enumerate keys, clearing it entirely", name);
                cache.clear();
            }
        }
        log.info("Evicted {} cache entr{} matching '{}'", evicted, evicted == 1 ? "y" : "ies", globPattern);
        return new ClearResult(names, evicted);
    }

    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        for (char c : glob.toCharArray()) {
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString());
    }
}
