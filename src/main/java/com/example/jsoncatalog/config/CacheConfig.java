package com.example.jsoncatalog.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * Caching of catalog lookups. The provider comes from {@code spring.cache.type};
 * {@code none} turns it off without changing behavior.
 */
@Configuration
@EnableCaching
public class CacheConfig {
}
