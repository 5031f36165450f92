package com.venueops.common.config;

import org.springframework.cache.annotation.EnableCaching;
import org.springframework.context.annotation.Configuration;

/**
 * Local Caffeine cache for catalog lookups. The cache spec lives in application.yml
 * ({@code spring.cache.caffeine.spec}).
 */
@Configuration
@EnableCaching
public class CacheConfig {
}
