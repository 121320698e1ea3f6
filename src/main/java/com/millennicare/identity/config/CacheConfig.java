package com.millennicare.identity.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.interceptor.KeyGenerator;
import org.springframework.cache.interceptor.SimpleKeyGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * In-process Caffeine cache. Only seeded role lookups are cached; roles never change at runtime.
 */
@Slf4j
@Configuration
@EnableCaching
public class CacheConfig implements CachingConfigurer {

    public static final String ROLE_BY_NAME = "roleByName";

    @Bean
    @Override
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(32)
                .expireAfterWrite(Duration.ofHours(6))
                .recordStats());
        manager.setCacheNames(List.of(ROLE_BY_NAME));
        manager.setAllowNullValues(false);
        return manager;
    }

    /** Role names are matched case-insensitively, so keys are trimmed and lower-cased. */
    @Bean
    public KeyGenerator lowerCaseStringKeyGenerator() {
        return (target, method, params) -> params.length == 1 && params[0] instanceof String s
                ? s.trim().toLowerCase(Locale.ROOT)
                : SimpleKeyGenerator.generateKey(params);
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return new RoleCacheErrorHandler();
    }

    /** A broken cache degrades to a database lookup. */
    static final class RoleCacheErrorHandler implements CacheErrorHandler {

        @Override
        public void handleCacheGetError(@NonNull RuntimeException e, @NonNull Cache cache, @NonNull Object key) {
            log.warn("Cache read failed on {} for {}: {}", cache.getName(), key, e.toString());
        }

        @Override
        public void handleCachePutError(@NonNull RuntimeException e, @NonNull Cache cache,
                                        @NonNull Object key, @Nullable Object value) {
            log.warn("Cache write failed on {} for {}: {}", cache.getName(), key, e.toString());
        }

        @Override
        public void handleCacheEvictError(@NonNull RuntimeException e, @NonNull Cache cache, @NonNull Object key) {
            log.warn("Cache evict failed on {} for {}: {}", cache.getName(), key, e.toString());
        }

        @Override
        public void handleCacheClearError(@NonNull RuntimeException e, @NonNull Cache cache) {
            log.warn("Cache clear failed on {}: {}", cache.getName(), e.toString());
        }
    }
}
