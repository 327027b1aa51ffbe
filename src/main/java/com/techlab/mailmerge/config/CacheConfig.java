package com.techlab.mailmerge.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Cache of stored templates. {@code FileTemplateStore.load} parses one JSON file per template; the
 * parsed {@code StoredTemplate} is kept here under the template's safe name, the same key used for
 * its file name.
 *
 * <p>Saving or deleting a template evicts its entry. Entries are immutable, so callers share them.
 */
@Configuration
@EnableCaching
public class CacheConfig {

    /** Stored templates by safe name. */
    public static final String TEMPLATES_CACHE = "templates";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(TEMPLATES_CACHE);
        // files edited outside the service are picked up after an hour at most
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(100)
                .expireAfterWrite(1, TimeUnit.HOURS)
                .recordStats());
        return cacheManager;
    }
}
