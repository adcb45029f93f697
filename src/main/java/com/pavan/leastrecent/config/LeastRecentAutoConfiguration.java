package com.pavan.leastrecent.config;

import com.pavan.leastrecent.cache.LRUCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Exposes a shared {@link LRUCache} bean sized from {@link CacheProperties}.
 * Applications that declare their own cache bean replace this one.
 */
@AutoConfiguration
@EnableConfigurationProperties(CacheProperties.class)
public class LeastRecentAutoConfiguration {
    
    private static final Logger logger = LoggerFactory.getLogger(LeastRecentAutoConfiguration.class);
    
    @Bean
    @ConditionalOnMissingBean(LRUCache.class)
    public LRUCache<Object, Object> leastRecentCache(CacheProperties properties) {
        LRUCache<Object, Object> cache = LRUCache.withCapacity(properties.getCapacity());
        if (properties.isLogEvictions()) {
            cache.onEvicted((key, value) -> logger.debug("Evicted key {} from least-recent cache", key));
        }
        logger.info("Initialized least-recent cache (capacity: {}, pointer width: {})",
            cache.capacity(), cache.pointerWidth());
        return cache;
    }
}
