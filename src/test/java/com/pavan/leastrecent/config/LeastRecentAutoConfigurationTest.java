package com.pavan.leastrecent.config;

import com.pavan.leastrecent.cache.InvalidCapacityException;
import com.pavan.leastrecent.cache.LRUCache;
import com.pavan.leastrecent.cache.PointerWidth;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the auto-configured cache bean.
 */
@SpringBootTest(classes = LeastRecentAutoConfiguration.class)
@TestPropertySource(properties = {
    "spring.main.banner-mode=off",
    "logging.level.org.springframework=WARN",
    "least-recent.cache.capacity=2",
    "least-recent.cache.log-evictions=true",
    "logging.level.com.pavan.leastrecent.config=DEBUG"
})
@ExtendWith(OutputCaptureExtension.class)
class LeastRecentAutoConfigurationTest {
    
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LeastRecentAutoConfiguration.class));
    
    @Autowired
    private LRUCache<Object, Object> cache;
    
    @Autowired
    private CacheProperties properties;
    
    @Test
    void testCacheBoundFromProperties() {
        assertEquals(2, properties.getCapacity());
        assertTrue(properties.isLogEvictions());
        assertEquals(2, cache.capacity());
        assertEquals(PointerWidth.UINT8, cache.pointerWidth());
    }
    
    @Test
    void testInjectedCacheLogsEvictions(CapturedOutput output) {
        cache.clear();
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("c", 3);
        
        assertFalse(cache.has("a"));
        assertEquals(2, cache.size());
        assertTrue(output.getOut().contains("Evicted key a from least-recent cache"));
    }
    
    @Test
    void testDefaultCapacity() {
        contextRunner.run(context -> {
            LRUCache<?, ?> defaultCache = context.getBean(LRUCache.class);
            assertEquals(1000, defaultCache.capacity());
            assertEquals(PointerWidth.UINT16, defaultCache.pointerWidth());
        });
    }
    
    @Test
    void testInvalidCapacityFailsStartup() {
        contextRunner.withPropertyValues("least-recent.cache.capacity=0").run(context -> {
            Throwable failure = context.getStartupFailure();
            assertNotNull(failure);
            while (failure.getCause() != null) {
                failure = failure.getCause();
            }
            assertInstanceOf(InvalidCapacityException.class, failure);
        });
    }
    
    @Test
    void testUserDefinedCacheTakesPrecedence() {
        contextRunner.withUserConfiguration(CustomCacheConfiguration.class).run(context -> {
            assertEquals(1, context.getBeansOfType(LRUCache.class).size());
            assertEquals(5, context.getBean(LRUCache.class).capacity());
        });
    }
    
    @Configuration(proxyBeanMethods = false)
    static class CustomCacheConfiguration {
        
        @Bean
        LRUCache<String, String> customCache() {
            return new LRUCache<>(5);
        }
    }
}
