package quest.gekko.insights.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {
    public static final String PAGE_DETAILS = "pageDetails";

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean
    public Caffeine<Object, Object> caffeine(final InsightsProperties.Cache cache, final Ticker cacheTicker) {
        return Caffeine.newBuilder()
                .maximumSize(cache.maximumSize())
                .expireAfterWrite(cache.pageDetailTtl())
                .ticker(cacheTicker);
    }

    @Bean
    public CacheManager cacheManager(final Caffeine<Object, Object> caffeine) {
        final CaffeineCacheManager cacheManager = new CaffeineCacheManager(PAGE_DETAILS);
        cacheManager.setCaffeine(caffeine);
        return cacheManager;
    }
}
