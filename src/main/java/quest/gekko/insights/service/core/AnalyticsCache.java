package quest.gekko.insights.service.core;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.stereotype.Component;
import quest.gekko.insights.config.InsightsProperties;
import quest.gekko.insights.service.analytics.AnalyticsSnapshot;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Short lived analytics snapshots keyed by page identifier. Entries expire after the configured TTL,
 * measured with the injected ticker.
 * <p>
 * Every eviction bumps the identifier's version. A snapshot is only stored when the version read before
 * computing it is still current, so a snapshot built from data older than the last eviction is dropped.
 */
@Component
public class AnalyticsCache {
    private final Cache<String, AnalyticsSnapshot> snapshots;
    private final ConcurrentMap<String, Long> versions = new ConcurrentHashMap<>();

    public AnalyticsCache(final InsightsProperties.Cache cache, final Ticker cacheTicker) {
        this.snapshots = Caffeine.newBuilder()
                .maximumSize(cache.maximumSize())
                .expireAfterWrite(cache.analyticsTtl())
                .ticker(cacheTicker)
                .build();
    }

    public Optional<AnalyticsSnapshot> get(String identifier) {
        return Optional.ofNullable(snapshots.getIfPresent(identifier));
    }

    /** Read before loading the data a snapshot is computed from. */
    public long version(String identifier) {
        return versions.getOrDefault(identifier, 0L);
    }

    /**
     * Stores the snapshot unless the identifier was evicted after {@code version} was read.
     *
     * @return whether the snapshot was stored
     */
    public boolean put(String identifier, AnalyticsSnapshot snapshot, long version) {
        // compute runs under the entry's lock, the same lock evict takes
        AnalyticsSnapshot cached = snapshots.asMap()
                .compute(identifier, (id, current) -> version(id) == version ? snapshot : current);
        return cached == snapshot;
    }

    public void evict(String identifier) {
        snapshots.asMap().compute(identifier, (id, current) -> {
            versions.merge(id, 1L, Long::sum);
            return null;
        });
    }
}
