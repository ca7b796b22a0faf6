package quest.gekko.insights.service.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.Post;
import quest.gekko.insights.service.analytics.AnalyticsAggregator;
import quest.gekko.insights.service.analytics.AnalyticsSnapshot;
import quest.gekko.insights.service.error.PageNotFoundException;
import quest.gekko.insights.service.integration.summary.SummaryPrompts;
import quest.gekko.insights.service.integration.summary.SummaryProvider;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class AnalyticsService {
    private final PageStore pageStore;
    private final AnalyticsAggregator aggregator;
    private final AnalyticsCache cache;
    private final Optional<SummaryProvider> summaryProvider;
    private final Clock clock;

    public AnalyticsService(PageStore pageStore, AnalyticsAggregator aggregator, AnalyticsCache cache,
                            Optional<SummaryProvider> summaryProvider, Clock clock) {
        this.pageStore = pageStore;
        this.aggregator = aggregator;
        this.cache = cache;
        this.summaryProvider = summaryProvider;
        this.clock = clock;
    }

    public AnalyticsSnapshot getAnalytics(String identifier) {
        Optional<AnalyticsSnapshot> cached = cache.get(identifier);
        if (cached.isPresent()) {
            log.debug("Analytics cache hit for {}", identifier);
            return cached.get();
        }
        long version = cache.version(identifier);
        AnalyticsSnapshot snapshot = compute(requirePage(identifier));
        if (!cache.put(identifier, snapshot, version)) {
            log.debug("Page {} changed while computing analytics, not caching", identifier);
        }
        return snapshot;
    }

    /**
     * Recomputes the snapshot and asks the summary provider for a fresh narrative. Provider failures
     * leave the previous narrative in place; the snapshot is returned either way.
     */
    public AnalyticsSnapshot refreshNarrative(String identifier) {
        long version = cache.version(identifier);
        CompanyPage page = requirePage(identifier);
        List<Post> posts = pageStore.getPostsFor(identifier);
        AnalyticsSnapshot snapshot = compute(page, posts);

        Optional<String> narrative = generateNarrative(page, posts, snapshot.averageEngagement());
        if (narrative.isPresent()) {
            Instant now = clock.instant();
            pageStore.saveNarrative(identifier, narrative.get(), now);
            snapshot = snapshot.withNarrative(narrative.get(), now);
            log.info("Generated narrative summary for {}", identifier);
        }
        cache.put(identifier, snapshot, version);
        return snapshot;
    }

    public void invalidate(String identifier) {
        cache.evict(identifier);
    }

    private Optional<String> generateNarrative(CompanyPage page, List<Post> posts, double averageEngagement) {
        if (summaryProvider.isEmpty()) return Optional.empty();
        try {
            return summaryProvider.get().summarize(SummaryPrompts.pageSummary(page, posts, averageEngagement));
        } catch (RuntimeException e) {
            log.warn("Summary generation failed for {}: {}", page.getIdentifier(), e.getMessage());
            return Optional.empty();
        }
    }

    private CompanyPage requirePage(String identifier) {
        return pageStore.findPage(identifier).orElseThrow(() -> new PageNotFoundException(identifier));
    }

    private AnalyticsSnapshot compute(CompanyPage page) {
        return compute(page, pageStore.getPostsFor(page.getIdentifier()));
    }

    private AnalyticsSnapshot compute(CompanyPage page, List<Post> posts) {
        return aggregator.aggregate(page, posts, pageStore.getFollowerHistory(page.getIdentifier()), clock.instant());
    }
}
