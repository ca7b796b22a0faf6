package quest.gekko.insights.service.analytics;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate view over a page's current posts and follower history. Recomputed, never stored.
 *
 * @param mostEngagedPost null when the page has no posts
 * @param narrative       null until a summary has been generated
 */
public record AnalyticsSnapshot(
        String identifier,
        int totalPostsAnalyzed,
        double averageEngagement,
        PostHighlight mostEngagedPost,
        List<TrendPoint> followerTrend,
        List<String> topFollowerIndustries,
        String narrative,
        Instant narrativeGeneratedAt,
        Instant computedAt
) {
    public AnalyticsSnapshot withNarrative(String text, Instant generatedAt) {
        return new AnalyticsSnapshot(identifier, totalPostsAnalyzed, averageEngagement, mostEngagedPost,
                followerTrend, topFollowerIndustries, text, generatedAt, computedAt);
    }
}
