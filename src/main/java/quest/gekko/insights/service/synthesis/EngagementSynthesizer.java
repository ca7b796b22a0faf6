package quest.gekko.insights.service.synthesis;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.random.RandomGenerator;

@Component
@RequiredArgsConstructor
public class EngagementSynthesizer {
    static final int MIN_DAYS_AGO = 1;
    static final int MAX_DAYS_AGO = 30;

    private final RandomGenerator random;
    private final EngagementValidator validator;

    /**
     * Draws likes from the tier, derives comments, shares and views from them and computes the
     * engagement rate against the page's follower count.
     */
    public Engagement synthesize(TierRanges ranges, long followers) {
        long likes = ranges.likes().draw(random);
        long comments = Math.round(likes * ranges.commentRatio().draw(random));
        long shares = Math.round(likes * ranges.shareRatio().draw(random));
        double multiplier = Math.max(1.0, ranges.viewMultiplier().draw(random));
        long views = Math.round(likes * multiplier);

        Engagement engagement = new Engagement(likes, comments, shares, views,
                EngagementRate.of(likes, comments, shares, followers));
        return validator.check(engagement, ranges, followers);
    }

    /** Posting times 1 to 30 days before {@code now}, most recent first. */
    public List<Instant> postingTimes(int count, Instant now) {
        List<Instant> times = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int daysAgo = random.nextInt(MIN_DAYS_AGO, MAX_DAYS_AGO + 1);
            times.add(now.minus(Duration.ofDays(daysAgo)));
        }
        times.sort(Comparator.reverseOrder());
        return times;
    }
}
