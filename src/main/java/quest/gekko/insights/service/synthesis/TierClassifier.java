package quest.gekko.insights.service.synthesis;

import org.springframework.stereotype.Component;

@Component
public class TierClassifier {
    public static final long MEDIUM_THRESHOLD = 1_000_000L;
    public static final long LARGE_THRESHOLD = 10_000_000L;

    public Tier classify(long followers) {
        if (followers < 0) throw new IllegalArgumentException("Follower count must not be negative: " + followers);
        if (followers >= LARGE_THRESHOLD) return Tier.LARGE;
        if (followers >= MEDIUM_THRESHOLD) return Tier.MEDIUM;
        return Tier.SMALL;
    }
}
