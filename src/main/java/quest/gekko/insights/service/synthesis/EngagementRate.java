package quest.gekko.insights.service.synthesis;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The engagement rate of a post: interactions per follower, as a percentage with two decimals.
 * Every stored or displayed rate comes from here.
 */
public final class EngagementRate {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private EngagementRate() {
    }

    public static double of(long likes, long comments, long shares, long followers) {
        if (followers <= 0) return 0.0;
        return BigDecimal.valueOf(likes + comments + shares)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(followers), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
