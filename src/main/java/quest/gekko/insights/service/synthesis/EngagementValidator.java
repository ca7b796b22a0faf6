package quest.gekko.insights.service.synthesis;

import org.springframework.stereotype.Component;

/**
 * Checks the cross-field invariants of a synthesized engagement quadruple against the ranges it
 * was drawn from.
 */
@Component
public class EngagementValidator {

    public Engagement check(Engagement e, TierRanges ranges, long followers) {
        if (!ranges.likes().contains(e.likes())) {
            throw violation(e, "likes outside " + ranges.likes());
        }
        if (e.views() < e.likes()
                || e.views() < ranges.viewMultiplier().lowerBoundFor(e.likes())
                || e.views() > ranges.viewMultiplier().upperBoundFor(e.likes())) {
            throw violation(e, "views not within multiplier range " + ranges.viewMultiplier());
        }
        if (e.comments() < ranges.commentRatio().lowerBoundFor(e.likes())
                || e.comments() > ranges.commentRatio().upperBoundFor(e.likes())
                || e.comments() > e.likes()) {
            throw violation(e, "comments not within ratio range " + ranges.commentRatio());
        }
        if (e.shares() < ranges.shareRatio().lowerBoundFor(e.likes())
                || e.shares() > ranges.shareRatio().upperBoundFor(e.likes())
                || e.shares() > e.likes()) {
            throw violation(e, "shares not within ratio range " + ranges.shareRatio());
        }
        double expectedRate = EngagementRate.of(e.likes(), e.comments(), e.shares(), followers);
        if (Double.compare(expectedRate, e.engagementRate()) != 0) {
            throw violation(e, "engagement rate should be " + expectedRate);
        }
        return e;
    }

    private static IllegalStateException violation(Engagement e, String detail) {
        return new IllegalStateException("Inconsistent engagement " + e + ": " + detail);
    }
}
