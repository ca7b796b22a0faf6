package quest.gekko.insights.service.synthesis;

/**
 * Numeric ranges used to synthesize engagement for one size tier. Comment and share ratios are
 * fractions of likes, the view multiplier scales likes into views.
 */
public record TierRanges(IntRange likes, DoubleRange commentRatio, DoubleRange shareRatio, DoubleRange viewMultiplier) {
    public TierRanges {
        if (likes.min() < 0) throw new IllegalArgumentException("likes must not be negative");
        requireFraction("commentRatio", commentRatio);
        requireFraction("shareRatio", shareRatio);
        if (viewMultiplier.min() < 1.0) throw new IllegalArgumentException("viewMultiplier must be at least 1");
    }

    private static void requireFraction(String name, DoubleRange range) {
        if (range.min() < 0.0 || range.max() > 1.0) {
            throw new IllegalArgumentException(name + " must lie within [0, 1]");
        }
    }
}
