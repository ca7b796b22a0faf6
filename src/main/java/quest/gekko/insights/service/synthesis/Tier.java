package quest.gekko.insights.service.synthesis;

public enum Tier {
    SMALL(new TierRanges(new IntRange(50, 1_000),
            new DoubleRange(0.01, 0.05), new DoubleRange(0.005, 0.04), new DoubleRange(2, 8))),
    MEDIUM(new TierRanges(new IntRange(100, 2_000),
            new DoubleRange(0.01, 0.05), new DoubleRange(0.005, 0.04), new DoubleRange(3, 10))),
    LARGE(new TierRanges(new IntRange(150, 5_000),
            new DoubleRange(0.005, 0.04), new DoubleRange(0.002, 0.03), new DoubleRange(5, 15)));

    private final TierRanges ranges;

    Tier(TierRanges ranges) {
        this.ranges = ranges;
    }

    public TierRanges ranges() {
        return ranges;
    }
}
