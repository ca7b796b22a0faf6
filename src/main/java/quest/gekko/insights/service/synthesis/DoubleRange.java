package quest.gekko.insights.service.synthesis;

import java.util.random.RandomGenerator;

public record DoubleRange(double min, double max) {
    public DoubleRange {
        if (Double.isNaN(min) || Double.isNaN(max) || min > max) {
            throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
        }
    }

    public double draw(RandomGenerator random) {
        return min == max ? min : random.nextDouble(min, max);
    }

    /** Bounds of {@code round(base * x)} for any x in this range. */
    public long lowerBoundFor(long base) {
        return Math.round(base * min);
    }

    public long upperBoundFor(long base) {
        return Math.round(base * max);
    }
}
