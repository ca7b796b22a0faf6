package quest.gekko.insights.service.synthesis;

import java.util.random.RandomGenerator;

/** Closed integer range. */
public record IntRange(int min, int max) {
    public IntRange {
        if (min > max) throw new IllegalArgumentException("Empty range [" + min + ", " + max + "]");
    }

    public int draw(RandomGenerator random) {
        return min == max ? min : random.nextInt(min, max + 1);
    }

    public boolean contains(long value) {
        return value >= min && value <= max;
    }
}
