package quest.gekko.insights.service.acquisition;

import java.time.Duration;

/**
 * @param depth       1 = page only, 2 = page and posts, 3 = page, posts, people and narrative
 * @param liveTimeout budget for the live fetch; {@code null} uses the configured default
 */
public record AcquisitionRequest(String identifier, int depth, boolean includeComments, Duration liveTimeout) {
    public static final int MIN_DEPTH = 1;
    public static final int MAX_DEPTH = 3;

    public AcquisitionRequest(String identifier, int depth, boolean includeComments) {
        this(identifier, depth, includeComments, null);
    }

    public static AcquisitionRequest of(String identifier, int depth) {
        return new AcquisitionRequest(identifier, depth, false);
    }

    public boolean includesPosts() {
        return depth >= 2;
    }

    public boolean includesPeople() {
        return depth >= 3;
    }

    public Duration liveTimeoutOr(Duration configured) {
        return liveTimeout != null ? liveTimeout : configured;
    }
}
