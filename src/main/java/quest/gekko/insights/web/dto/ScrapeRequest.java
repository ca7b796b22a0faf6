package quest.gekko.insights.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

import java.time.Duration;

public record ScrapeRequest(
        @NotBlank String pageId,
        @Min(1) @Max(3) Integer depth,
        Boolean includeComments,
        @Min(1) @Max(300) Integer liveTimeoutSeconds
) {
    public int depthOrDefault() {
        return depth != null ? depth : 1;
    }

    public boolean includeCommentsOrDefault() {
        return Boolean.TRUE.equals(includeComments);
    }

    /** {@code null} when the caller leaves the live budget to configuration. */
    public Duration liveTimeout() {
        return liveTimeoutSeconds != null ? Duration.ofSeconds(liveTimeoutSeconds) : null;
    }
}
