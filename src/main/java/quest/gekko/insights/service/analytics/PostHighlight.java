package quest.gekko.insights.service.analytics;

import java.time.Instant;

public record PostHighlight(String postIdentifier, String content, double engagementRate, Instant postedAt) {}
