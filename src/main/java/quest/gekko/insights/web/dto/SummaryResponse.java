package quest.gekko.insights.web.dto;

import quest.gekko.insights.service.analytics.AnalyticsSnapshot;

import java.time.Instant;

public record SummaryResponse(String pageId, String summary, Instant generatedAt, boolean generated) {
    public static SummaryResponse from(AnalyticsSnapshot snapshot) {
        return new SummaryResponse(snapshot.identifier(), snapshot.narrative(), snapshot.narrativeGeneratedAt(),
                snapshot.narrative() != null);
    }
}
