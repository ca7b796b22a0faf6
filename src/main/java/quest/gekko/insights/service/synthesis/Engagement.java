package quest.gekko.insights.service.synthesis;

public record Engagement(long likes, long comments, long shares, long views, double engagementRate) {}
