package quest.gekko.insights.service.analytics;

import java.time.LocalDate;

public record TrendPoint(LocalDate date, long followers) {}
