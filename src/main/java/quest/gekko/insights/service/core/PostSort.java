package quest.gekko.insights.service.core;

import org.springframework.data.domain.Sort;

import java.util.Locale;

public enum PostSort {
    RECENT(Sort.by(Sort.Order.desc("postedAt"))),
    POPULAR(Sort.by(Sort.Order.desc("likesCount"), Sort.Order.desc("postedAt"))),
    ENGAGEMENT(Sort.by(Sort.Order.desc("engagementRate"), Sort.Order.desc("postedAt")));

    private final Sort sort;

    PostSort(Sort sort) {
        this.sort = sort;
    }

    public Sort sort() {
        return sort;
    }

    public static PostSort parse(String value) {
        if (value == null || value.isBlank()) return RECENT;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("sort_by must be one of recent, popular, engagement; got '" + value + "'");
        }
    }
}
