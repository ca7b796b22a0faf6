package quest.gekko.insights.service.integration.connector;

import quest.gekko.insights.service.synthesis.PageFacts;

import java.util.List;
import java.util.Optional;

public interface LivePageConnector {
    /**
     * Fetch the public facts of a page. Empty when the page could not be read (blocked, login wall,
     * connector disabled); network failures may also surface as exceptions.
     */
    Optional<PageFacts> fetch(String identifier);

    /** Most recent posts first, at most {@code limit}. Empty when the posts page could not be read. */
    default List<LivePost> fetchPosts(String identifier, int limit) {
        return List.of();
    }

    default List<LivePerson> fetchEmployees(String identifier, int limit) {
        return List.of();
    }
}
