package quest.gekko.insights.service.core;

import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.FollowerSample;
import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.Post;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence boundary for acquired pages. Each call is a single transaction.
 */
public interface PageStore {

    /**
     * Inserts or updates the page keyed by its identifier and replaces its posts and people with the
     * given ones. Also records a follower sample for this acquisition.
     */
    CompanyPage upsertPage(CompanyPage page, List<Post> posts, List<PersonProfile> people);

    Optional<CompanyPage> findPage(String identifier);

    /** Posts of the page, most recent first. */
    List<Post> getPostsFor(String identifier);

    /** One sample per acquisition, oldest first. */
    List<FollowerSample> getFollowerHistory(String identifier);

    CompanyPage saveNarrative(String identifier, String narrative, Instant generatedAt);

    List<CompanyPage> findAllPages();
}
