package quest.gekko.insights.service.acquisition;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import quest.gekko.insights.config.InsightsProperties;
import quest.gekko.insights.domain.AcquisitionSource;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.PersonRole;
import quest.gekko.insights.domain.Post;
import quest.gekko.insights.service.core.AnalyticsService;
import quest.gekko.insights.service.core.PageStore;
import quest.gekko.insights.service.error.AcquisitionFailedException;
import quest.gekko.insights.service.error.AcquisitionTimeoutException;
import quest.gekko.insights.service.error.StorageFailureException;
import quest.gekko.insights.service.integration.connector.LivePageConnector;
import quest.gekko.insights.service.integration.connector.LivePerson;
import quest.gekko.insights.service.integration.connector.LivePost;
import quest.gekko.insights.service.synthesis.Engagement;
import quest.gekko.insights.service.synthesis.EngagementRate;
import quest.gekko.insights.service.synthesis.EngagementSynthesizer;
import quest.gekko.insights.service.synthesis.FallbackPageFacts;
import quest.gekko.insights.service.synthesis.PageFacts;
import quest.gekko.insights.service.synthesis.SyntheticContentGenerator;
import quest.gekko.insights.service.synthesis.Tier;
import quest.gekko.insights.service.synthesis.TierClassifier;
import quest.gekko.insights.util.PageIdentifiers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Acquires a page: tries the live connector within a time budget, falls back to synthetic facts,
 * takes the depth-appropriate posts and people from the live result or synthesizes them, and stores
 * everything in one upsert.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AcquisitionOrchestrator {
    private final LivePageConnector liveConnector;
    private final FallbackPageFacts fallbackFacts;
    private final TierClassifier tierClassifier;
    private final SyntheticContentGenerator contentGenerator;
    private final EngagementSynthesizer engagementSynthesizer;
    private final PageStore pageStore;
    private final AnalyticsService analyticsService;
    private final IdentifierLocks locks;
    private final ExecutorService liveFetchExecutor;
    private final InsightsProperties.Acquisition acquisition;
    private final InsightsProperties.Generation generation;
    private final Clock clock;

    public CompanyPage acquire(String identifier, int depth) {
        return acquire(AcquisitionRequest.of(identifier, depth)).page();
    }

    public AcquisitionOutcome acquire(AcquisitionRequest request) {
        String identifier = validate(request);
        log.info("Acquisition {} for {} at depth {}", AcquisitionState.REQUESTED, identifier, request.depth());

        LiveCapture capture = capture(identifier, request);
        AcquisitionOutcome outcome = locks.withLock(identifier, () -> generateAndStore(identifier, request, capture));

        if (request.includesPeople()) {
            warmAnalytics(identifier);
        }
        return outcome;
    }

    /**
     * Returns the stored page, acquiring it first when it has never been stored. The check is repeated
     * under the page lock, so a page stored by a concurrent acquisition is returned untouched.
     */
    public CompanyPage acquireIfAbsent(String identifier, int depth) {
        AcquisitionRequest request = AcquisitionRequest.of(identifier, depth);
        String normalized = validate(request);
        Optional<CompanyPage> stored = pageStore.findPage(normalized);
        if (stored.isPresent()) return stored.get();

        log.info("Acquisition {} for {} at depth {} (not stored yet)", AcquisitionState.REQUESTED, normalized, depth);
        LiveCapture capture = capture(normalized, request);
        CompanyPage page = locks.withLock(normalized, () -> pageStore.findPage(normalized)
                .map(existing -> {
                    log.debug("Page {} was stored concurrently, keeping it", normalized);
                    return existing;
                })
                .orElseGet(() -> generateAndStore(normalized, request, capture).page()));

        if (request.includesPeople()) {
            warmAnalytics(normalized);
        }
        return page;
    }

    private String validate(AcquisitionRequest request) {
        if (request.depth() < AcquisitionRequest.MIN_DEPTH || request.depth() > AcquisitionRequest.MAX_DEPTH) {
            throw new IllegalArgumentException("Depth must be between 1 and 3, got " + request.depth());
        }
        if (request.liveTimeout() != null && (request.liveTimeout().isNegative() || request.liveTimeout().isZero())) {
            throw new IllegalArgumentException("Live timeout must be positive, got " + request.liveTimeout());
        }
        return PageIdentifiers.normalize(request.identifier());
    }

    private LiveCapture capture(String identifier, AcquisitionRequest request) {
        log.debug("Acquisition {} for {}", AcquisitionState.ACQUIRING, identifier);
        Optional<LiveCapture> live = fetchLiveWithinBudget(identifier, request);
        PageFacts defaults = fallbackFacts.forIdentifier(identifier);

        LiveCapture capture = live
                .map(c -> new LiveCapture(c.facts().orElse(defaults), c.posts(), c.employees(), AcquisitionSource.LIVE))
                .orElseGet(() -> new LiveCapture(defaults, List.of(), List.of(), AcquisitionSource.SYNTHETIC));
        AcquisitionState acquired = live.isPresent() ? AcquisitionState.ACQUIRED_LIVE : AcquisitionState.ACQUIRED_SYNTHETIC;
        log.info("Acquisition {} for {} ({} followers)", acquired, identifier, capture.facts().followers());
        return capture;
    }

    private AcquisitionOutcome generateAndStore(String identifier, AcquisitionRequest request, LiveCapture capture) {
        Instant now = clock.instant();
        PageFacts facts = capture.facts();
        CompanyPage page;
        List<Post> posts;
        List<PersonProfile> people;
        try {
            page = toPage(identifier, facts, capture.source(), request.depth(), now);
            posts = request.includesPosts() ? posts(identifier, capture, request.includeComments(), now) : List.of();
            people = request.includesPeople() ? people(capture) : List.of();
        } catch (RuntimeException e) {
            log.error("Acquisition {} for {}: synthesis failed", AcquisitionState.FAILED, identifier, e);
            throw new AcquisitionFailedException(identifier, e);
        }

        CompanyPage stored;
        try {
            stored = pageStore.upsertPage(page, posts, people);
        } catch (TransientDataAccessException e) {
            throw new StorageFailureException("Transient storage failure for page '" + identifier + "'", e, true);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Storage failure for page '" + identifier + "'", e, false);
        }
        analyticsService.invalidate(identifier);

        log.info("Acquisition {} for {}: {} posts, {} people ({})",
                AcquisitionState.PERSISTED, identifier, posts.size(), people.size(), capture.source());
        return new AcquisitionOutcome(stored, capture.source(), AcquisitionState.PERSISTED, posts.size(), people.size());
    }

    private Optional<LiveCapture> fetchLiveWithinBudget(String identifier, AcquisitionRequest request) {
        try {
            return fetchLive(identifier, request);
        } catch (AcquisitionTimeoutException e) {
            log.warn("{}; using synthetic data", e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Live acquisition failed for {}: {}; using synthetic data", identifier, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<LiveCapture> fetchLive(String identifier, AcquisitionRequest request) {
        Duration timeout = request.liveTimeoutOr(acquisition.liveTimeout());
        Future<Optional<LiveCapture>> future = liveFetchExecutor.submit(() -> liveCapture(identifier, request));
        try {
            Optional<LiveCapture> capture = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return capture == null ? Optional.empty() : capture;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AcquisitionTimeoutException(identifier, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException(cause.getMessage(), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for live acquisition", e);
        }
    }

    // runs on the live fetch pool; posts and employees are only read once the page itself was readable
    private Optional<LiveCapture> liveCapture(String identifier, AcquisitionRequest request) {
        Optional<PageFacts> facts = liveConnector.fetch(identifier);
        if (facts == null || facts.isEmpty() || facts.get().followers() <= 0) return Optional.empty();

        List<LivePost> posts = request.includesPosts()
                ? nullToEmpty(liveConnector.fetchPosts(identifier, generation.posts())) : List.of();
        List<LivePerson> employees = request.includesPeople()
                ? nullToEmpty(liveConnector.fetchEmployees(identifier, generation.maxEmployees())) : List.of();
        return Optional.of(new LiveCapture(facts.get(), posts, employees, AcquisitionSource.LIVE));
    }

    private CompanyPage toPage(String identifier, PageFacts facts, AcquisitionSource source, int depth, Instant now) {
        if (facts.followers() < 0 || facts.employees() < 0) {
            throw new IllegalStateException("Negative counts in page facts for " + identifier);
        }
        CompanyPage page = new CompanyPage();
        page.setIdentifier(identifier);
        page.setName(facts.name());
        page.setUrl(facts.url() != null ? facts.url() : PageIdentifiers.canonicalUrl(identifier));
        page.setDescription(facts.description());
        page.setProfilePictureUrl(facts.profilePictureUrl());
        page.setWebsite(facts.website());
        page.setIndustry(facts.industry());
        page.setCompanySize(facts.companySize());
        page.setHeadquarters(facts.headquarters());
        page.setFoundedYear(facts.foundedYear());
        page.setSpecialties(new ArrayList<>(facts.specialties()));
        page.setFollowersCount(facts.followers());
        page.setEmployeesCount(facts.employees());
        page.setSource(source);
        page.setLastDepth(depth);
        page.setCreatedAt(now);
        page.setUpdatedAt(now);
        page.setLastAcquiredAt(now);
        return page;
    }

    private List<Post> posts(String identifier, LiveCapture capture, boolean withComments, Instant now) {
        if (capture.posts().isEmpty()) {
            return synthesizePosts(identifier, capture.facts(), withComments, now);
        }
        return livePosts(identifier, capture, withComments, now);
    }

    private List<Post> synthesizePosts(String identifier, PageFacts facts, boolean withComments, Instant now) {
        Tier tier = tierClassifier.classify(facts.followers());
        int count = generation.posts();
        List<String> bodies = contentGenerator.postBodies(facts, count);
        List<Instant> times = engagementSynthesizer.postingTimes(count, now);
        log.debug("Synthesizing {} posts for {} in tier {}", count, identifier, tier);

        List<Post> posts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Engagement engagement = engagementSynthesizer.synthesize(tier.ranges(), facts.followers());
            Post post = post(identifier, i, bodies.get(i), engagement, times.get(i));
            if (withComments) attachComments(post, now);
            posts.add(post);
        }
        return posts;
    }

    // live posts carry no timestamp; document order is newest first, so they are spaced a minute apart
    private List<Post> livePosts(String identifier, LiveCapture capture, boolean withComments, Instant now) {
        long followers = capture.facts().followers();
        List<LivePost> live = capture.posts().subList(0, Math.min(capture.posts().size(), generation.posts()));
        log.debug("Storing {} live posts for {}", live.size(), identifier);

        List<Post> posts = new ArrayList<>(live.size());
        for (int i = 0; i < live.size(); i++) {
            LivePost source = live.get(i);
            long views = Math.max(source.views(), source.likes());
            Engagement engagement = new Engagement(source.likes(), source.comments(), source.shares(), views,
                    EngagementRate.of(source.likes(), source.comments(), source.shares(), followers));
            Post post = post(identifier, i, source.content(), engagement, now.minus(Duration.ofMinutes(i)));
            post.setImageUrl(source.imageUrl());
            if (withComments) attachComments(post, now);
            posts.add(post);
        }
        return posts;
    }

    private static Post post(String identifier, int index, String content, Engagement engagement, Instant postedAt) {
        Post post = new Post();
        post.setPostIdentifier("post_" + identifier + "_" + index);
        post.setContent(content);
        post.setLikesCount(engagement.likes());
        post.setCommentsCount(engagement.comments());
        post.setSharesCount(engagement.shares());
        post.setViewsCount(engagement.views());
        post.setEngagementRate(engagement.engagementRate());
        post.setPostedAt(postedAt);
        return post;
    }

    private void attachComments(Post post, Instant now) {
        int sample = (int) Math.min(post.getCommentsCount(), generation.maxCommentsPerPost());
        contentGenerator.comments(sample, post.getPostedAt(), now).forEach(post::addComment);
    }

    private List<PersonProfile> people(LiveCapture capture) {
        PageFacts facts = capture.facts();
        List<PersonProfile> people = new ArrayList<>(contentGenerator.people(facts, PersonRole.FOLLOWER, generation.followers()));
        if (capture.employees().isEmpty()) {
            int employees = contentGenerator.employeeSampleSize(facts.employees(), generation.minEmployees(), generation.maxEmployees());
            people.addAll(contentGenerator.people(facts, PersonRole.EMPLOYEE, employees));
        } else {
            capture.employees().stream()
                    .limit(generation.maxEmployees())
                    .map(person -> employee(person, facts))
                    .forEach(people::add);
        }
        return people;
    }

    private static PersonProfile employee(LivePerson person, PageFacts facts) {
        PersonProfile profile = new PersonProfile();
        profile.setRole(PersonRole.EMPLOYEE);
        profile.setProfileIdentifier(person.profileIdentifier());
        profile.setFirstName(person.firstName());
        profile.setLastName(person.lastName());
        profile.setHeadline(person.headline());
        profile.setCurrentPosition(person.currentPosition());
        profile.setCurrentCompany(facts.name());
        return profile;
    }

    private void warmAnalytics(String identifier) {
        try {
            analyticsService.refreshNarrative(identifier);
        } catch (RuntimeException e) {
            log.warn("Could not precompute analytics for {}: {}", identifier, e.getMessage());
        }
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    private record LiveCapture(PageFacts facts, List<LivePost> posts, List<LivePerson> employees,
                               AcquisitionSource source) {}
}
