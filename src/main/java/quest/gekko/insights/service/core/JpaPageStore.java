package quest.gekko.insights.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insights.config.CacheConfig;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.FollowerSample;
import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.Post;
import quest.gekko.insights.repository.CompanyPageRepository;
import quest.gekko.insights.repository.FollowerSampleRepository;
import quest.gekko.insights.repository.PersonProfileRepository;
import quest.gekko.insights.repository.PostRepository;
import quest.gekko.insights.service.error.PageNotFoundException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaPageStore implements PageStore {
    private final CompanyPageRepository pageRepository;
    private final PostRepository postRepository;
    private final PersonProfileRepository personRepository;
    private final FollowerSampleRepository sampleRepository;

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.PAGE_DETAILS, allEntries = true)
    public CompanyPage upsertPage(CompanyPage page, List<Post> posts, List<PersonProfile> people) {
        CompanyPage saved = pageRepository.findByIdentifier(page.getIdentifier())
                .map(existing -> updateExistingPage(existing, page))
                .orElseGet(() -> pageRepository.save(page));

        postRepository.deleteByPage(saved);
        personRepository.deleteByPage(saved);
        // deletes must hit the database before the replacements reuse their unique keys
        postRepository.flush();

        posts.forEach(post -> post.setPage(saved));
        people.forEach(person -> person.setPage(saved));
        postRepository.saveAll(posts);
        personRepository.saveAll(people);

        FollowerSample sample = new FollowerSample();
        sample.setPage(saved);
        sample.setSampledAt(saved.getLastAcquiredAt() != null ? saved.getLastAcquiredAt() : saved.getUpdatedAt());
        sample.setFollowers(saved.getFollowersCount());
        sample.setSource(saved.getSource());
        sampleRepository.save(sample);

        log.debug("Stored page {} with {} posts and {} people", saved.getIdentifier(), posts.size(), people.size());
        return saved;
    }

    @Override
    public Optional<CompanyPage> findPage(String identifier) {
        return pageRepository.findByIdentifier(identifier);
    }

    @Override
    public List<Post> getPostsFor(String identifier) {
        return postRepository.findByPage_IdentifierOrderByPostedAtDesc(identifier);
    }

    @Override
    public List<FollowerSample> getFollowerHistory(String identifier) {
        return sampleRepository.findByPage_IdentifierOrderBySampledAtAsc(identifier);
    }

    @Override
    @Transactional
    @CacheEvict(cacheNames = CacheConfig.PAGE_DETAILS, allEntries = true)
    public CompanyPage saveNarrative(String identifier, String narrative, Instant generatedAt) {
        CompanyPage page = pageRepository.findByIdentifier(identifier)
                .orElseThrow(() -> new PageNotFoundException(identifier));
        page.setNarrativeSummary(narrative);
        page.setNarrativeGeneratedAt(generatedAt);
        return pageRepository.save(page);
    }

    @Override
    public List<CompanyPage> findAllPages() {
        return pageRepository.findAll();
    }

    private CompanyPage updateExistingPage(CompanyPage existing, CompanyPage updated) {
        // identifier and createdAt stay as first stored
        existing.setName(updated.getName());
        existing.setUrl(updated.getUrl());
        existing.setDescription(updated.getDescription());
        existing.setProfilePictureUrl(updated.getProfilePictureUrl());
        existing.setWebsite(updated.getWebsite());
        existing.setIndustry(updated.getIndustry());
        existing.setCompanySize(updated.getCompanySize());
        existing.setHeadquarters(updated.getHeadquarters());
        existing.setFoundedYear(updated.getFoundedYear());
        existing.setSpecialties(updated.getSpecialties());
        existing.setFollowersCount(updated.getFollowersCount());
        existing.setEmployeesCount(updated.getEmployeesCount());
        existing.setSource(updated.getSource());
        existing.setLastDepth(updated.getLastDepth());
        existing.setUpdatedAt(updated.getUpdatedAt());
        existing.setLastAcquiredAt(updated.getLastAcquiredAt());
        return pageRepository.save(existing);
    }
}
