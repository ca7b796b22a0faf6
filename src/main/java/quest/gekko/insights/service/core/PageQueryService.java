package quest.gekko.insights.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insights.config.CacheConfig;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.PersonRole;
import quest.gekko.insights.repository.CompanyPageRepository;
import quest.gekko.insights.repository.PersonProfileRepository;
import quest.gekko.insights.repository.PostRepository;
import quest.gekko.insights.service.error.PageNotFoundException;
import quest.gekko.insights.web.dto.CompanyPageDTO;
import quest.gekko.insights.web.dto.PageDetailDTO;
import quest.gekko.insights.web.dto.PagedResponse;
import quest.gekko.insights.web.dto.PersonDTO;
import quest.gekko.insights.web.dto.PostDTO;

import java.util.List;

/**
 * Read side of the API. Entities are mapped to DTOs inside the transaction so lazy associations never
 * leak out of it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class PageQueryService {
    public static final int MAX_PAGES_PER_PAGE = 100;
    public static final int MAX_ITEMS_PER_PAGE = 50;
    public static final int DETAIL_POSTS = 15;

    private final CompanyPageRepository pageRepository;
    private final PostRepository postRepository;
    private final PersonProfileRepository personRepository;

    public PagedResponse<CompanyPageDTO> listPages(PageFilter filter, int page, int perPage) {
        checkPaging(page, perPage, MAX_PAGES_PER_PAGE);
        if (filter.minFollowers() != null && filter.maxFollowers() != null && filter.minFollowers() > filter.maxFollowers()) {
            throw new IllegalArgumentException("min_followers must not exceed max_followers");
        }

        Specification<CompanyPage> spec = Specification
                .where(CompanyPageRepository.minFollowers(filter.minFollowers()))
                .and(CompanyPageRepository.maxFollowers(filter.maxFollowers()))
                .and(CompanyPageRepository.industryContains(filter.industry()))
                .and(CompanyPageRepository.nameContains(filter.name()));

        PageRequest request = PageRequest.of(page - 1, perPage, Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")));
        return PagedResponse.from(pageRepository.findAll(spec, request), CompanyPageDTO::from);
    }

    public boolean exists(String identifier) {
        return pageRepository.existsByIdentifier(identifier);
    }

    @Cacheable(cacheNames = CacheConfig.PAGE_DETAILS,
            key = "#identifier + ':' + #includePosts + ':' + #includeFollowers + ':' + #includeEmployees")
    public PageDetailDTO getPageDetail(String identifier, boolean includePosts, boolean includeFollowers,
                                       boolean includeEmployees) {
        CompanyPage page = pageRepository.findByIdentifier(identifier)
                .orElseThrow(() -> new PageNotFoundException(identifier));
        log.debug("Loading detail for {} (posts={}, followers={}, employees={})",
                identifier, includePosts, includeFollowers, includeEmployees);

        List<PostDTO> posts = includePosts
                ? postRepository.findByPage_Identifier(identifier, PageRequest.of(0, DETAIL_POSTS, PostSort.RECENT.sort()))
                        .map(PostDTO::from).getContent()
                : null;
        List<PersonDTO> followers = includeFollowers ? people(identifier, PersonRole.FOLLOWER) : null;
        List<PersonDTO> employees = includeEmployees ? people(identifier, PersonRole.EMPLOYEE) : null;

        return new PageDetailDTO(CompanyPageDTO.from(page), posts, followers, employees);
    }

    public PagedResponse<PostDTO> listPosts(String identifier, int page, int perPage, PostSort sort) {
        checkPaging(page, perPage, MAX_ITEMS_PER_PAGE);
        requireExists(identifier);
        return PagedResponse.from(
                postRepository.findByPage_Identifier(identifier, PageRequest.of(page - 1, perPage, sort.sort())),
                PostDTO::from);
    }

    public PagedResponse<PersonDTO> listPeople(String identifier, PersonRole role, int page, int perPage) {
        checkPaging(page, perPage, MAX_ITEMS_PER_PAGE);
        requireExists(identifier);
        return PagedResponse.from(
                personRepository.findByPage_IdentifierAndRole(identifier, role, PageRequest.of(page - 1, perPage, Sort.by("id"))),
                PersonDTO::from);
    }

    private List<PersonDTO> people(String identifier, PersonRole role) {
        return personRepository.findByPage_IdentifierAndRoleOrderByIdAsc(identifier, role).stream()
                .map(PersonDTO::from)
                .toList();
    }

    private void requireExists(String identifier) {
        if (!pageRepository.existsByIdentifier(identifier)) throw new PageNotFoundException(identifier);
    }

    private static void checkPaging(int page, int perPage, int maxPerPage) {
        if (page < 1) throw new IllegalArgumentException("page must be at least 1");
        if (perPage < 1 || perPage > maxPerPage) {
            throw new IllegalArgumentException("per_page must be between 1 and " + maxPerPage);
        }
    }

    public record PageFilter(Long minFollowers, Long maxFollowers, String industry, String name) {
        public static PageFilter none() {
            return new PageFilter(null, null, null, null);
        }
    }
}
