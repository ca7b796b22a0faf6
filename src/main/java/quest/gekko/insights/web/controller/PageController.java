package quest.gekko.insights.web.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.insights.domain.PersonRole;
import quest.gekko.insights.service.acquisition.AcquisitionOrchestrator;
import quest.gekko.insights.service.acquisition.AcquisitionOutcome;
import quest.gekko.insights.service.acquisition.AcquisitionRequest;
import quest.gekko.insights.service.analytics.AnalyticsSnapshot;
import quest.gekko.insights.service.core.AnalyticsService;
import quest.gekko.insights.service.core.PageQueryService;
import quest.gekko.insights.service.core.PageQueryService.PageFilter;
import quest.gekko.insights.service.core.PostSort;
import quest.gekko.insights.util.PageIdentifiers;
import quest.gekko.insights.web.dto.CompanyPageDTO;
import quest.gekko.insights.web.dto.PageDetailDTO;
import quest.gekko.insights.web.dto.PagedResponse;
import quest.gekko.insights.web.dto.PersonDTO;
import quest.gekko.insights.web.dto.PostDTO;
import quest.gekko.insights.web.dto.ScrapeRequest;
import quest.gekko.insights.web.dto.ScrapeResponse;
import quest.gekko.insights.web.dto.SummaryResponse;

@RestController
@RequestMapping("/api/pages")
@RequiredArgsConstructor
@Slf4j
public class PageController {
    private final PageQueryService queryService;
    private final AcquisitionOrchestrator orchestrator;
    private final AnalyticsService analyticsService;

    @GetMapping
    public PagedResponse<CompanyPageDTO> listPages(@RequestParam(defaultValue = "1") int page,
                                                   @RequestParam(name = "per_page", defaultValue = "10") int perPage,
                                                   @RequestParam(name = "min_followers", required = false) Long minFollowers,
                                                   @RequestParam(name = "max_followers", required = false) Long maxFollowers,
                                                   @RequestParam(required = false) String industry,
                                                   @RequestParam(required = false) String name) {
        return queryService.listPages(new PageFilter(minFollowers, maxFollowers, industry, name), page, perPage);
    }

    /** Returns a stored page; a page seen for the first time is acquired at depth 1 before it is returned. */
    @GetMapping("/{pageId}")
    public PageDetailDTO getPage(@PathVariable String pageId,
                                 @RequestParam(name = "include_posts", defaultValue = "true") boolean includePosts,
                                 @RequestParam(name = "include_followers", defaultValue = "false") boolean includeFollowers,
                                 @RequestParam(name = "include_employees", defaultValue = "false") boolean includeEmployees) {
        String identifier = PageIdentifiers.normalize(pageId);
        if (!queryService.exists(identifier)) {
            log.info("Page {} not stored yet, acquiring on demand", identifier);
            orchestrator.acquireIfAbsent(identifier, AcquisitionRequest.MIN_DEPTH);
        }
        return queryService.getPageDetail(identifier, includePosts, includeFollowers, includeEmployees);
    }

    @GetMapping("/{pageId}/posts")
    public PagedResponse<PostDTO> getPosts(@PathVariable String pageId,
                                           @RequestParam(defaultValue = "1") int page,
                                           @RequestParam(name = "per_page", defaultValue = "15") int perPage,
                                           @RequestParam(name = "sort_by", defaultValue = "recent") String sortBy) {
        return queryService.listPosts(PageIdentifiers.normalize(pageId), page, perPage, PostSort.parse(sortBy));
    }

    @GetMapping("/{pageId}/followers")
    public PagedResponse<PersonDTO> getFollowers(@PathVariable String pageId,
                                                 @RequestParam(defaultValue = "1") int page,
                                                 @RequestParam(name = "per_page", defaultValue = "20") int perPage) {
        return queryService.listPeople(PageIdentifiers.normalize(pageId), PersonRole.FOLLOWER, page, perPage);
    }

    @GetMapping("/{pageId}/employees")
    public PagedResponse<PersonDTO> getEmployees(@PathVariable String pageId,
                                                 @RequestParam(defaultValue = "1") int page,
                                                 @RequestParam(name = "per_page", defaultValue = "20") int perPage) {
        return queryService.listPeople(PageIdentifiers.normalize(pageId), PersonRole.EMPLOYEE, page, perPage);
    }

    @GetMapping("/{pageId}/analytics")
    public AnalyticsSnapshot getAnalytics(@PathVariable String pageId) {
        return analyticsService.getAnalytics(PageIdentifiers.normalize(pageId));
    }

    @PostMapping("/scrape")
    public ScrapeResponse scrape(@Valid @RequestBody ScrapeRequest request) {
        AcquisitionOutcome outcome = orchestrator.acquire(
                new AcquisitionRequest(request.pageId(), request.depthOrDefault(), request.includeCommentsOrDefault(),
                        request.liveTimeout()));
        return ScrapeResponse.from(outcome);
    }

    @PostMapping("/{pageId}/generate-summary")
    public SummaryResponse generateSummary(@PathVariable String pageId) {
        return SummaryResponse.from(analyticsService.refreshNarrative(PageIdentifiers.normalize(pageId)));
    }
}
