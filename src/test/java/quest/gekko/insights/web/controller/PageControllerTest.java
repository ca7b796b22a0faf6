package quest.gekko.insights.web.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import quest.gekko.insights.domain.AcquisitionSource;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.PersonRole;
import quest.gekko.insights.service.acquisition.AcquisitionOrchestrator;
import quest.gekko.insights.service.acquisition.AcquisitionOutcome;
import quest.gekko.insights.service.acquisition.AcquisitionRequest;
import quest.gekko.insights.service.acquisition.AcquisitionState;
import quest.gekko.insights.service.analytics.AnalyticsSnapshot;
import quest.gekko.insights.service.analytics.PostHighlight;
import quest.gekko.insights.service.analytics.TrendPoint;
import quest.gekko.insights.service.core.AnalyticsService;
import quest.gekko.insights.service.core.PageQueryService;
import quest.gekko.insights.service.core.PostSort;
import quest.gekko.insights.service.error.AcquisitionFailedException;
import quest.gekko.insights.service.error.PageNotFoundException;
import quest.gekko.insights.service.error.StorageFailureException;
import quest.gekko.insights.web.dto.CompanyPageDTO;
import quest.gekko.insights.web.dto.PageDetailDTO;
import quest.gekko.insights.web.dto.PagedResponse;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PageController.class)
class PageControllerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private PageQueryService queryService;

    @MockBean
    private AcquisitionOrchestrator orchestrator;

    @MockBean
    private AnalyticsService analyticsService;

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void shouldListPagesWithSnakeCaseMetadata() throws Exception {
            when(queryService.listPages(any(), eq(1), eq(10)))
                    .thenReturn(new PagedResponse<>(1, 1, 10, 1, List.of(CompanyPageDTO.from(page()))));

            mvc.perform(get("/api/pages").param("industry", "manufacturing"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total").value(1))
                    .andExpect(jsonPath("$.per_page").value(10))
                    .andExpect(jsonPath("$.items[0].page_id").value("acme"))
                    .andExpect(jsonPath("$.items[0].followers_count").value(500000));
        }

        @Test
        void shouldAcquireUnknownPagesOnDemand() throws Exception {
            when(queryService.exists("acme")).thenReturn(false);
            when(queryService.getPageDetail("acme", true, false, false))
                    .thenReturn(new PageDetailDTO(CompanyPageDTO.from(page()), List.of(), null, null));

            mvc.perform(get("/api/pages/{id}", "Acme"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.page.name").value("Acme"))
                    .andExpect(jsonPath("$.followers").doesNotExist());

            verify(orchestrator).acquireIfAbsent("acme", 1);
        }

        @Test
        void shouldServeStoredPagesWithoutAcquiring() throws Exception {
            when(queryService.exists("acme")).thenReturn(true);
            when(queryService.getPageDetail("acme", false, true, true))
                    .thenReturn(new PageDetailDTO(CompanyPageDTO.from(page()), null, List.of(), List.of()));

            mvc.perform(get("/api/pages/acme")
                            .param("include_posts", "false")
                            .param("include_followers", "true")
                            .param("include_employees", "true"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.followers").isArray());

            verify(orchestrator, never()).acquireIfAbsent(anyString(), anyInt());
        }

        @Test
        void shouldPassTheRequestedPostOrdering() throws Exception {
            when(queryService.listPosts("acme", 2, 5, PostSort.ENGAGEMENT))
                    .thenReturn(new PagedResponse<>(12, 2, 5, 3, List.of()));

            mvc.perform(get("/api/pages/acme/posts")
                            .param("page", "2")
                            .param("per_page", "5")
                            .param("sort_by", "engagement"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.pages").value(3));
        }

        @Test
        void shouldListEmployees() throws Exception {
            when(queryService.listPeople("acme", PersonRole.EMPLOYEE, 1, 20))
                    .thenReturn(new PagedResponse<>(0, 1, 20, 0, List.of()));

            mvc.perform(get("/api/pages/acme/employees")).andExpect(status().isOk());
        }

        @Test
        void shouldReturnAnalytics() throws Exception {
            when(analyticsService.getAnalytics("acme")).thenReturn(new AnalyticsSnapshot("acme", 15, 0.21,
                    new PostHighlight("post_acme_3", "Milestone moment", 0.4, NOW),
                    List.of(new TrendPoint(LocalDate.of(2026, 3, 1), 500_000)),
                    List.of("Manufacturing", "Information Technology", "Human Resources"), null, null, NOW));

            mvc.perform(get("/api/pages/acme/analytics"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.total_posts_analyzed").value(15))
                    .andExpect(jsonPath("$.average_engagement").value(0.21))
                    .andExpect(jsonPath("$.most_engaged_post.post_identifier").value("post_acme_3"))
                    .andExpect(jsonPath("$.follower_trend[0].date").value("2026-03-01"))
                    .andExpect(jsonPath("$.narrative").doesNotExist());
        }
    }

    @Nested
    @DisplayName("acquisition")
    class Acquisition {

        @Test
        void shouldAcquireWithTheRequestedDepthAndComments() throws Exception {
            AcquisitionRequest expected = new AcquisitionRequest("acme", 3, true);
            when(orchestrator.acquire(expected)).thenReturn(
                    new AcquisitionOutcome(page(), AcquisitionSource.SYNTHETIC, AcquisitionState.PERSISTED, 15, 33));

            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"depth\": 3, \"include_comments\": true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("success"))
                    .andExpect(jsonPath("$.source").value("SYNTHETIC"))
                    .andExpect(jsonPath("$.people_stored").value(33))
                    .andExpect(jsonPath("$.page.page_id").value("acme"));
        }

        @Test
        void shouldPassTheCallersLiveTimeout() throws Exception {
            AcquisitionRequest expected = new AcquisitionRequest("acme", 2, false, Duration.ofSeconds(5));
            when(orchestrator.acquire(expected)).thenReturn(
                    new AcquisitionOutcome(page(), AcquisitionSource.SYNTHETIC, AcquisitionState.PERSISTED, 15, 0));

            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"depth\": 2, \"live_timeout_seconds\": 5}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.posts_stored").value(15));
        }

        @Test
        void shouldRejectANonPositiveLiveTimeout() throws Exception {
            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"live_timeout_seconds\": 0}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));

            verify(orchestrator, never()).acquire(any(AcquisitionRequest.class));
        }

        @Test
        void shouldDefaultToDepthOne() throws Exception {
            when(orchestrator.acquire(new AcquisitionRequest("acme", 1, false))).thenReturn(
                    new AcquisitionOutcome(page(), AcquisitionSource.LIVE, AcquisitionState.PERSISTED, 0, 0));

            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.source").value("LIVE"));
        }

        @Test
        void shouldReturnTheGeneratedSummary() throws Exception {
            when(analyticsService.refreshNarrative("acme")).thenReturn(new AnalyticsSnapshot("acme", 0, 0.0, null,
                    List.of(), List.of("Technology"), "Acme is a steady manufacturer.", NOW, NOW));

            mvc.perform(post("/api/pages/acme/generate-summary"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.summary").value("Acme is a steady manufacturer."))
                    .andExpect(jsonPath("$.generated").value(true));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        void shouldRejectMissingPageIds() throws Exception {
            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"depth\": 2}"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"))
                    .andExpect(jsonPath("$.path").value("/api/pages/scrape"));
        }

        @Test
        void shouldRejectDepthAboveThree() throws Exception {
            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"depth\": 5}"))
                    .andExpect(status().isBadRequest());
            verify(orchestrator, never()).acquire(any(AcquisitionRequest.class));
        }

        @Test
        void shouldRejectMalformedIdentifiers() throws Exception {
            mvc.perform(get("/api/pages/{id}/analytics", "not a slug!"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.kind").value("INVALID_ARGUMENT"));
        }

        @Test
        void shouldRejectUnknownSortOrders() throws Exception {
            mvc.perform(get("/api/pages/acme/posts").param("sort_by", "trending"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.message").value(containsString("sort_by")));
        }

        @Test
        void shouldRejectNonNumericPaging() throws Exception {
            mvc.perform(get("/api/pages").param("page", "first"))
                    .andExpect(status().isBadRequest());
        }

        @Test
        void shouldMapUnknownPagesToNotFound() throws Exception {
            when(analyticsService.getAnalytics("nobody")).thenThrow(new PageNotFoundException("nobody"));

            mvc.perform(get("/api/pages/nobody/analytics"))
                    .andExpect(status().isNotFound())
                    .andExpect(jsonPath("$.kind").value("NOT_FOUND"))
                    .andExpect(jsonPath("$.status").value(404))
                    .andExpect(jsonPath("$.timestamp").exists());
        }

        @Test
        void shouldMapAcquisitionFailuresToBadGateway() throws Exception {
            when(orchestrator.acquire(any(AcquisitionRequest.class)))
                    .thenThrow(new AcquisitionFailedException("acme", new IllegalStateException("no template")));

            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"depth\": 2}"))
                    .andExpect(status().isBadGateway())
                    .andExpect(jsonPath("$.kind").value("ACQUISITION_FAILED"));
        }

        @Test
        void shouldMapTransientStorageFailuresToServiceUnavailable() throws Exception {
            when(orchestrator.acquire(any(AcquisitionRequest.class)))
                    .thenThrow(new StorageFailureException("busy", new RuntimeException("lock"), true));

            mvc.perform(post("/api/pages/scrape")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"page_id\": \"acme\", \"depth\": 2}"))
                    .andExpect(status().isServiceUnavailable())
                    .andExpect(jsonPath("$.kind").value("TRANSIENT_FAILURE"));
        }

        @Test
        void shouldHideDetailsOfUnexpectedErrors() throws Exception {
            when(analyticsService.getAnalytics("acme")).thenThrow(new NullPointerException("secret internals"));

            mvc.perform(get("/api/pages/acme/analytics"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.kind").value("INTERNAL"))
                    .andExpect(jsonPath("$.message").value("An unexpected error occurred"));
        }
    }

    private static CompanyPage page() {
        CompanyPage page = new CompanyPage();
        page.setId(1L);
        page.setIdentifier("acme");
        page.setName("Acme");
        page.setUrl("https://www.linkedin.com/company/acme");
        page.setFollowersCount(500_000);
        page.setSource(AcquisitionSource.SYNTHETIC);
        page.setLastDepth(2);
        page.setCreatedAt(NOW);
        page.setUpdatedAt(NOW);
        page.setLastAcquiredAt(NOW);
        return page;
    }
}
