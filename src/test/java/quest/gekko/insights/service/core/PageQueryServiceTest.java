package quest.gekko.insights.service.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.PersonRole;
import quest.gekko.insights.domain.Post;
import quest.gekko.insights.service.core.PageQueryService.PageFilter;
import quest.gekko.insights.service.error.PageNotFoundException;
import quest.gekko.insights.web.dto.CompanyPageDTO;
import quest.gekko.insights.web.dto.PageDetailDTO;
import quest.gekko.insights.web.dto.PagedResponse;
import quest.gekko.insights.web.dto.PersonDTO;
import quest.gekko.insights.web.dto.PostDTO;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({ JpaPageStore.class, PageQueryService.class })
class PageQueryServiceTest {
    private static final Instant BASE = Instant.parse("2026-02-01T10:00:00Z");

    @Autowired
    private JpaPageStore store;

    @Autowired
    private PageQueryService queryService;

    @BeforeEach
    void seed() {
        store.upsertPage(page("acme", "Acme", "Manufacturing", 500_000, BASE), posts("acme"),
                List.of(JpaPageStoreTest.person("grace_lee_0", PersonRole.FOLLOWER),
                        JpaPageStoreTest.person("sam_chen_0", PersonRole.EMPLOYEE)));
        store.upsertPage(page("globex", "Globex Corporation", "Information Technology", 2_000_000, BASE.plus(Duration.ofDays(1))),
                List.of(), List.of());
        store.upsertPage(page("initech", "Initech", "Information Technology Services", 40_000, BASE.plus(Duration.ofDays(2))),
                List.of(), List.of());
    }

    @Nested
    @DisplayName("listing pages")
    class ListPages {

        @Test
        void shouldListNewestFirstWithPaginationMetadata() {
            PagedResponse<CompanyPageDTO> response = queryService.listPages(PageFilter.none(), 1, 2);

            assertThat(response.total()).isEqualTo(3);
            assertThat(response.pages()).isEqualTo(2);
            assertThat(response.page()).isEqualTo(1);
            assertThat(response.perPage()).isEqualTo(2);
            assertThat(response.items()).extracting(CompanyPageDTO::pageId).containsExactly("initech", "globex");
        }

        @Test
        void shouldFilterByFollowerRange() {
            PagedResponse<CompanyPageDTO> response =
                    queryService.listPages(new PageFilter(100_000L, 1_000_000L, null, null), 1, 10);

            assertThat(response.items()).extracting(CompanyPageDTO::pageId).containsExactly("acme");
        }

        @Test
        void shouldMatchIndustryAndNamePartiallyIgnoringCase() {
            assertThat(queryService.listPages(new PageFilter(null, null, "information technology", null), 1, 10).items())
                    .extracting(CompanyPageDTO::pageId).containsExactly("initech", "globex");
            assertThat(queryService.listPages(new PageFilter(null, null, null, "GLOB"), 1, 10).items())
                    .extracting(CompanyPageDTO::pageId).containsExactly("globex");
        }

        @Test
        void shouldRejectOutOfBoundsPaging() {
            assertThatThrownBy(() -> queryService.listPages(PageFilter.none(), 0, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> queryService.listPages(PageFilter.none(), 1, 101))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> queryService.listPages(new PageFilter(10L, 5L, null, null), 1, 10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    void shouldEmbedOnlyTheRequestedCollections() {
        PageDetailDTO detail = queryService.getPageDetail("acme", true, false, true);

        assertThat(detail.page().name()).isEqualTo("Acme");
        assertThat(detail.posts()).hasSize(PageQueryService.DETAIL_POSTS);
        assertThat(detail.posts().get(0).postId()).isEqualTo("post_acme_0");
        assertThat(detail.followers()).isNull();
        assertThat(detail.employees()).extracting(PersonDTO::username).containsExactly("sam_chen_0");
    }

    @Test
    void shouldSortPostsByLikesWhenAskedForPopular() {
        PagedResponse<PostDTO> response = queryService.listPosts("acme", 1, 5, PostSort.POPULAR);

        assertThat(response.total()).isEqualTo(20);
        assertThat(response.pages()).isEqualTo(4);
        assertThat(response.items()).extracting(PostDTO::likesCount).isSortedAccordingTo((a, b) -> Long.compare(b, a));
        assertThat(response.items().get(0).likesCount()).isEqualTo(1_019L);
    }

    @Test
    void shouldPageThroughPeopleOfOneRole() {
        PagedResponse<PersonDTO> followers = queryService.listPeople("acme", PersonRole.FOLLOWER, 1, 20);

        assertThat(followers.items()).extracting(PersonDTO::username).containsExactly("grace_lee_0");
    }

    @Test
    void shouldRejectQueriesForUnknownPages() {
        assertThatThrownBy(() -> queryService.listPosts("nobody", 1, 10, PostSort.RECENT))
                .isInstanceOf(PageNotFoundException.class);
        assertThatThrownBy(() -> queryService.listPeople("nobody", PersonRole.EMPLOYEE, 1, 10))
                .isInstanceOf(PageNotFoundException.class);
        assertThatThrownBy(() -> queryService.getPageDetail("nobody", true, false, false))
                .isInstanceOf(PageNotFoundException.class);
    }

    private static CompanyPage page(String identifier, String name, String industry, long followers, Instant at) {
        CompanyPage page = JpaPageStoreTest.page(followers, at);
        page.setIdentifier(identifier);
        page.setName(name);
        page.setUrl("https://www.linkedin.com/company/" + identifier);
        page.setIndustry(industry);
        return page;
    }

    // post_acme_0 is the newest, likes grow with the index
    private static List<Post> posts(String identifier) {
        List<Post> posts = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            Post post = JpaPageStoreTest.post("post_" + identifier + "_" + i, BASE.minus(Duration.ofDays(i + 1)));
            post.setLikesCount(1_000 + i);
            posts.add(post);
        }
        return posts;
    }
}
