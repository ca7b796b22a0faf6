package quest.gekko.insights.service.integration.connector;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import quest.gekko.insights.config.InsightsProperties;
import quest.gekko.insights.service.synthesis.PageFacts;
import quest.gekko.insights.util.PageIdentifiers;
import quest.gekko.insights.util.RateLimiter;

import java.util.List;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class LinkedInPageConnector implements LivePageConnector {
    private final WebClient http;
    private final RateLimiter rateLimiter;
    private final HtmlPageParser parser;
    private final InsightsProperties.Live live;

    @Override
    public Optional<PageFacts> fetch(String identifier) {
        if (!live.enabled()) return Optional.empty();
        if (identifier == null || identifier.isBlank()) return Optional.empty();

        String canonical = PageIdentifiers.canonicalUrl(identifier);
        for (String path : candidatePaths(identifier)) {
            Optional<String> html = download(path);
            if (html.isEmpty()) continue;

            Optional<PageFacts> facts = parser.parse(html.get(), identifier, canonical, live.minHtmlLength())
                    .filter(f -> f.followers() > 0);
            if (facts.isPresent()) {
                log.info("Live facts for {} from {}: {} followers, {} employees",
                        identifier, path, facts.get().followers(), facts.get().employees());
                return facts;
            }
        }
        log.info("No usable live page for {}", identifier);
        return Optional.empty();
    }

    @Override
    public List<LivePost> fetchPosts(String identifier, int limit) {
        if (!live.enabled() || identifier == null || identifier.isBlank()) return List.of();

        List<LivePost> posts = download("/company/" + identifier + "/posts")
                .map(html -> parser.parsePosts(html, limit))
                .orElse(List.of());
        log.info("Live posts for {}: {}", identifier, posts.size());
        return posts;
    }

    @Override
    public List<LivePerson> fetchEmployees(String identifier, int limit) {
        if (!live.enabled() || identifier == null || identifier.isBlank()) return List.of();

        List<LivePerson> employees = download("/company/" + identifier + "/people")
                .map(html -> parser.parseEmployees(html, limit))
                .orElse(List.of());
        log.info("Live employees for {}: {}", identifier, employees.size());
        return employees;
    }

    // about page first, then the main page, then the legacy /companies/ form
    private static List<String> candidatePaths(String identifier) {
        return List.of(
                "/company/" + identifier + "/about",
                "/company/" + identifier,
                "/companies/" + identifier
        );
    }

    private Optional<String> download(String path) {
        try {
            String body = rateLimiter.call(() -> http.get()
                    .uri(live.baseUrl() + path)
                    .header(HttpHeaders.USER_AGENT, live.userAgent())
                    .header(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header(HttpHeaders.ACCEPT_LANGUAGE, "en-US,en;q=0.9")
                    .retrieve()
                    .bodyToMono(String.class)
                    .block());
            return Optional.ofNullable(body);
        } catch (WebClientException e) {
            log.debug("Fetching {} failed: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
