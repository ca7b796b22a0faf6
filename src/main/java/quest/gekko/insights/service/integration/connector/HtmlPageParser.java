package quest.gekko.insights.service.integration.connector;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;
import quest.gekko.insights.service.synthesis.PageFacts;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts page facts, posts and employee cards from the HTML of public company pages.
 */
@Component
@Slf4j
public class HtmlPageParser {
    private static final Pattern YEAR = Pattern.compile("(\\d{4})");
    private static final Pattern JSON_LD_COUNT = Pattern.compile("\"(?:interactionCount|followerCount|followers)\"\\s*:\\s*\"?([\\d.,]+[KMB]?)\"?", Pattern.CASE_INSENSITIVE);

    // full numbers first so "12,345 followers" is not read as "345"
    private static final List<Pattern> FOLLOWER_PATTERNS = List.of(
            Pattern.compile("(\\d{1,3}(?:,\\d{3})+)\\s*followers", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+(?:[.,]\\d+)?\\s*[KMB])\\s*followers", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s+followers", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern EMPLOYEE_RANGE = Pattern.compile("(\\d+(?:,\\d{3})*)\\s*-\\s*(\\d+(?:,\\d{3})*)\\s*employees", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> EMPLOYEE_PATTERNS = List.of(
            Pattern.compile("(\\d{1,3}(?:,\\d{3})+)\\s*employees", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+(?:[.,]\\d+)?\\s*[KMB])\\s*employees", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\"(?:numberOfEmployees|employees)\"\\s*:\\s*(\\d+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+)\\s+employees", Pattern.CASE_INSENSITIVE)
    );
    static final int MAX_POST_CONTENT = 500;
    static final int MAX_URL_LENGTH = 500;
    private static final Pattern LIKES = metric("likes?|reactions?");
    private static final Pattern COMMENTS = metric("comments?");
    private static final Pattern SHARES = metric("shares?|reposts?");
    private static final Pattern VIEWS = metric("views?|impressions?");

    /**
     * @return empty when the document is a login wall or too short to be a company page
     */
    public Optional<PageFacts> parse(String html, String identifier, String url, int minLength) {
        if (html == null || html.length() < minLength) return Optional.empty();

        Document doc = Jsoup.parse(html);
        Element h1 = doc.selectFirst("h1");
        String name = h1 != null ? h1.text().trim() : null;
        if (name == null || name.isBlank() || name.equalsIgnoreCase("Sign in")) {
            log.debug("No company heading in page for {}, probably a login wall", identifier);
            return Optional.empty();
        }

        String specialties = labelled(doc, "Specialties");
        return Optional.of(new PageFacts(
                identifier,
                name,
                url,
                meta(doc, "og:description"),
                meta(doc, "og:image"),
                labelled(doc, "Website"),
                labelled(doc, "Industry"),
                labelled(doc, "Company size"),
                labelled(doc, "Headquarters"),
                foundedYear(doc),
                specialties == null ? List.of() : Arrays.stream(specialties.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList(),
                followers(html),
                employees(html)
        ));
    }

    long followers(String html) {
        Matcher jsonLd = JSON_LD_COUNT.matcher(html);
        if (jsonLd.find()) {
            long count = CountParser.parse(jsonLd.group(1));
            if (count > 0) return count;
        }
        return firstCount(html, FOLLOWER_PATTERNS, 100);
    }

    long employees(String html) {
        Matcher range = EMPLOYEE_RANGE.matcher(html);
        if (range.find()) {
            return CountParser.parse(range.group(2));
        }
        return firstCount(html, EMPLOYEE_PATTERNS, 0);
    }

    private static long firstCount(String html, List<Pattern> patterns, long mustExceed) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(html);
            while (m.find()) {
                long count = CountParser.parse(m.group(1));
                if (count > mustExceed) return count;
            }
        }
        return 0L;
    }

    private static String meta(Document doc, String property) {
        Element meta = doc.selectFirst("meta[property=" + property + "]");
        if (meta == null) meta = doc.selectFirst("meta[name=" + property + "]");
        if (meta == null) return null;
        String content = meta.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    /** Value rendered next to a label such as "Industry" in the about section. */
    private static String labelled(Document doc, String label) {
        for (Element element : doc.getElementsContainingOwnText(label)) {
            if (!element.ownText().trim().equalsIgnoreCase(label)) continue;
            Element value = element.nextElementSibling();
            if (value == null && element.parent() != null) value = element.parent().nextElementSibling();
            if (value != null && !value.text().isBlank()) return value.text().trim();
        }
        return null;
    }

    private static Integer foundedYear(Document doc) {
        String founded = labelled(doc, "Founded");
        if (founded == null) return null;
        Matcher m = YEAR.matcher(founded);
        return m.find() ? Integer.valueOf(m.group(1)) : null;
    }

    /**
     * Posts on a company posts page, in document order. Elements without text content are skipped.
     */
    public List<LivePost> parsePosts(String html, int limit) {
        if (html == null || html.isBlank() || limit <= 0) return List.of();

        Document doc = Jsoup.parse(html);
        List<LivePost> posts = new ArrayList<>();
        for (Element element : doc.select("[data-id]")) {
            if (posts.size() >= limit) break;
            // nested data-id elements belong to the outer post
            if (element.parents().stream().anyMatch(parent -> parent.hasAttr("data-id"))) continue;

            String content = postContent(element);
            if (content == null) continue;
            String text = element.text();
            posts.add(new LivePost(content, postImage(element),
                    metricCount(text, LIKES), metricCount(text, COMMENTS),
                    metricCount(text, SHARES), metricCount(text, VIEWS)));
        }
        log.debug("Parsed {} posts", posts.size());
        return posts;
    }

    /**
     * Employee cards on a company people page. A card needs a username or a profile id to be kept;
     * repeated cards for the same profile are collapsed.
     */
    public List<LivePerson> parseEmployees(String html, int limit) {
        if (html == null || html.isBlank() || limit <= 0) return List.of();

        Elements cards = Jsoup.parse(html).select("div[class*=profile]");
        Map<String, LivePerson> people = new LinkedHashMap<>();
        for (Element card : cards) {
            if (people.size() >= limit) break;
            String id = attr(card, "data-username");
            if (id == null) id = attr(card, "data-linkedin-id");
            if (id == null) continue;

            Element h3 = card.selectFirst("h3");
            people.putIfAbsent(id, new LivePerson(id,
                    attr(card, "data-first-name"),
                    attr(card, "data-last-name"),
                    h3 != null && !h3.text().isBlank() ? h3.text().trim() : null,
                    attr(card, "data-position")));
        }
        return List.copyOf(people.values());
    }

    private static String postContent(Element post) {
        for (Element candidate : post.select("p, span")) {
            String text = candidate.text().trim();
            if (!text.isEmpty()) {
                return text.length() > MAX_POST_CONTENT ? text.substring(0, MAX_POST_CONTENT) : text;
            }
        }
        return null;
    }

    private static String postImage(Element post) {
        Element img = post.selectFirst("img[src]");
        if (img == null) return null;
        String src = img.attr("src").trim();
        return src.isEmpty() || src.length() > MAX_URL_LENGTH ? null : src;
    }

    private static long metricCount(String text, Pattern metric) {
        Matcher m = metric.matcher(text);
        return m.find() ? CountParser.parse(m.group(1)) : 0L;
    }

    private static Pattern metric(String words) {
        return Pattern.compile("(\\d+(?:[.,]\\d+)*\\s*[KMB]?)\\s+(?:" + words + ")\\b", Pattern.CASE_INSENSITIVE);
    }

    private static String attr(Element element, String name) {
        String value = element.attr(name).trim();
        return value.isEmpty() ? null : value;
    }
}
