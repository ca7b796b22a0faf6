package quest.gekko.insights.service.synthesis;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.insights.domain.Comment;
import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.PersonRole;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Builds post bodies, person profiles and comments from fixed pools. The pool entry is picked at
 * random; rendering a given template index for the same page always yields the same text.
 */
@Component
@RequiredArgsConstructor
public class SyntheticContentGenerator {
    public static final int MAX_POST_LENGTH = 500;

    static final List<String> POST_TEMPLATES = List.of(
            "Excited to share our latest work in {industry}! {company} is bringing AI and cloud together to change how teams operate. Read more: {link}",
            "A big thank you to everyone at {company} for an incredible quarter. Together we are shaping the future of {industry}.",
            "Partnership news: {company} and {partner} are teaming up to deliver enterprise solutions at scale. #innovation",
            "New whitepaper: five trends redefining {industry} this year, from automation to responsible AI. Download it here: {link}",
            "Milestone moment: {followers} people now follow {company}. Thank you to our community of builders and leaders.",
            "Introducing {feature}, built to help customers scale faster. Early adopters report 40% efficiency gains. {link}",
            "We're hiring in {headquarters} and beyond! Join {company} and help shape the future of {industry}. Apply now: {link}",
            "Proud to support {initiative}. Ethical innovation sits at the core of everything we build at {company}.",
            "Announcing a {amount} investment in {region} over the next {years} years to grow our cloud and AI infrastructure.",
            "Case study: how {partner} uses {company} to serve millions of customers in real time. {link}"
    );

    static final List<String> PARTNERS = List.of("Infosys", "Cognizant", "Accenture", "Capgemini", "Deloitte", "Wipro");
    static final List<String> FEATURES = List.of("Insights Studio", "Copilot Assist", "DataFlow", "Smart Workspace");
    static final List<String> INITIATIVES = List.of("responsible AI", "digital skills for everyone", "open source sustainability");
    static final List<String> REGIONS = List.of("India", "Southeast Asia", "Europe", "the Americas");

    static final List<String> FIRST_NAMES = List.of(
            "John", "Sarah", "Mike", "Emma", "Alex", "Lisa", "James", "Rachel", "David", "Sophie",
            "Robert", "Maria", "Christopher", "Jennifer", "Daniel", "Amanda", "Matthew", "Nicole", "Grace", "Samuel");
    static final List<String> LAST_NAMES = List.of(
            "Smith", "Johnson", "Chen", "Wilson", "Kumar", "Anderson", "Brown", "Lee", "Martinez", "Taylor",
            "Garcia", "Davis", "Rodriguez", "Jones", "Miller", "Thompson", "White", "Collins", "Edwards", "Stewart");
    static final List<String> POSITIONS = List.of(
            "Software Engineer", "Product Manager", "Data Scientist", "UX/UI Designer", "Sales Manager",
            "Marketing Manager", "DevOps Engineer", "Business Analyst", "QA Engineer", "Team Lead",
            "VP Engineering", "Chief Product Officer");
    static final List<String> FOLLOWER_COMPANIES = List.of("TechCorp", "DataSystems", "CloudInnovate", "AILabs");
    static final List<String> LOCATIONS = List.of(
            "San Francisco, CA", "New York, NY", "Seattle, WA", "Austin, TX", "Boston, MA", "Los Angeles, CA", "Chicago, IL");
    static final List<String> COMMENT_TEMPLATES = List.of(
            "Congratulations to the whole team!",
            "Great news, looking forward to seeing what comes next.",
            "This is really insightful, thanks for sharing.",
            "Impressive work. How can we learn more?",
            "Exciting times ahead!",
            "Well deserved, keep it up.");

    private final RandomGenerator random;

    public List<String> postBodies(PageFacts facts, int count) {
        List<String> bodies = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            bodies.add(renderPost(random.nextInt(POST_TEMPLATES.size()), facts));
        }
        return bodies;
    }

    public String renderPost(int templateIndex, PageFacts facts) {
        String company = facts.name() != null ? facts.name() : facts.identifier();
        int salt = Math.floorMod(templateIndex + company.length(), Integer.MAX_VALUE);
        Map<String, String> tokens = Map.of(
                "{industry}", facts.industry() != null ? facts.industry() : "technology",
                "{company}", company,
                "{headquarters}", facts.headquarters() != null ? facts.headquarters() : "multiple locations",
                "{followers}", formatFollowers(facts.followers()),
                "{partner}", PARTNERS.get(salt % PARTNERS.size()),
                "{feature}", FEATURES.get(salt % FEATURES.size()),
                "{initiative}", INITIATIVES.get(salt % INITIATIVES.size()),
                "{region}", REGIONS.get(salt % REGIONS.size()),
                "{amount}", "$" + (5 + salt % 16) + "B",
                "{years}", String.valueOf(2 + salt % 4)
        );
        String text = POST_TEMPLATES.get(templateIndex).replace("{link}", linkFor(facts));
        for (Map.Entry<String, String> token : tokens.entrySet()) {
            text = text.replace(token.getKey(), token.getValue());
        }
        return text.length() > MAX_POST_LENGTH ? text.substring(0, MAX_POST_LENGTH) : text;
    }

    public List<PersonProfile> people(PageFacts facts, PersonRole role, int count) {
        List<PersonProfile> people = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String first = pick(FIRST_NAMES);
            String last = pick(LAST_NAMES);

            PersonProfile person = new PersonProfile();
            person.setRole(role);
            person.setProfileIdentifier((first + "_" + last).toLowerCase() + "_" + i);
            person.setFirstName(first);
            person.setLastName(last);

            if (role == PersonRole.EMPLOYEE) {
                String position = pick(POSITIONS);
                person.setHeadline(position);
                person.setCurrentPosition(position);
                person.setCurrentCompany(facts.name());
                person.setLocation(facts.headquarters() != null ? facts.headquarters() : pick(LOCATIONS));
                person.setConnectionsCount(random.nextInt(200, 1_001));
                person.setFollowersCount(random.nextInt(10, 1_001));
            } else {
                person.setHeadline(pick(POSITIONS) + " at " + pick(FOLLOWER_COMPANIES));
                person.setLocation(pick(LOCATIONS));
                person.setConnectionsCount(random.nextInt(100, 2_001));
                person.setFollowersCount(random.nextInt(0, 5_001));
            }
            people.add(person);
        }
        return people;
    }

    /** A sample of one in a hundred employees, clamped to the given bounds. */
    public int employeeSampleSize(long employees, int min, int max) {
        long sample = employees / 100;
        return (int) Math.max(min, Math.min(sample, max));
    }

    /** Comments posted between {@code postedAt} and {@code now}, newest first. */
    public List<Comment> comments(int count, Instant postedAt, Instant now) {
        long window = Math.max(1, Duration.between(postedAt, now).toMinutes());
        List<Comment> comments = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Comment comment = new Comment();
            comment.setAuthorName(pick(FIRST_NAMES) + " " + pick(LAST_NAMES));
            comment.setContent(pick(COMMENT_TEMPLATES));
            comment.setLikesCount(random.nextInt(0, 51));
            comment.setCreatedAt(postedAt.plus(Duration.ofMinutes(random.nextLong(0, window))));
            comments.add(comment);
        }
        comments.sort((a, b) -> b.getCreatedAt().compareTo(a.getCreatedAt()));
        return comments;
    }

    private String pick(List<String> pool) {
        return pool.get(random.nextInt(pool.size()));
    }

    private static String linkFor(PageFacts facts) {
        if (facts.website() != null) return facts.website();
        return facts.url() != null ? facts.url() : "";
    }

    static String formatFollowers(long followers) {
        if (followers >= 1_000_000) return String.format(Locale.ROOT, "%.1fM", followers / 1_000_000.0);
        if (followers >= 1_000) return String.format(Locale.ROOT, "%.1fK", followers / 1_000.0);
        return String.valueOf(followers);
    }
}
