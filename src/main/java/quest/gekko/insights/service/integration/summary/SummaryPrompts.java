package quest.gekko.insights.service.integration.summary;

import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.Post;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public final class SummaryPrompts {
    static final String SYSTEM = "You are an expert business analyst providing concise, insightful summaries of companies "
            + "based on their LinkedIn presence. Keep responses to 2-3 paragraphs.";
    static final int TOPIC_POSTS = 3;
    static final int TOPIC_LENGTH = 100;
    static final int DESCRIPTION_LENGTH = 300;

    private SummaryPrompts() {
    }

    public static String pageSummary(CompanyPage page, List<Post> recentPosts, double averageEngagement) {
        String specialties = page.getSpecialties() == null || page.getSpecialties().isEmpty()
                ? "Not specified" : String.join(", ", page.getSpecialties());
        String description = page.getDescription() == null ? "Not provided" : truncate(page.getDescription(), DESCRIPTION_LENGTH);

        String topics = recentPosts.stream()
                .limit(TOPIC_POSTS)
                .map(p -> "- " + truncate(p.getContent(), TOPIC_LENGTH))
                .collect(Collectors.joining("\n"));

        return String.format(Locale.ROOT, """
                %s

                Analyze and provide insights about this company based on their LinkedIn presence:

                Company Name: %s
                Industry: %s
                Description: %s

                Social Metrics:
                - LinkedIn Followers: %,d
                - Employees on LinkedIn: %,d
                - Average Post Engagement Rate: %.2f%%
                - Recent Posts Analyzed: %d

                Specialties: %s
                %s
                Please provide:
                1. A brief assessment of the company's industry position and market presence
                2. Analysis of their LinkedIn engagement and audience reach
                3. Insights about their content strategy and company culture (based on posts)
                """,
                SYSTEM,
                page.getName(),
                page.getIndustry() == null ? "Not specified" : page.getIndustry(),
                description,
                page.getFollowersCount(),
                page.getEmployeesCount(),
                averageEngagement,
                recentPosts.size(),
                specialties,
                topics.isEmpty() ? "" : "\nRecent post topics:\n" + topics + "\n").strip();
    }

    private static String truncate(String text, int length) {
        return text.length() <= length ? text : text.substring(0, length);
    }
}
