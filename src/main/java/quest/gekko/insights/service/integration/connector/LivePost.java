package quest.gekko.insights.service.integration.connector;

/**
 * A post as it appears on the public posts page. Counts the page does not show are zero.
 */
public record LivePost(String content, String imageUrl, long likes, long comments, long shares, long views) {}
