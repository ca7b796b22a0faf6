package quest.gekko.insights.web.dto;

import quest.gekko.insights.domain.Post;

import java.time.Instant;
import java.util.List;

public record PostDTO(
        String postId,
        String content,
        String imageUrl,
        long likesCount,
        long commentsCount,
        long sharesCount,
        long viewsCount,
        double engagementRate,
        Instant postedAt,
        List<CommentDTO> comments
) {
    public static PostDTO from(Post post) {
        return new PostDTO(post.getPostIdentifier(), post.getContent(), post.getImageUrl(), post.getLikesCount(),
                post.getCommentsCount(), post.getSharesCount(), post.getViewsCount(), post.getEngagementRate(),
                post.getPostedAt(), post.getComments().stream().map(CommentDTO::from).toList());
    }
}
