package quest.gekko.insights.web.dto;

import quest.gekko.insights.domain.Comment;

import java.time.Instant;

public record CommentDTO(String authorName, String content, long likesCount, Instant createdAt) {
    public static CommentDTO from(Comment comment) {
        return new CommentDTO(comment.getAuthorName(), comment.getContent(), comment.getLikesCount(), comment.getCreatedAt());
    }
}
