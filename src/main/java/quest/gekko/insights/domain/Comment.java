package quest.gekko.insights.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "post_comment")
@Getter @Setter
public class Comment {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "post_id")
    Post post;

    @Column(nullable = false)
    String authorName;

    @Column(nullable = false, length = 1000)
    String content;

    long likesCount;

    @Column(nullable = false)
    Instant createdAt;
}
