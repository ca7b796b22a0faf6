package quest.gekko.insights.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "post", uniqueConstraints = @UniqueConstraint(columnNames = { "page_id", "post_identifier" }))
@Getter @Setter
public class Post {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "page_id")
    CompanyPage page;

    @Column(name = "post_identifier", nullable = false, length = 150)
    String postIdentifier;

    @Column(nullable = false, length = 500)
    String content;

    @Column(length = 500)
    String imageUrl;

    long likesCount;
    long commentsCount;
    long sharesCount;
    long viewsCount;

    // always (likes + comments + shares) / page followers * 100, two decimals
    double engagementRate;

    @Column(nullable = false)
    Instant postedAt;

    @OneToMany(mappedBy = "post", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("createdAt DESC")
    List<Comment> comments = new ArrayList<>();

    public void addComment(Comment comment) {
        comment.setPost(this);
        comments.add(comment);
    }
}
