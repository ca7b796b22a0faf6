package quest.gekko.insights.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.Post;

import java.util.List;

public interface PostRepository extends JpaRepository<Post, Long> {
    Page<Post> findByPage_Identifier(final String identifier, final Pageable pageable);
    List<Post> findByPage_IdentifierOrderByPostedAtDesc(final String identifier);

    void deleteByPage(final CompanyPage page);
}
