package quest.gekko.insights.repository;

import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import quest.gekko.insights.domain.CompanyPage;

import java.util.Optional;

public interface CompanyPageRepository extends JpaRepository<CompanyPage, Long>, JpaSpecificationExecutor<CompanyPage> {
    Optional<CompanyPage> findByIdentifier(final String identifier);
    boolean existsByIdentifier(final String identifier);

    static Specification<CompanyPage> minFollowers(final Long min) {
        return (root, query, cb) -> min == null ? null : cb.greaterThanOrEqualTo(root.get("followersCount"), min);
    }

    static Specification<CompanyPage> maxFollowers(final Long max) {
        return (root, query, cb) -> max == null ? null : cb.lessThanOrEqualTo(root.get("followersCount"), max);
    }

    static Specification<CompanyPage> industryContains(final String industry) {
        return (root, query, cb) -> industry == null || industry.isBlank() ? null
                : cb.like(cb.lower(root.get("industry")), "%" + industry.trim().toLowerCase() + "%");
    }

    static Specification<CompanyPage> nameContains(final String name) {
        return (root, query, cb) -> name == null || name.isBlank() ? null
                : cb.like(cb.lower(root.get("name")), "%" + name.trim().toLowerCase() + "%");
    }
}
