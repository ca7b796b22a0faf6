package quest.gekko.insights.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insights.domain.CompanyPage;
import quest.gekko.insights.domain.PersonProfile;
import quest.gekko.insights.domain.PersonRole;

import java.util.List;

public interface PersonProfileRepository extends JpaRepository<PersonProfile, Long> {
    Page<PersonProfile> findByPage_IdentifierAndRole(final String identifier, final PersonRole role, final Pageable pageable);
    List<PersonProfile> findByPage_IdentifierAndRoleOrderByIdAsc(final String identifier, final PersonRole role);

    void deleteByPage(final CompanyPage page);
}
