package quest.gekko.insights.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insights.domain.FollowerSample;

import java.util.List;

public interface FollowerSampleRepository extends JpaRepository<FollowerSample, Long> {
    List<FollowerSample> findByPage_IdentifierOrderBySampledAtAsc(final String identifier);
}
