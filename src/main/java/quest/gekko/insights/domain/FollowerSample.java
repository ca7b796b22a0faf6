package quest.gekko.insights.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "follower_sample")
@Getter @Setter
public class FollowerSample {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "page_id")
    CompanyPage page;

    @Column(nullable = false)
    Instant sampledAt;

    long followers;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    AcquisitionSource source;
}
