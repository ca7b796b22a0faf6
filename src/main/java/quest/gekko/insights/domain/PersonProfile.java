package quest.gekko.insights.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

/**
 * A follower or an employee of a page. The same person showing up under two pages
 * is stored twice; profiles are owned by the page they were acquired for.
 */
@Entity
@Table(name = "person_profile",
        uniqueConstraints = @UniqueConstraint(columnNames = { "page_id", "role", "profile_identifier" }))
@Getter @Setter
public class PersonProfile {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "page_id")
    CompanyPage page;

    @Enumerated(EnumType.STRING) @Column(nullable = false, length = 20)
    PersonRole role;

    @Column(name = "profile_identifier", nullable = false)
    String profileIdentifier;

    String firstName;
    String lastName;
    String headline;
    String location;
    String currentPosition;
    String currentCompany;

    long connectionsCount;
    long followersCount;
}
