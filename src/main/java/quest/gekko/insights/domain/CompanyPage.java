package quest.gekko.insights.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "company_page", uniqueConstraints = @UniqueConstraint(columnNames = { "identifier" }))
@Getter @Setter
public class CompanyPage {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false, updatable = false, length = 100)
    String identifier;

    @Column(nullable = false)
    String name;

    @Column(nullable = false, length = 500)
    String url;

    @Column(length = 2000)
    String description;

    @Column(length = 500)
    String profilePictureUrl;

    @Column(length = 500)
    String website;

    @Column(length = 100)
    String industry;

    @Column(length = 50)
    String companySize;

    String headquarters;
    Integer foundedYear;

    @Convert(converter = StringListConverter.class)
    @Column(length = 1000)
    List<String> specialties = new ArrayList<>();

    @Column(nullable = false)
    long followersCount;

    @Column(nullable = false)
    long employeesCount;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    AcquisitionSource source;

    @Column(nullable = false)
    int lastDepth;

    @Column(length = 4000)
    String narrativeSummary;

    Instant narrativeGeneratedAt;

    @Column(nullable = false, updatable = false)
    Instant createdAt = Instant.now();

    @Column(nullable = false)
    Instant updatedAt = Instant.now();

    Instant lastAcquiredAt;
}
