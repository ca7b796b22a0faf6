package quest.gekko.insights.web.dto;

import quest.gekko.insights.domain.AcquisitionSource;
import quest.gekko.insights.domain.CompanyPage;

import java.time.Instant;
import java.util.List;

public record CompanyPageDTO(
        Long id,
        String pageId,
        String name,
        String url,
        String description,
        String profilePictureUrl,
        String website,
        String industry,
        String companySize,
        String headquarters,
        Integer foundedYear,
        List<String> specialties,
        long followersCount,
        long employeesCount,
        AcquisitionSource source,
        int lastDepth,
        Instant createdAt,
        Instant updatedAt,
        Instant lastAcquiredAt
) {
    public static CompanyPageDTO from(CompanyPage page) {
        return new CompanyPageDTO(page.getId(), page.getIdentifier(), page.getName(), page.getUrl(),
                page.getDescription(), page.getProfilePictureUrl(), page.getWebsite(), page.getIndustry(),
                page.getCompanySize(), page.getHeadquarters(), page.getFoundedYear(), List.copyOf(page.getSpecialties()),
                page.getFollowersCount(), page.getEmployeesCount(), page.getSource(), page.getLastDepth(),
                page.getCreatedAt(), page.getUpdatedAt(), page.getLastAcquiredAt());
    }
}
