package quest.gekko.insights.service.synthesis;

import java.util.List;

/**
 * Basic facts about a page, as scraped live or taken from defaults. Any field except the identifier
 * may be missing on a live result.
 */
public record PageFacts(
        String identifier,
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
        long followers,
        long employees
) {
    public PageFacts {
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
    }

    /** Fills whatever this record lacks from {@code defaults}. Counts are taken from defaults only when zero. */
    public PageFacts orElse(PageFacts defaults) {
        return new PageFacts(
                identifier,
                pick(name, defaults.name()),
                pick(url, defaults.url()),
                pick(description, defaults.description()),
                pick(profilePictureUrl, defaults.profilePictureUrl()),
                pick(website, defaults.website()),
                pick(industry, defaults.industry()),
                pick(companySize, defaults.companySize()),
                pick(headquarters, defaults.headquarters()),
                foundedYear != null ? foundedYear : defaults.foundedYear(),
                specialties.isEmpty() ? defaults.specialties() : specialties,
                followers > 0 ? followers : defaults.followers(),
                employees > 0 ? employees : defaults.employees()
        );
    }

    private static String pick(String value, String fallback) {
        return value != null && !value.isBlank() ? value : fallback;
    }
}
