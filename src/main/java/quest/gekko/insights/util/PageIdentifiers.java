package quest.gekko.insights.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PageIdentifiers {
    public static final String BASE_URL = "https://www.linkedin.com";

    private static final Pattern COMPANY_URL = Pattern.compile("linkedin\\.com/compan(?:y|ies)/([^/?#]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern VALID = Pattern.compile("[a-z0-9][a-z0-9-]{0,99}");

    private PageIdentifiers() {
    }

    /**
     * Accepts a bare page identifier or a company page URL and returns the lower-case identifier.
     *
     * @throws IllegalArgumentException if no valid identifier can be extracted
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) throw new IllegalArgumentException("Page identifier must not be blank");

        String candidate = raw.trim();
        Matcher m = COMPANY_URL.matcher(candidate);
        if (m.find()) candidate = m.group(1);
        candidate = candidate.toLowerCase(Locale.ROOT);

        if (!VALID.matcher(candidate).matches()) {
            throw new IllegalArgumentException("Malformed page identifier: '" + raw + "'");
        }
        return candidate;
    }

    public static String canonicalUrl(String identifier) {
        return BASE_URL + "/company/" + identifier;
    }
}
