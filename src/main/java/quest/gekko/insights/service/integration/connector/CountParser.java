package quest.gekko.insights.service.integration.connector;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses human formatted counts such as "152,472", "1.2K" or "3M".
 */
public final class CountParser {
    private static final Pattern COUNT = Pattern.compile("(\\d+(?:[.,]\\d+)*)\\s*([KMB])?", Pattern.CASE_INSENSITIVE);

    private CountParser() {
    }

    public static long parse(String text) {
        if (text == null || text.isBlank()) return 0L;
        Matcher m = COUNT.matcher(text.trim());
        if (!m.find()) return 0L;

        String digits = m.group(1);
        String suffix = m.group(2);
        try {
            if (suffix == null) {
                return new BigDecimal(digits.replace(",", "")).longValue();
            }
            // "1,5K" is a decimal comma, "1,500" is a thousands separator
            String decimal = digits.matches("\\d+,\\d{1,2}") ? digits.replace(',', '.') : digits.replace(",", "");
            long multiplier = switch (suffix.toUpperCase(Locale.ROOT)) {
                case "K" -> 1_000L;
                case "M" -> 1_000_000L;
                default -> 1_000_000_000L;
            };
            return new BigDecimal(decimal).multiply(BigDecimal.valueOf(multiplier)).longValue();
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
