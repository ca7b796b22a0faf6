package quest.gekko.insights.service.integration.summary;

import java.util.Optional;

/**
 * Text generation used for the narrative part of page analytics.
 */
public interface SummaryProvider {
    /**
     * @return the generated text, or empty when the provider is not configured
     */
    Optional<String> summarize(String prompt);
}
