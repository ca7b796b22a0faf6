package quest.gekko.insights.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration properties for acquisition, generation and the outbound integrations
 */
@Configuration
@EnableConfigurationProperties({
        InsightsProperties.Acquisition.class,
        InsightsProperties.Live.class,
        InsightsProperties.Generation.class,
        InsightsProperties.Cache.class,
        InsightsProperties.Summary.class,
        InsightsProperties.Refresh.class
})
public class InsightsProperties {

    /** How long a live fetch may run before the synthetic path takes over. */
    @ConfigurationProperties("insights.acquisition")
    public record Acquisition(Duration liveTimeout, int liveFetchThreads) {}

    @ConfigurationProperties("insights.live")
    public record Live(boolean enabled, String baseUrl, String userAgent,
                       int maxConcurrent, int maxAttempts, Duration backoff, int minHtmlLength) {}

    @ConfigurationProperties("insights.generation")
    public record Generation(int posts, int followers, int minEmployees, int maxEmployees, int maxCommentsPerPost) {}

    @ConfigurationProperties("insights.cache")
    public record Cache(Duration analyticsTtl, Duration pageDetailTtl, long maximumSize) {}

    /** Gemini settings. {@code timeout} bounds one generateContent call, 30 seconds when unset. */
    @ConfigurationProperties("insights.summary")
    public record Summary(String apiKey, String model, String baseUrl, int maxOutputTokens, double temperature,
                          Duration timeout) {
        public Summary {
            if (timeout == null) timeout = Duration.ofSeconds(30);
        }

        public boolean configured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @ConfigurationProperties("insights.refresh")
    public record Refresh(boolean enabled, String cron) {}
}
