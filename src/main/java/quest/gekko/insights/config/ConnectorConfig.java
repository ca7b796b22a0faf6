package quest.gekko.insights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.random.RandomGenerator;

@Configuration
@Slf4j
public class ConnectorConfig {

    @Bean
    public WebClient webClient() {
        return WebClient.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .build();
    }

    /** Runs live fetches so they can be abandoned on timeout without blocking the caller. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService liveFetchExecutor(final InsightsProperties.Acquisition acquisition) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "live-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Live fetch pool sized at {} threads, timeout {}", acquisition.liveFetchThreads(), acquisition.liveTimeout());
        return Executors.newFixedThreadPool(Math.max(1, acquisition.liveFetchThreads()), factory);
    }

    @Bean
    public RandomGenerator syntheticRandom() {
        return new Random();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
