package quest.gekko.insights.util;

import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import quest.gekko.insights.config.InsightsProperties;

import java.util.concurrent.Callable;
import java.util.concurrent.Semaphore;

/**
 * Caps concurrent outbound calls to the live page source and retries each one a few times.
 */
@Component
public class RateLimiter {
    private final Semaphore sem;
    private final RetryTemplate retry;

    public RateLimiter(final InsightsProperties.Live live) {
        this.sem = new Semaphore(Math.max(1, live.maxConcurrent()));
        this.retry = RetryTemplate.builder()
                .maxAttempts(Math.max(1, live.maxAttempts()))
                .fixedBackoff(Math.max(1L, live.backoff().toMillis()))
                .build();
    }

    public <T> T call(Callable<T> c) {
        try {
            sem.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for an outbound slot", e);
        }
        try {
            return retry.execute(ctx -> c.call());
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        } finally {
            sem.release();
        }
    }
}
