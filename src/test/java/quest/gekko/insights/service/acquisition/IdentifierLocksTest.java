package quest.gekko.insights.service.acquisition;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifierLocksTest {
    private final IdentifierLocks locks = new IdentifierLocks();

    @Test
    void shouldRunActionsOnTheSameIdentifierOneAtATime() throws Exception {
        // GIVEN
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService callers = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);

        // WHEN
        List<Future<Integer>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 4; i++) {
                int value = i;
                results.add(callers.submit(() -> {
                    start.await();
                    return locks.withLock("acme", () -> {
                        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                        sleep(20);
                        inside.decrementAndGet();
                        return value;
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> result : results) result.get(10, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        // THEN
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void shouldNotBlockOtherIdentifiers() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService holder = Executors.newSingleThreadExecutor();
        try {
            holder.submit(() -> locks.withLock("acme", () -> {
                held.countDown();
                await(release);
                return null;
            }));
            assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(locks.withLock("globex", () -> "done")).isEqualTo("done");
        } finally {
            release.countDown();
            holder.shutdownNow();
        }
    }

    @Test
    void shouldAllowNestedActionsOnTheSameIdentifier() {
        assertThat(locks.withLock("acme", () -> locks.withLock("acme", () -> 42))).isEqualTo(42);
    }

    @Test
    void shouldReleaseTheLockWhenTheActionFails() throws Exception {
        assertThatThrownBy(() -> locks.withLock("acme", () -> {
            throw new IllegalStateException("boom");
        })).hasMessage("boom");

        // another thread, since the lock is reentrant for this one
        assertThat(CompletableFuture.supplyAsync(() -> locks.withLock("acme", () -> "again")).get(5, TimeUnit.SECONDS))
                .isEqualTo("again");
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
