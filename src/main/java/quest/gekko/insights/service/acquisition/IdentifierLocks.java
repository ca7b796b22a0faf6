package quest.gekko.insights.service.acquisition;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One fair lock per page identifier. Writers for the same page queue up; different pages never block each other.
 * Locks are weakly held, so an identifier nobody is working on costs nothing once collected.
 */
@Component
public class IdentifierLocks {
    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(id -> new ReentrantLock(true));

    public <T> T withLock(String identifier, Supplier<T> action) {
        ReentrantLock lock = locks.get(identifier);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
