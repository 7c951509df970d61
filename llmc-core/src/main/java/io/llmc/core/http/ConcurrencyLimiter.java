package io.llmc.core.http;

import io.llmc.core.error.BackpressureException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-provider cap on in-flight upstream calls. Callers over the cap fail fast.
 */
public final class ConcurrencyLimiter {
    private final int limit;
    private final Map<String, Semaphore> semaphores = new ConcurrentHashMap<>();

    public ConcurrencyLimiter(int limit) {
        this.limit = Math.max(1, limit);
    }

    public Permit acquire(String provider) {
        String key = provider == null ? "" : provider;
        Semaphore semaphore = semaphores.computeIfAbsent(key, ignored -> new Semaphore(limit));
        if (!semaphore.tryAcquire()) {
            throw new BackpressureException(key, limit);
        }
        return new Permit(semaphore);
    }

    public int available(String provider) {
        Semaphore semaphore = semaphores.get(provider == null ? "" : provider);
        return semaphore == null ? limit : semaphore.availablePermits();
    }

    public static final class Permit implements AutoCloseable {
        private final Semaphore semaphore;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                semaphore.release();
            }
        }
    }
}
