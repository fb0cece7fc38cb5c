package io.agentkernel.util;

import io.agentkernel.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for storage calls. Only {@link SQLException}s are retried; anything
 * else is a programming error and propagates untouched.
 */
public final class Backoff {
    private static final Logger log = LoggerFactory.getLogger(Backoff.class);

    private final int maxAttempts;
    private final long baseBackoffMs;
    private final long maxBackoffMs;

    public Backoff(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffMs = Math.max(1L, baseBackoffMs);
        this.maxBackoffMs = Math.max(this.baseBackoffMs, maxBackoffMs);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public <T> T call(String operation, SqlCall<T> call) {
        SQLException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.call();
            } catch (SQLException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long sleepMs = delayMs(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, maxAttempts, sleepMs, e.getMessage());
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw new PersistenceException(operation + " interrupted during backoff", attempt, e);
                }
            }
        }
        throw new PersistenceException(operation + " failed after " + maxAttempts + " attempts", maxAttempts, last);
    }

    long delayMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.max(1L, baseBackoffMs / 2L) + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    @FunctionalInterface
    public interface SqlCall<T> {
        T call() throws SQLException;
    }
}
