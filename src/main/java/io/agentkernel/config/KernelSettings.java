package io.agentkernel.config;

import io.agentkernel.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read once at boot from {@code kernel-settings.json}. Missing or out-of-range values
 * fall back to the defaults below.
 */
public record KernelSettings(
        long classifierTimeoutMs,
        int lazyQueueCapacity,
        long idempotencyWindowMs,
        long claimTimeoutMs,
        long inProgressDeadlineMs,
        int defaultMaxRetries,
        int maxInputChars,
        int routerThreads,
        long maintenanceIntervalMs,
        int persistenceMaxAttempts,
        long persistenceBaseBackoffMs,
        long persistenceMaxBackoffMs
) {
    private static final Logger log = LoggerFactory.getLogger(KernelSettings.class);

    public static final long DEFAULT_CLASSIFIER_TIMEOUT_MS = 500L;
    public static final int DEFAULT_LAZY_QUEUE_CAPACITY = 100;
    public static final long DEFAULT_IDEMPOTENCY_WINDOW_MS = 60_000L;
    public static final long DEFAULT_CLAIM_TIMEOUT_MS = 30_000L;
    public static final long DEFAULT_IN_PROGRESS_DEADLINE_MS = 600_000L;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_MAX_INPUT_CHARS = 10_000;
    public static final int DEFAULT_ROUTER_THREADS = 4;
    public static final long DEFAULT_MAINTENANCE_INTERVAL_MS = 5_000L;
    public static final int DEFAULT_PERSISTENCE_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_PERSISTENCE_BASE_BACKOFF_MS = 50L;
    public static final long DEFAULT_PERSISTENCE_MAX_BACKOFF_MS = 2_000L;

    public static KernelSettings defaults() {
        return new KernelSettings(
                DEFAULT_CLASSIFIER_TIMEOUT_MS,
                DEFAULT_LAZY_QUEUE_CAPACITY,
                DEFAULT_IDEMPOTENCY_WINDOW_MS,
                DEFAULT_CLAIM_TIMEOUT_MS,
                DEFAULT_IN_PROGRESS_DEADLINE_MS,
                DEFAULT_MAX_RETRIES,
                DEFAULT_MAX_INPUT_CHARS,
                DEFAULT_ROUTER_THREADS,
                DEFAULT_MAINTENANCE_INTERVAL_MS,
                DEFAULT_PERSISTENCE_MAX_ATTEMPTS,
                DEFAULT_PERSISTENCE_BASE_BACKOFF_MS,
                DEFAULT_PERSISTENCE_MAX_BACKOFF_MS
        );
    }

    public static KernelSettings load(Path file) {
        KernelSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            KernelSettings resolved = fromFile(raw, defaults);
            log.info("Loaded kernel settings from {}", file);
            return resolved;
        } catch (IOException e) {
            throw new IllegalStateException("Invalid kernel settings file: " + file, e);
        }
    }

    static KernelSettings fromFile(SettingsFile file, KernelSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long baseBackoff = sanitizeLong(file.persistenceBaseBackoffMs(), defaults.persistenceBaseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.persistenceMaxBackoffMs(), defaults.persistenceMaxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        return new KernelSettings(
                sanitizeLong(file.classifierTimeoutMs(), defaults.classifierTimeoutMs(), 1L),
                sanitizeInt(file.lazyQueueCapacity(), defaults.lazyQueueCapacity(), 1),
                sanitizeLong(file.idempotencyWindowMs(), defaults.idempotencyWindowMs(), 0L),
                sanitizeLong(file.claimTimeoutMs(), defaults.claimTimeoutMs(), 1L),
                sanitizeLong(file.inProgressDeadlineMs(), defaults.inProgressDeadlineMs(), 1L),
                sanitizeInt(file.defaultMaxRetries(), defaults.defaultMaxRetries(), 1),
                sanitizeInt(file.maxInputChars(), defaults.maxInputChars(), 1),
                sanitizeInt(file.routerThreads(), defaults.routerThreads(), 1),
                sanitizeLong(file.maintenanceIntervalMs(), defaults.maintenanceIntervalMs(), 0L),
                sanitizeInt(file.persistenceMaxAttempts(), defaults.persistenceMaxAttempts(), 1),
                baseBackoff,
                maxBackoff
        );
    }

    public KernelSettings withLazyQueueCapacity(int capacity) {
        return new KernelSettings(classifierTimeoutMs, Math.max(1, capacity), idempotencyWindowMs, claimTimeoutMs,
                inProgressDeadlineMs, defaultMaxRetries, maxInputChars, routerThreads, maintenanceIntervalMs,
                persistenceMaxAttempts, persistenceBaseBackoffMs, persistenceMaxBackoffMs);
    }

    public KernelSettings withClassifierTimeoutMs(long timeoutMs) {
        return new KernelSettings(Math.max(1L, timeoutMs), lazyQueueCapacity, idempotencyWindowMs, claimTimeoutMs,
                inProgressDeadlineMs, defaultMaxRetries, maxInputChars, routerThreads, maintenanceIntervalMs,
                persistenceMaxAttempts, persistenceBaseBackoffMs, persistenceMaxBackoffMs);
    }

    public KernelSettings withIdempotencyWindowMs(long windowMs) {
        return new KernelSettings(classifierTimeoutMs, lazyQueueCapacity, Math.max(0L, windowMs), claimTimeoutMs,
                inProgressDeadlineMs, defaultMaxRetries, maxInputChars, routerThreads, maintenanceIntervalMs,
                persistenceMaxAttempts, persistenceBaseBackoffMs, persistenceMaxBackoffMs);
    }

    public KernelSettings withClaimTimeoutMs(long timeoutMs) {
        return new KernelSettings(classifierTimeoutMs, lazyQueueCapacity, idempotencyWindowMs, Math.max(1L, timeoutMs),
                inProgressDeadlineMs, defaultMaxRetries, maxInputChars, routerThreads, maintenanceIntervalMs,
                persistenceMaxAttempts, persistenceBaseBackoffMs, persistenceMaxBackoffMs);
    }

    public KernelSettings withMaintenanceIntervalMs(long intervalMs) {
        return new KernelSettings(classifierTimeoutMs, lazyQueueCapacity, idempotencyWindowMs, claimTimeoutMs,
                inProgressDeadlineMs, defaultMaxRetries, maxInputChars, routerThreads, Math.max(0L, intervalMs),
                persistenceMaxAttempts, persistenceBaseBackoffMs, persistenceMaxBackoffMs);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return value < min ? fallback : value;
    }

    record SettingsFile(
            Long classifierTimeoutMs,
            Integer lazyQueueCapacity,
            Long idempotencyWindowMs,
            Long claimTimeoutMs,
            Long inProgressDeadlineMs,
            Integer defaultMaxRetries,
            Integer maxInputChars,
            Integer routerThreads,
            Long maintenanceIntervalMs,
            Integer persistenceMaxAttempts,
            Long persistenceBaseBackoffMs,
            Long persistenceMaxBackoffMs
    ) {
    }
}
