package io.agentkernel.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide fail-closed switch. The ledger trips it on a broken chain or on exhausted storage
 * retries; every write path checks it before touching state.
 */
public final class HaltSwitch {
    private static final Logger log = LoggerFactory.getLogger(HaltSwitch.class);

    private final AtomicReference<Halt> halt = new AtomicReference<>();

    public boolean trip(String cause, long sequenceNumber) {
        Halt next = new Halt(cause, sequenceNumber, Instant.now());
        if (halt.compareAndSet(null, next)) {
            log.error("KERNEL HALTED: {} (sequence={}). All ledger writes are refused until an operator intervenes.",
                    cause, sequenceNumber);
            return true;
        }
        return false;
    }

    public boolean isHalted() {
        return halt.get() != null;
    }

    public Halt current() {
        return halt.get();
    }

    public void ensureWritable() {
        Halt current = halt.get();
        if (current != null) {
            throw new LedgerCorruptionException("Kernel is halted: " + current.cause(), current.sequenceNumber());
        }
    }

    public record Halt(String cause, long sequenceNumber, Instant haltedAt) {
    }
}
