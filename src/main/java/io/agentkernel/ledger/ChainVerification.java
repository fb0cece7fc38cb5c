package io.agentkernel.ledger;

/**
 * Result of a full chain walk. When {@code ok} is false, {@code brokenSequence} is the first
 * event that failed and {@code reason} one of {@code sequence_gap}, {@code prev_hash_mismatch},
 * {@code hash_mismatch} or {@code unreadable_event}.
 */
public record ChainVerification(boolean ok, long checked, Long brokenSequence, String reason) {

    static ChainVerification intact(long checked) {
        return new ChainVerification(true, checked, null, "ok");
    }

    static ChainVerification broken(long checked, long sequenceNumber, String reason) {
        return new ChainVerification(false, checked, sequenceNumber, reason);
    }
}
