package io.agentkernel.ledger;

/**
 * Last appended position. An empty chain has sequence {@code -1} and the genesis hash.
 */
public record LedgerHead(long sequenceNumber, String hash) {
    public boolean isEmpty() {
        return sequenceNumber < 0;
    }

    public long size() {
        return sequenceNumber + 1L;
    }
}
