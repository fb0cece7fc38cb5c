package io.agentkernel.error;

/**
 * The hash chain can not be trusted any more. Once raised the kernel is halted and stays halted
 * until an operator intervenes.
 */
public final class LedgerCorruptionException extends KernelException {
    private final long sequenceNumber;

    public LedgerCorruptionException(String message, long sequenceNumber) {
        super(message);
        this.sequenceNumber = sequenceNumber;
    }

    public long sequenceNumber() {
        return sequenceNumber;
    }
}
