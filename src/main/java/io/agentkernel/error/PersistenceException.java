package io.agentkernel.error;

public final class PersistenceException extends KernelException {
    private final int attempts;

    public PersistenceException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
