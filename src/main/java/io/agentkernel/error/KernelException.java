package io.agentkernel.error;

/**
 * Root of every typed failure the kernel reports to its callers.
 */
public class KernelException extends RuntimeException {
    public KernelException(String message) {
        super(message);
    }

    public KernelException(String message, Throwable cause) {
        super(message, cause);
    }
}
