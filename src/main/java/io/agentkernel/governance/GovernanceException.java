package io.agentkernel.governance;

import io.agentkernel.error.KernelException;

/**
 * Terminal registration or verification failure. Callers re-register instead of retrying.
 */
public final class GovernanceException extends KernelException {
    private final GovernanceError error;
    private final String agentId;

    public GovernanceException(GovernanceError error, String agentId, String message) {
        super(message);
        this.error = error;
        this.agentId = agentId;
    }

    public GovernanceError error() {
        return error;
    }

    public String agentId() {
        return agentId;
    }
}
