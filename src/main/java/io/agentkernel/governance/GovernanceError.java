package io.agentkernel.governance;

public enum GovernanceError {
    INVALID_SIGNATURE,
    OATH_STALE,
    ALREADY_REGISTERED,
    UNKNOWN_AGENT
}
