package io.agentkernel.scheduler;

public enum SchedulingError {
    NOT_OWNER,
    INVALID_STATE,
    NOT_FOUND,
    AGENT_NOT_SWORN
}
