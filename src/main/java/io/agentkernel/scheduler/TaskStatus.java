package io.agentkernel.scheduler;

public enum TaskStatus {
    PENDING,
    CLAIMED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    DEAD;

    public boolean isClaimed() {
        return this == CLAIMED || this == IN_PROGRESS;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD;
    }
}
