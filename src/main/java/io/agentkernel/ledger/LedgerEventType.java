package io.agentkernel.ledger;

public enum LedgerEventType {
    OATH_SWORN,
    OATH_REJECTED,
    OATH_INVALIDATED,
    REQUEST_ADMITTED,
    REQUEST_BLOCKED,
    TASK_CREATED,
    TASK_CLAIMED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_REQUEUED,
    TASK_DEAD
}
