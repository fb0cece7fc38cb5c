package io.agentkernel.scheduler;

import io.agentkernel.error.KernelException;

/**
 * Rejected task transition. Nothing was written; callers re-read the task before retrying.
 */
public final class SchedulingException extends KernelException {
    private final SchedulingError error;
    private final String taskId;

    public SchedulingException(SchedulingError error, String taskId, String message) {
        super(message);
        this.error = error;
        this.taskId = taskId;
    }

    public SchedulingError error() {
        return error;
    }

    public String taskId() {
        return taskId;
    }
}
