package io.agentkernel.runtime;

import io.agentkernel.scheduler.Task;

import java.util.Optional;

/**
 * What an agent gets to see of the kernel: its own work queue and nothing else.
 */
public interface AgentHandle {
    String agentId();

    Optional<Task> nextTask();

    Task start(String taskId);

    Task complete(String taskId, String resultPayload);

    Task fail(String taskId, String errorPayload);
}
