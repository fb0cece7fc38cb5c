package io.agentkernel.scheduler;

import io.agentkernel.admission.RoutingTier;

import java.time.Instant;

public record Task(
        String taskId,
        long sequence,
        String requestId,
        String sourceAgentId,
        String agentId,
        String payload,
        RoutingTier tier,
        PlacementRank placementRank,
        int userPriority,
        TaskStatus status,
        long claimEpoch,
        int attemptCount,
        int maxRetries,
        String resultPayload,
        String lastError,
        Instant createdAt,
        Instant claimedAt,
        Instant startedAt,
        Instant completedAt,
        Instant updatedAt
) {
}
