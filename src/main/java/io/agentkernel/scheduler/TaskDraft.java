package io.agentkernel.scheduler;

import io.agentkernel.admission.RoutingTier;

/**
 * Everything the router knows about a task before it exists.
 */
public record TaskDraft(
        String taskId,
        String requestId,
        String sourceAgentId,
        String payload,
        RoutingTier tier,
        PlacementRank placementRank,
        int userPriority,
        int maxRetries
) {
    public TaskDraft {
        if (tier == null || tier == RoutingTier.BLOCKED) {
            throw new IllegalArgumentException("tasks need a schedulable tier, got " + tier);
        }
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be >= 1");
        }
        if (placementRank == null) {
            placementRank = PlacementRank.UNIFORM;
        }
    }
}
