package io.agentkernel.scheduler;

import io.agentkernel.admission.RoutingTier;

/**
 * External collaborator that places new work. The scheduler never interprets the rank.
 */
@FunctionalInterface
public interface PlacementService {
    PlacementRank rankFor(String sourceAgentId, String rawInput, RoutingTier tier);

    static PlacementService uniform() {
        return (sourceAgentId, rawInput, tier) -> PlacementRank.UNIFORM;
    }
}
