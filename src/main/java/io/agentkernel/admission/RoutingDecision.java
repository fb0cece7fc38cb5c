package io.agentkernel.admission;

import java.time.Instant;
import java.util.List;

/**
 * Write-once record of what the router did with one request. {@code deduplicated} is true only on
 * the copy handed back for a replayed request.
 */
public record RoutingDecision(
        String requestId,
        RoutingTier tier,
        String reason,
        String createdTaskId,
        SecurityRejection rejection,
        List<String> concepts,
        Instant decidedAt,
        boolean deduplicated
) {
    public RoutingDecision {
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
    }

    public boolean isBlocked() {
        return tier == RoutingTier.BLOCKED;
    }

    RoutingDecision asReplay() {
        return new RoutingDecision(requestId, tier, reason, createdTaskId, rejection, concepts, decidedAt, true);
    }
}
