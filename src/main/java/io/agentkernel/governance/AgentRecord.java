package io.agentkernel.governance;

import java.time.Instant;
import java.util.Set;

/**
 * Registry entry. {@code oathEventSequence} points at the OATH_SWORN event of the current oath.
 */
public record AgentRecord(
        String agentId,
        String publicKey,
        Set<String> capabilities,
        OathStatus oathStatus,
        Long oathEventSequence,
        Instant registeredAt,
        Instant updatedAt
) {
    public boolean isSworn() {
        return oathStatus == OathStatus.SWORN;
    }
}
