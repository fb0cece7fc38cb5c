package io.agentkernel.scheduler;

import java.util.Map;

public record TaskCounts(
        long pending,
        long claimed,
        long inProgress,
        long completed,
        long failed,
        long dead,
        Map<String, Long> pendingByTier
) {
    public long total() {
        return pending + claimed + inProgress + completed + failed + dead;
    }
}
