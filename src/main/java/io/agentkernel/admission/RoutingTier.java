package io.agentkernel.admission;

/**
 * Admission tier. BLOCKED never becomes a task; the others order the pending queue.
 */
public enum RoutingTier {
    BLOCKED(-1),
    HIGH(0),
    MEDIUM(1),
    LOW(2);

    private final int schedulingRank;

    RoutingTier(int schedulingRank) {
        this.schedulingRank = schedulingRank;
    }

    /**
     * Lower runs first.
     */
    public int schedulingRank() {
        return schedulingRank;
    }
}
