package io.agentkernel.scheduler;

/**
 * Opaque tie-break supplied by the placement collaborator. Only the order matters; lower first.
 */
public record PlacementRank(long value) implements Comparable<PlacementRank> {
    public static final PlacementRank UNIFORM = new PlacementRank(0L);

    @Override
    public int compareTo(PlacementRank other) {
        return Long.compare(value, other.value);
    }
}
