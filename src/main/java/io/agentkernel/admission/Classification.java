package io.agentkernel.admission;

import java.util.List;

/**
 * Classifier answer: a coarse tier plus concept tags extracted from the input.
 */
public record Classification(RoutingTier tier, List<String> concepts, String reason) {
    public Classification {
        concepts = concepts == null ? List.of() : List.copyOf(concepts);
    }
}
