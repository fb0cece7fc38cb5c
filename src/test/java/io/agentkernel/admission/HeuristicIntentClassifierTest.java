package io.agentkernel.admission;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class HeuristicIntentClassifierTest {
    private final HeuristicIntentClassifier classifier = new HeuristicIntentClassifier();

    @Test
    void conversationalQueriesAreMedium() {
        for (String input : List.of("What is the capital of France?", "tell me a joke", "hi", "Status", "thanks!")) {
            Classification result = classifier.classify(input);
            Assertions.assertEquals(RoutingTier.MEDIUM, result.tier(), input);
            Assertions.assertEquals(List.of("simple_query"), result.concepts());
        }
    }

    @Test
    void batchChoresAreLowWithTheirKeywords() {
        Classification result = classifier.classify("Export report for Q3 and archive logs");
        Assertions.assertEquals(RoutingTier.LOW, result.tier());
        Assertions.assertEquals(List.of("batch_processing", "export", "report", "archive"), result.concepts());
    }

    @Test
    void everythingElseNeedsReasoning() {
        Classification result = classifier.classify("Design a fault tolerant consensus protocol for five nodes");
        Assertions.assertEquals(RoutingTier.HIGH, result.tier());
        Assertions.assertEquals(List.of("complex_reasoning"), result.concepts());
        Assertions.assertEquals(RoutingTier.HIGH, classifier.classify("history of the printing press").tier());
    }
}
