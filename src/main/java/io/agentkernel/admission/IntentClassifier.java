package io.agentkernel.admission;

/**
 * Gate 1 collaborator. May be slow or remote; the router bounds every call with a timeout.
 */
@FunctionalInterface
public interface IntentClassifier {
    Classification classify(String rawInput) throws Exception;
}
