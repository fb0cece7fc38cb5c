package io.agentkernel.runtime;

import io.agentkernel.admission.IntentClassifier;
import io.agentkernel.governance.PolicyDocumentProvider;
import io.agentkernel.governance.SignatureVerifier;
import io.agentkernel.scheduler.PlacementService;

/**
 * External collaborators plugged into the kernel. A null entry selects the built-in default.
 */
public record Collaborators(
        IntentClassifier classifier,
        PlacementService placement,
        PolicyDocumentProvider policy,
        SignatureVerifier verifier
) {
    public static Collaborators defaults() {
        return new Collaborators(null, null, null, null);
    }

    public Collaborators withClassifier(IntentClassifier value) {
        return new Collaborators(value, placement, policy, verifier);
    }

    public Collaborators withPlacement(PlacementService value) {
        return new Collaborators(classifier, value, policy, verifier);
    }

    public Collaborators withPolicy(PolicyDocumentProvider value) {
        return new Collaborators(classifier, placement, value, verifier);
    }

    public Collaborators withVerifier(SignatureVerifier value) {
        return new Collaborators(classifier, placement, policy, value);
    }
}
