package io.agentkernel.runtime;

/**
 * Optional components, resolved once when the kernel is constructed.
 */
public record KernelCapabilities(
        boolean ed25519Available,
        String signatureAlgorithm,
        boolean customClassifier,
        boolean customPlacement,
        boolean customPolicySource,
        boolean maintenanceLoop
) {
}
