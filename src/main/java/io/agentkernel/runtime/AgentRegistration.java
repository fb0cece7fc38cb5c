package io.agentkernel.runtime;

import java.util.Set;

/**
 * An agent the operator wants sworn in during boot.
 */
public record AgentRegistration(String agentId, String publicKey, Set<String> capabilities, String oathSignature) {
    public AgentRegistration {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
