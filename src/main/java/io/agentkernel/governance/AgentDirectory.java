package io.agentkernel.governance;

/**
 * Read-only view of the registry handed to components that must not mutate it.
 */
@FunctionalInterface
public interface AgentDirectory {
    boolean isSworn(String agentId);
}
