package io.agentkernel.runtime;

/**
 * Boot runs these in declaration order; each must finish before the next starts.
 */
public enum BootPhase {
    STORAGE,
    LEDGER,
    GOVERNANCE,
    ADMISSION,
    SCHEDULER,
    MAINTENANCE
}
