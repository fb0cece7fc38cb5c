package io.agentkernel.governance;

/**
 * Source of the governing policy document whose hash every oath signs.
 */
@FunctionalInterface
public interface PolicyDocumentProvider {
    byte[] currentPolicy();
}
