/**
 * Kernel lifecycle package.
 *
 * <p>{@link io.agentkernel.runtime.AgentKernel} boots the components in a fixed phase order,
 * hands agents their {@link io.agentkernel.runtime.AgentHandle}, and reports queue status and health.
 */
package io.agentkernel.runtime;
