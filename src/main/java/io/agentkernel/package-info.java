/**
 * Agent kernel source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentkernel.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.agentkernel.cli.KernelCommand} maps commands to kernel APIs.</li>
 *   <li>{@code io.agentkernel.runtime.AgentKernel} wires storage, ledger, governance, admission and scheduling.</li>
 *   <li>{@code io.agentkernel.ledger.Ledger} is the append-only, hash-chained record of every decision.</li>
 * </ul>
 */
package io.agentkernel;
