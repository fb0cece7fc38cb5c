package io.agentkernel;

import io.agentkernel.config.KernelConfig;
import io.agentkernel.config.KernelSettings;
import io.agentkernel.governance.AgentRecord;
import io.agentkernel.governance.Ed25519Keys;
import io.agentkernel.ledger.Ledger;
import io.agentkernel.ledger.LedgerEventType;
import io.agentkernel.runtime.AgentKernel;
import io.agentkernel.runtime.Collaborators;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Shared helpers for tests that need a booted kernel over a temporary root.
 */
public final class KernelFixtures {
    private KernelFixtures() {
    }

    public static KernelSettings quietSettings() {
        return KernelSettings.defaults().withMaintenanceIntervalMs(0L);
    }

    public static AgentKernel boot(Path root) {
        return boot(root, quietSettings(), Collaborators.defaults());
    }

    public static AgentKernel boot(Path root, KernelSettings settings, Collaborators collaborators) {
        AgentKernel kernel = new AgentKernel(KernelConfig.fromRoot(root.toString()), settings, collaborators);
        kernel.boot();
        return kernel;
    }

    /**
     * Generates a key pair, signs the kernel's current policy hash and registers the agent.
     */
    public static AgentRecord swear(AgentKernel kernel, String agentId) {
        Ed25519Keys.EncodedKeyPair keys = Ed25519Keys.generate();
        String signature = Ed25519Keys.signOath(keys.privateKey(), kernel.governance().currentPolicyHash());
        return kernel.governance().register(agentId, keys.publicKey(), Set.of("general"), signature);
    }

    public static long count(Ledger ledger, LedgerEventType type) {
        return ledger.stream(0L).filter(e -> e.eventType() == type).count();
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
