package io.agentkernel.runtime;

import io.agentkernel.KernelFixtures;
import io.agentkernel.config.KernelConfig;
import io.agentkernel.error.LedgerCorruptionException;
import io.agentkernel.governance.AgentRecord;
import io.agentkernel.governance.Ed25519Keys;
import io.agentkernel.governance.GovernanceException;
import io.agentkernel.ledger.LedgerHead;
import io.agentkernel.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

final class AgentKernelTest {

    @Test
    void bootRunsEveryPhaseInOrder() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-boot-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            AgentKernel.HealthOutcome health = kernel.health();

            Assertions.assertTrue(health.ok());
            Assertions.assertTrue(health.booted());
            Assertions.assertFalse(health.degraded());
            Assertions.assertEquals(Arrays.asList(BootPhase.values()), health.completedPhases());
            Assertions.assertEquals(-1L, health.ledgerHead());
            Assertions.assertTrue(health.capabilities().ed25519Available());
            Assertions.assertFalse(health.capabilities().maintenanceLoop());
            Assertions.assertTrue(Files.exists(kernel.config().dbFile()));
            Assertions.assertTrue(Files.exists(kernel.config().ledgerFile()));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void unbootedKernelRefusesWork() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-unbooted-");
        AgentKernel kernel = new AgentKernel(KernelConfig.fromRoot(root.toString()),
                KernelFixtures.quietSettings(), Collaborators.defaults());
        try {
            Assertions.assertThrows(IllegalStateException.class, () -> kernel.admit("hello", "agent-a"));
            kernel.shutdown();
            Assertions.assertThrows(IllegalStateException.class, kernel::boot);
        } finally {
            kernel.shutdown();
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void queueStatusReflectsTasksAndLazyQueue() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-status-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            kernel.admit("Investigate the memory leak in the indexer", "agent-a");
            kernel.admit("schedule cleanup of temp files", "agent-a");
            kernel.admit("status", "agent-a");

            AgentKernel.QueueStatus status = kernel.queueStatus();
            Assertions.assertEquals(3L, status.tasks().pending());
            Assertions.assertEquals(1L, status.tasks().pendingByTier().get("HIGH"));
            Assertions.assertEquals(1L, status.tasks().pendingByTier().get("MEDIUM"));
            Assertions.assertEquals(1L, status.tasks().pendingByTier().get("LOW"));
            Assertions.assertEquals(1, status.lazyQueueDepth());
            Assertions.assertEquals(kernel.settings().lazyQueueCapacity(), status.lazyQueueCapacity());
            Assertions.assertFalse(status.degraded());
            Assertions.assertNull(status.haltCause());
            Assertions.assertEquals(kernel.ledger().size(), status.ledgerSize());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void restartResumesChainAndState() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-restart-");
        try {
            LedgerHead headBefore;
            String taskId;
            try (AgentKernel first = KernelFixtures.boot(root)) {
                KernelFixtures.swear(first, "worker");
                taskId = first.admit("Prepare the capacity plan", "agent-a").createdTaskId();
                headBefore = first.ledger().head();
            }

            try (AgentKernel second = KernelFixtures.boot(root)) {
                Assertions.assertEquals(headBefore, second.ledger().head());
                Assertions.assertTrue(second.governance().isSworn("worker"));
                Assertions.assertEquals(taskId, second.agentHandle("worker").nextTask().orElseThrow().taskId());
                Assertions.assertEquals(headBefore.sequenceNumber() + 1L, second.ledger().head().sequenceNumber());
                Assertions.assertTrue(second.verifyChain().ok());
            }
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void tamperedLedgerStopsBootAndReportsDegraded() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-tamper-");
        try {
            try (AgentKernel kernel = KernelFixtures.boot(root)) {
                KernelFixtures.swear(kernel, "worker");
                kernel.admit("Prepare the capacity plan", "agent-a");
            }
            Path ledgerFile = KernelConfig.fromRoot(root.toString()).ledgerFile();
            try (Connection c = DriverManager.getConnection(Database.jdbcUrl(ledgerFile));
                 PreparedStatement ps = c.prepareStatement(
                         "UPDATE ledger_events SET actor='mallory' WHERE sequence_number=1")) {
                Assertions.assertEquals(1, ps.executeUpdate());
            }

            AgentKernel kernel = new AgentKernel(KernelConfig.fromRoot(root.toString()),
                    KernelFixtures.quietSettings(), Collaborators.defaults());
            try {
                LedgerCorruptionException error = Assertions.assertThrows(LedgerCorruptionException.class, kernel::boot);
                Assertions.assertEquals(1L, error.sequenceNumber());

                AgentKernel.HealthOutcome health = kernel.health();
                Assertions.assertFalse(health.ok());
                Assertions.assertTrue(health.degraded());
                Assertions.assertEquals(1L, health.haltSequence());
                Assertions.assertTrue(health.haltCause().contains("hash_mismatch"));
                Assertions.assertEquals(List.of(BootPhase.STORAGE), health.completedPhases());
                Assertions.assertTrue(kernel.isHalted());
            } finally {
                kernel.shutdown();
            }
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void emptyLedgerOverExistingStateIsRefused() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-lost-ledger-");
        try {
            try (AgentKernel kernel = KernelFixtures.boot(root)) {
                KernelFixtures.swear(kernel, "worker");
            }
            Path ledgerRoot = KernelConfig.fromRoot(root.toString()).ledgerRoot();
            KernelFixtures.deleteRecursively(ledgerRoot);

            AgentKernel kernel = new AgentKernel(KernelConfig.fromRoot(root.toString()),
                    KernelFixtures.quietSettings(), Collaborators.defaults());
            try {
                Assertions.assertThrows(LedgerCorruptionException.class, kernel::boot);
                Assertions.assertTrue(kernel.isHalted());
            } finally {
                kernel.shutdown();
            }
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void bootAgentsRegistersNewcomersAndReverifiesSwornAgents() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-boot-agents-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            Ed25519Keys.EncodedKeyPair keys = Ed25519Keys.generate();
            String signature = Ed25519Keys.signOath(keys.privateKey(), kernel.governance().currentPolicyHash());
            AgentRegistration registration = new AgentRegistration("planner", keys.publicKey(), Set.of("plan"), signature);

            List<AgentRecord> first = kernel.bootAgents(List.of(registration));
            List<AgentRecord> again = kernel.bootAgents(List.of(registration));
            Assertions.assertEquals(first.get(0).oathEventSequence(), again.get(0).oathEventSequence());

            Files.writeString(kernel.config().policyFile(), "# amended\n", StandardCharsets.UTF_8);
            Assertions.assertThrows(GovernanceException.class, () -> kernel.bootAgents(List.of(registration)));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void maintenanceLoopFailsOverdueWork() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-kernel-maintenance-");
        Files.writeString(root.resolve("kernel-settings.json"), """
                {
                  "inProgressDeadlineMs": 1,
                  "maintenanceIntervalMs": 20,
                  "defaultMaxRetries": 1
                }
                """, StandardCharsets.UTF_8);
        try (AgentKernel kernel = new AgentKernel(KernelConfig.fromRoot(root.toString()))) {
            kernel.boot();
            Assertions.assertTrue(kernel.capabilities().maintenanceLoop());
            KernelFixtures.swear(kernel, "worker");
            String taskId = kernel.admit("Reconcile the ledger exports", "agent-a").createdTaskId();
            AgentHandle worker = kernel.agentHandle("worker");
            worker.nextTask().orElseThrow();
            worker.start(taskId);

            long deadline = System.currentTimeMillis() + 10_000L;
            while (System.currentTimeMillis() < deadline
                    && !kernel.scheduler().getTask(taskId).orElseThrow().status().isTerminal()) {
                Thread.sleep(20L);
            }
            Assertions.assertEquals("DEAD", kernel.scheduler().getTask(taskId).orElseThrow().status().name());
            Assertions.assertEquals("deadline_exceeded", kernel.scheduler().getTask(taskId).orElseThrow().lastError());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }
}
