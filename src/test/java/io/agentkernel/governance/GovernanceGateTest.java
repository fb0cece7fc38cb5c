package io.agentkernel.governance;

import io.agentkernel.KernelFixtures;
import io.agentkernel.ledger.LedgerEvent;
import io.agentkernel.ledger.LedgerEventType;
import io.agentkernel.runtime.AgentKernel;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

final class GovernanceGateTest {

    @Test
    void validOathRegistersAgentAndRecordsSwornEvent() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-ok-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            AgentRecord agent = KernelFixtures.swear(kernel, "agent-a");

            Assertions.assertEquals(OathStatus.SWORN, agent.oathStatus());
            Assertions.assertTrue(kernel.governance().isSworn("agent-a"));
            Assertions.assertEquals(Set.of("general"), agent.capabilities());

            LedgerEvent sworn = kernel.ledger().stream(0L)
                    .filter(e -> e.eventType() == LedgerEventType.OATH_SWORN)
                    .findFirst().orElseThrow();
            Assertions.assertEquals(sworn.sequenceNumber(), agent.oathEventSequence());
            Assertions.assertEquals(kernel.governance().currentPolicyHash(),
                    sworn.payloadJson().path("policy_hash").asText());

            OathRecord oath = kernel.governance().verify("agent-a");
            Assertions.assertTrue(oath.valid());
            Assertions.assertEquals(sworn.sequenceNumber(), oath.ledgerSequence());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void badSignatureIsRejectedOnceAndNeverRegistered() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-bad-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            Ed25519Keys.EncodedKeyPair claimed = Ed25519Keys.generate();
            Ed25519Keys.EncodedKeyPair other = Ed25519Keys.generate();
            String forged = Ed25519Keys.signOath(other.privateKey(), kernel.governance().currentPolicyHash());

            GovernanceException error = Assertions.assertThrows(GovernanceException.class,
                    () -> kernel.governance().register("agent-x", claimed.publicKey(), Set.of(), forged));

            Assertions.assertEquals(GovernanceError.INVALID_SIGNATURE, error.error());
            Assertions.assertEquals("agent-x", error.agentId());
            Assertions.assertTrue(kernel.governance().find("agent-x").isEmpty());
            Assertions.assertFalse(kernel.governance().isSworn("agent-x"));
            Assertions.assertEquals(1L, KernelFixtures.count(kernel.ledger(), LedgerEventType.OATH_REJECTED));
            Assertions.assertEquals(0L, KernelFixtures.count(kernel.ledger(), LedgerEventType.OATH_SWORN));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void undecodableKeyIsRejectedAsInvalidSignature() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-malformed-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            GovernanceException error = Assertions.assertThrows(GovernanceException.class,
                    () -> kernel.governance().register("agent-m", "not base64 at all", Set.of(), "c2ln"));

            Assertions.assertEquals(GovernanceError.INVALID_SIGNATURE, error.error());
            Assertions.assertTrue(error.getMessage().contains("public key rejected"), error.getMessage());
            Assertions.assertTrue(kernel.governance().listAgents().isEmpty());
            Assertions.assertEquals(1L, KernelFixtures.count(kernel.ledger(), LedgerEventType.OATH_REJECTED));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void secondRegistrationOfSwornAgentIsRefused() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-dup-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            KernelFixtures.swear(kernel, "agent-a");

            GovernanceException error = Assertions.assertThrows(GovernanceException.class,
                    () -> KernelFixtures.swear(kernel, "agent-a"));

            Assertions.assertEquals(GovernanceError.ALREADY_REGISTERED, error.error());
            Assertions.assertEquals(1, kernel.governance().oathHistory("agent-a").size());
            Assertions.assertEquals(1L, KernelFixtures.count(kernel.ledger(), LedgerEventType.OATH_SWORN));
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void policyChangeInvalidatesOathExactlyOnce() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-stale-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            KernelFixtures.swear(kernel, "agent-a");
            String before = kernel.governance().currentPolicyHash();

            Files.writeString(kernel.config().policyFile(), "# Constitution v2\nAgents must log every action.\n",
                    StandardCharsets.UTF_8);
            Assertions.assertNotEquals(before, kernel.governance().currentPolicyHash());

            GovernanceException first = Assertions.assertThrows(GovernanceException.class,
                    () -> kernel.governance().verify("agent-a"));
            GovernanceException second = Assertions.assertThrows(GovernanceException.class,
                    () -> kernel.governance().verify("agent-a"));

            Assertions.assertEquals(GovernanceError.OATH_STALE, first.error());
            Assertions.assertEquals(GovernanceError.OATH_STALE, second.error());
            Assertions.assertEquals(OathStatus.INVALIDATED,
                    kernel.governance().find("agent-a").orElseThrow().oathStatus());
            Assertions.assertFalse(kernel.governance().isSworn("agent-a"));
            Assertions.assertFalse(kernel.governance().oathHistory("agent-a").get(0).valid());
            Assertions.assertEquals(1L, KernelFixtures.count(kernel.ledger(), LedgerEventType.OATH_INVALIDATED));
            Assertions.assertTrue(kernel.agentHandle("agent-a").nextTask().isEmpty());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void invalidatedAgentCanSwearToTheNewPolicy() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-reswear-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            KernelFixtures.swear(kernel, "agent-a");
            KernelFixtures.swear(kernel, "agent-b");
            Files.writeString(kernel.config().policyFile(), "# Constitution v2\n", StandardCharsets.UTF_8);

            List<String> stale = kernel.governance().verifyAll();
            Assertions.assertEquals(List.of("agent-a", "agent-b"), stale.stream().sorted().toList());

            AgentRecord resworn = KernelFixtures.swear(kernel, "agent-a");
            Assertions.assertEquals(OathStatus.SWORN, resworn.oathStatus());
            Assertions.assertEquals(2, kernel.governance().oathHistory("agent-a").size());
            Assertions.assertEquals(kernel.governance().currentPolicyHash(),
                    kernel.governance().verify("agent-a").policyHash());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void unknownAgentCannotBeVerified() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-oath-unknown-");
        try (AgentKernel kernel = KernelFixtures.boot(root)) {
            GovernanceException error = Assertions.assertThrows(GovernanceException.class,
                    () -> kernel.governance().verify("ghost"));
            Assertions.assertEquals(GovernanceError.UNKNOWN_AGENT, error.error());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }
}
