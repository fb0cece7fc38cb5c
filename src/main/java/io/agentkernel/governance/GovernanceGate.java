package io.agentkernel.governance;

import io.agentkernel.ledger.LedgerEvent;
import io.agentkernel.ledger.LedgerEventType;
import io.agentkernel.ledger.LedgeredTransactor;
import io.agentkernel.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Admits agents to the registry only after their oath over the current policy hash verifies.
 * This is the sole writer of agent and oath rows.
 */
public final class GovernanceGate implements AgentDirectory {
    private static final Logger log = LoggerFactory.getLogger(GovernanceGate.class);
    static final String ACTOR = "governance";

    private final AgentStore store;
    private final LedgeredTransactor transactor;
    private final PolicyDocumentProvider policy;
    private final SignatureVerifier verifier;

    public GovernanceGate(AgentStore store, LedgeredTransactor transactor,
                          PolicyDocumentProvider policy, SignatureVerifier verifier) {
        this.store = store;
        this.transactor = transactor;
        this.policy = policy;
        this.verifier = verifier;
    }

    public String currentPolicyHash() {
        return Hashing.sha256Hex(policy.currentPolicy());
    }

    public AgentRecord register(String agentId, String publicKey, Set<String> capabilities, String oathSignature) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        String id = agentId.trim();
        Set<String> caps = capabilities == null ? Set.of() : Set.copyOf(capabilities);

        Optional<AgentRecord> existing = store.find(id);
        if (existing.isPresent() && existing.get().isSworn()) {
            throw reject(id, GovernanceError.ALREADY_REGISTERED, "agent is already registered with a sworn oath", null);
        }

        String policyHash = currentPolicyHash();
        boolean verified;
        try {
            verified = verifier.verify(publicKey, policyHash.getBytes(StandardCharsets.UTF_8), oathSignature);
        } catch (GeneralSecurityException e) {
            // An undecodable key can not produce a valid signature.
            throw reject(id, GovernanceError.INVALID_SIGNATURE, "public key rejected: " + e.getMessage(), policyHash);
        }
        if (!verified) {
            throw reject(id, GovernanceError.INVALID_SIGNATURE, "oath signature does not verify", policyHash);
        }

        long nowMs = System.currentTimeMillis();
        AgentRecord registered = transactor.inTransaction("register agent " + id, (c, recorder) -> {
            Optional<AgentRecord> current = store.find(c, id);
            if (current.isPresent() && current.get().isSworn()) {
                return null;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("agent_id", id);
            payload.put("policy_hash", policyHash);
            payload.put("public_key_sha256", Hashing.sha256Hex(publicKey.trim()));
            payload.put("capabilities", new ArrayList<>(new TreeSet<>(caps)));
            payload.put("algorithm", verifier.algorithm());
            LedgerEvent sworn = recorder.record(LedgerEventType.OATH_SWORN, payload, ACTOR);
            store.insertOath(c, id, policyHash, oathSignature.trim(), nowMs, sworn.sequenceNumber());
            store.upsertSworn(c, id, publicKey.trim(), caps, sworn.sequenceNumber(), nowMs);
            return store.find(c, id).orElseThrow();
        });
        if (registered == null) {
            throw reject(id, GovernanceError.ALREADY_REGISTERED, "agent is already registered with a sworn oath", policyHash);
        }
        log.info("Agent {} sworn to policy {} (ledger #{})", id, abbreviate(policyHash), registered.oathEventSequence());
        return registered;
    }

    /**
     * Recomputes the policy hash and checks it against the agent's current oath. A superseded oath
     * invalidates the agent and is recorded once.
     */
    public OathRecord verify(String agentId) {
        AgentRecord agent = store.find(agentId)
                .orElseThrow(() -> new GovernanceException(GovernanceError.UNKNOWN_AGENT, agentId,
                        "agent " + agentId + " is not registered"));
        OathRecord oath = store.currentOath(agentId)
                .orElseThrow(() -> new GovernanceException(GovernanceError.UNKNOWN_AGENT, agentId,
                        "agent " + agentId + " has no oath on record"));
        if (agent.oathStatus() != OathStatus.SWORN) {
            throw new GovernanceException(GovernanceError.OATH_STALE, agentId,
                    "oath of " + agentId + " is " + agent.oathStatus().name());
        }
        String currentHash = currentPolicyHash();
        if (currentHash.equals(oath.policyHash())) {
            return oath;
        }
        long nowMs = System.currentTimeMillis();
        boolean invalidated = transactor.inTransaction("invalidate oath " + agentId, (c, recorder) -> {
            if (!store.markInvalidated(c, agentId, nowMs)) {
                return false;
            }
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("agent_id", agentId);
            payload.put("sworn_policy_hash", oath.policyHash());
            payload.put("current_policy_hash", currentHash);
            payload.put("reason", "policy_changed");
            recorder.record(LedgerEventType.OATH_INVALIDATED, payload, ACTOR);
            return true;
        });
        if (invalidated) {
            log.warn("Oath of agent {} invalidated: policy changed from {} to {}",
                    agentId, abbreviate(oath.policyHash()), abbreviate(currentHash));
        }
        throw new GovernanceException(GovernanceError.OATH_STALE, agentId,
                "oath of " + agentId + " was sworn to policy " + abbreviate(oath.policyHash())
                        + " but the current policy is " + abbreviate(currentHash));
    }

    /**
     * Verifies every sworn agent and returns the ids whose oath went stale.
     */
    public List<String> verifyAll() {
        List<String> stale = new ArrayList<>();
        for (AgentRecord agent : store.list()) {
            if (!agent.isSworn()) {
                continue;
            }
            try {
                verify(agent.agentId());
            } catch (GovernanceException e) {
                if (e.error() == GovernanceError.OATH_STALE) {
                    stale.add(agent.agentId());
                } else {
                    throw e;
                }
            }
        }
        return stale;
    }

    @Override
    public boolean isSworn(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return false;
        }
        return store.oathStatus(agentId.trim()).map(s -> s == OathStatus.SWORN).orElse(false);
    }

    public Optional<AgentRecord> find(String agentId) {
        return store.find(agentId);
    }

    public List<AgentRecord> listAgents() {
        return store.list();
    }

    public List<OathRecord> oathHistory(String agentId) {
        return store.oathHistory(agentId);
    }

    private GovernanceException reject(String agentId, GovernanceError error, String reason, String policyHash) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", agentId);
        payload.put("error", error.name());
        payload.put("reason", reason);
        if (policyHash != null) {
            payload.put("policy_hash", policyHash);
        }
        transactor.inTransaction("record oath rejection " + agentId, (c, recorder) ->
                recorder.record(LedgerEventType.OATH_REJECTED, payload, ACTOR));
        log.warn("Oath rejected for agent {}: {} ({})", agentId, error, reason);
        return new GovernanceException(error, agentId, reason);
    }

    private static String abbreviate(String hash) {
        return hash == null || hash.length() <= 12 ? String.valueOf(hash) : hash.substring(0, 12);
    }
}
