package io.agentkernel.governance;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import io.agentkernel.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * SQL for the {@code agents} and {@code oath_records} tables. Mutating methods take the caller's
 * connection so they join the gate's transaction.
 */
public final class AgentStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String AGENT_COLUMNS =
            "agent_id,public_key,capabilities,oath_status,oath_event_sequence,registered_at_ms,updated_at_ms";
    private static final String OATH_COLUMNS =
            "oath_id,agent_id,policy_hash,signature,sworn_at_ms,valid,ledger_sequence";

    private final Database database;
    private final Backoff backoff;

    public AgentStore(Database database, Backoff backoff) {
        this.database = database;
        this.backoff = backoff;
    }

    public Optional<AgentRecord> find(String agentId) {
        return backoff.call("find agent", () -> {
            try (Connection c = database.openConnection()) {
                return find(c, agentId);
            }
        });
    }

    public Optional<AgentRecord> find(Connection c, String agentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + AGENT_COLUMNS + " FROM agents WHERE agent_id=?")) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapAgent(rs));
            }
        }
    }

    public Optional<OathStatus> oathStatus(String agentId) {
        return backoff.call("read oath status", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT oath_status FROM agents WHERE agent_id=?")) {
                ps.setString(1, agentId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(OathStatus.valueOf(rs.getString(1)));
                }
            }
        });
    }

    public List<AgentRecord> list() {
        return backoff.call("list agents", () -> {
            List<AgentRecord> out = new ArrayList<>();
            try (Connection c = database.openConnection();
                 Statement st = c.createStatement();
                 ResultSet rs = st.executeQuery("SELECT " + AGENT_COLUMNS + " FROM agents ORDER BY agent_id ASC")) {
                while (rs.next()) {
                    out.add(mapAgent(rs));
                }
            }
            return out;
        });
    }

    public List<OathRecord> oathHistory(String agentId) {
        return backoff.call("read oath history", () -> {
            List<OathRecord> out = new ArrayList<>();
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT " + OATH_COLUMNS + " FROM oath_records WHERE agent_id=? ORDER BY oath_id ASC")) {
                ps.setString(1, agentId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapOath(rs));
                    }
                }
            }
            return out;
        });
    }

    public Optional<OathRecord> currentOath(String agentId) {
        return backoff.call("read current oath", () -> {
            try (Connection c = database.openConnection()) {
                return currentOath(c, agentId);
            }
        });
    }

    public Optional<OathRecord> currentOath(Connection c, String agentId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT " + OATH_COLUMNS + " FROM oath_records WHERE agent_id=? ORDER BY oath_id DESC LIMIT 1")) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(mapOath(rs));
            }
        }
    }

    /**
     * Inserts or re-swears an agent. The original registration time survives re-registration.
     */
    public void upsertSworn(Connection c, String agentId, String publicKey, Set<String> capabilities,
                            long oathEventSequence, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO agents(agent_id,public_key,capabilities,oath_status,oath_event_sequence,registered_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET
                    public_key=excluded.public_key,
                    capabilities=excluded.capabilities,
                    oath_status=excluded.oath_status,
                    oath_event_sequence=excluded.oath_event_sequence,
                    updated_at_ms=excluded.updated_at_ms
                """)) {
            ps.setString(1, agentId);
            ps.setString(2, publicKey);
            ps.setString(3, Jsons.toCanonicalJson(new ArrayList<>(new TreeSet<>(capabilities))));
            ps.setString(4, OathStatus.SWORN.name());
            ps.setLong(5, oathEventSequence);
            ps.setLong(6, nowMs);
            ps.setLong(7, nowMs);
            ps.executeUpdate();
        }
    }

    public long insertOath(Connection c, String agentId, String policyHash, String signature,
                           long swornAtMs, long ledgerSequence) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO oath_records(agent_id,policy_hash,signature,sworn_at_ms,valid,ledger_sequence) VALUES(?,?,?,?,1,?)",
                Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, agentId);
            ps.setString(2, policyHash);
            ps.setString(3, signature);
            ps.setLong(4, swornAtMs);
            ps.setLong(5, ledgerSequence);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                return keys.next() ? keys.getLong(1) : -1L;
            }
        }
    }

    /**
     * SWORN to INVALIDATED. Returns false when the agent was not sworn, so the caller records the
     * invalidation at most once.
     */
    public boolean markInvalidated(Connection c, String agentId, long nowMs) throws SQLException {
        try (PreparedStatement agent = c.prepareStatement(
                "UPDATE agents SET oath_status=?,updated_at_ms=? WHERE agent_id=? AND oath_status=?");
             PreparedStatement oaths = c.prepareStatement(
                     "UPDATE oath_records SET valid=0 WHERE agent_id=? AND valid=1")) {
            agent.setString(1, OathStatus.INVALIDATED.name());
            agent.setLong(2, nowMs);
            agent.setString(3, agentId);
            agent.setString(4, OathStatus.SWORN.name());
            if (agent.executeUpdate() == 0) {
                return false;
            }
            oaths.setString(1, agentId);
            oaths.executeUpdate();
            return true;
        }
    }

    private AgentRecord mapAgent(ResultSet rs) throws SQLException {
        long eventSeq = rs.getLong("oath_event_sequence");
        Long oathEventSequence = rs.wasNull() ? null : eventSeq;
        return new AgentRecord(
                rs.getString("agent_id"),
                rs.getString("public_key"),
                parseCapabilities(rs.getString("capabilities")),
                OathStatus.valueOf(rs.getString("oath_status")),
                oathEventSequence,
                Instant.ofEpochMilli(rs.getLong("registered_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms"))
        );
    }

    private OathRecord mapOath(ResultSet rs) throws SQLException {
        return new OathRecord(
                rs.getLong("oath_id"),
                rs.getString("agent_id"),
                rs.getString("policy_hash"),
                rs.getString("signature"),
                Instant.ofEpochMilli(rs.getLong("sworn_at_ms")),
                rs.getInt("valid") == 1,
                rs.getLong("ledger_sequence")
        );
    }

    private static Set<String> parseCapabilities(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        try {
            return Set.copyOf(new LinkedHashSet<>(Jsons.mapper().readValue(raw, STRING_LIST)));
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt capabilities column: " + raw, e);
        }
    }
}
