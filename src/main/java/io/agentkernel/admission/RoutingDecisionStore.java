package io.agentkernel.admission;

import com.fasterxml.jackson.core.type.TypeReference;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import io.agentkernel.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SQL for {@code routing_decisions}. Rows are write-once and keyed by request id; the idempotency
 * window is measured on arrival time, and rows that have left it are removed by
 * {@link #purgeArrivedBefore(long)}.
 */
public final class RoutingDecisionStore {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String COLUMNS = "request_id,tier,reason,rejection,concepts,created_task_id,decided_at_ms";

    private final Database database;
    private final Backoff backoff;

    public RoutingDecisionStore(Database database, Backoff backoff) {
        this.database = database;
        this.backoff = backoff;
    }

    public Optional<RoutingDecision> find(String requestId) {
        return backoff.call("find routing decision", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM routing_decisions WHERE request_id=?")) {
                ps.setString(1, requestId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<RoutingDecision>empty();
                }
            }
        });
    }

    public Optional<RoutingDecision> findReplay(String requestId, String contentKey, long arrivedSinceMs) {
        return backoff.call("find replayable decision", () -> {
            try (Connection c = database.openConnection()) {
                return findReplay(c, requestId, contentKey, arrivedSinceMs);
            }
        });
    }

    /**
     * The decision stored under {@code requestId} if there is one, whatever its age. Otherwise the
     * most recent decision for the same content whose request arrived at or after
     * {@code arrivedSinceMs}.
     */
    public Optional<RoutingDecision> findReplay(Connection c, String requestId, String contentKey, long arrivedSinceMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + """
                 FROM routing_decisions
                WHERE request_id=? OR (content_key=? AND arrived_at_ms>=?)
                ORDER BY request_id=? DESC, arrived_at_ms DESC
                LIMIT 1
                """)) {
            ps.setString(1, requestId);
            ps.setString(2, contentKey);
            ps.setLong(3, arrivedSinceMs);
            ps.setString(4, requestId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    public void insert(Connection c, RoutingDecision decision, String contentKey, String sourceAgentId,
                       long arrivedAtMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO routing_decisions(request_id,content_key,source_agent_id,tier,reason,rejection,concepts,created_task_id,decided_at_ms,arrived_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, decision.requestId());
            ps.setString(2, contentKey);
            ps.setString(3, sourceAgentId);
            ps.setString(4, decision.tier().name());
            ps.setString(5, decision.reason());
            if (decision.rejection() == null) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, decision.rejection().name());
            }
            ps.setString(7, Jsons.toCanonicalJson(decision.concepts()));
            if (decision.createdTaskId() == null) {
                ps.setNull(8, Types.VARCHAR);
            } else {
                ps.setString(8, decision.createdTaskId());
            }
            ps.setLong(9, decision.decidedAt().toEpochMilli());
            ps.setLong(10, arrivedAtMs);
            ps.executeUpdate();
        }
    }

    /**
     * Deletes decisions whose request arrived before {@code cutoffMs}. A later submission of the
     * same input is then decided afresh.
     */
    public int purgeArrivedBefore(long cutoffMs) {
        return backoff.call("purge routing decisions", () -> {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement("DELETE FROM routing_decisions WHERE arrived_at_ms<?")) {
                ps.setLong(1, cutoffMs);
                return ps.executeUpdate();
            }
        });
    }

    private RoutingDecision map(ResultSet rs) throws SQLException {
        String rejection = rs.getString("rejection");
        List<String> concepts;
        try {
            concepts = Jsons.mapper().readValue(rs.getString("concepts"), STRING_LIST);
        } catch (Exception e) {
            throw new IllegalStateException("Corrupt concepts column for " + rs.getString("request_id"), e);
        }
        return new RoutingDecision(
                rs.getString("request_id"),
                RoutingTier.valueOf(rs.getString("tier")),
                rs.getString("reason"),
                rs.getString("created_task_id"),
                rejection == null ? null : SecurityRejection.valueOf(rejection),
                concepts,
                Instant.ofEpochMilli(rs.getLong("decided_at_ms")),
                false
        );
    }
}
