package io.agentkernel.scheduler;

import io.agentkernel.admission.RoutingTier;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQL for the {@code tasks} table. Every status change is a compare-and-set on the expected status
 * and claim epoch, so a stale caller updates zero rows instead of clobbering a newer claim.
 */
public final class TaskStore {
    private static final String COLUMNS = """
            seq,task_id,request_id,source_agent_id,payload,tier,placement_rank,user_priority,status,claimed_by,
            claim_epoch,attempt_count,max_retries,result_payload,last_error,created_at_ms,claimed_at_ms,
            started_at_ms,completed_at_ms,updated_at_ms""";

    private final Database database;
    private final Backoff backoff;

    public TaskStore(Database database, Backoff backoff) {
        this.database = database;
        this.backoff = backoff;
    }

    public void insert(Connection c, TaskDraft draft, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO tasks(task_id,request_id,source_agent_id,payload,tier,tier_rank,placement_rank,user_priority,
                                  status,claim_epoch,attempt_count,max_retries,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,0,0,?,?,?)
                """)) {
            ps.setString(1, draft.taskId());
            ps.setString(2, draft.requestId());
            ps.setString(3, draft.sourceAgentId());
            ps.setString(4, draft.payload());
            ps.setString(5, draft.tier().name());
            ps.setInt(6, draft.tier().schedulingRank());
            ps.setLong(7, draft.placementRank().value());
            ps.setInt(8, draft.userPriority());
            ps.setString(9, TaskStatus.PENDING.name());
            ps.setInt(10, draft.maxRetries());
            ps.setLong(11, nowMs);
            ps.setLong(12, nowMs);
            ps.executeUpdate();
        }
    }

    public Optional<Task> find(String taskId) {
        return backoff.call("find task", () -> {
            try (Connection c = database.openConnection()) {
                return find(c, taskId);
            }
        });
    }

    public Optional<Task> find(Connection c, String taskId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + " FROM tasks WHERE task_id=?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(map(rs));
            }
        }
    }

    /**
     * Head of the pending queue: tier, placement rank, user priority (desc), age, insertion order.
     */
    public Optional<Task> nextPending(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS + """
                 FROM tasks
                WHERE status=?
                ORDER BY tier_rank ASC, placement_rank ASC, user_priority DESC, created_at_ms ASC, seq ASC
                LIMIT 1
                """)) {
            ps.setString(1, TaskStatus.PENDING.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(map(rs));
            }
        }
    }

    public boolean claim(Connection c, String taskId, String agentId, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,claimed_by=?,claim_epoch=claim_epoch+1,claimed_at_ms=?,started_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND status=?
                """)) {
            ps.setString(1, TaskStatus.CLAIMED.name());
            ps.setString(2, agentId);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, taskId);
            ps.setString(6, TaskStatus.PENDING.name());
            return ps.executeUpdate() == 1;
        }
    }

    public boolean markStarted(Connection c, Task task, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,started_at_ms=?,updated_at_ms=?
                WHERE task_id=? AND status=? AND claimed_by=? AND claim_epoch=?
                """)) {
            ps.setString(1, TaskStatus.IN_PROGRESS.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, task.taskId());
            ps.setString(5, TaskStatus.CLAIMED.name());
            ps.setString(6, task.agentId());
            ps.setLong(7, task.claimEpoch());
            return ps.executeUpdate() == 1;
        }
    }

    public boolean markCompleted(Connection c, Task task, String resultPayload, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,result_payload=?,completed_at_ms=?,updated_at_ms=?
                WHERE task_id=? AND status=? AND claim_epoch=?
                """)) {
            ps.setString(1, TaskStatus.COMPLETED.name());
            setNullableString(ps, 2, resultPayload);
            ps.setLong(3, nowMs);
            ps.setLong(4, nowMs);
            ps.setString(5, task.taskId());
            ps.setString(6, task.status().name());
            ps.setLong(7, task.claimEpoch());
            return ps.executeUpdate() == 1;
        }
    }

    public boolean markFailed(Connection c, Task task, int attemptCount, String error, String resultPayload,
                              long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,attempt_count=?,last_error=?,result_payload=?,updated_at_ms=?
                WHERE task_id=? AND status=? AND claim_epoch=?
                """)) {
            ps.setString(1, TaskStatus.FAILED.name());
            ps.setInt(2, attemptCount);
            setNullableString(ps, 3, error);
            setNullableString(ps, 4, resultPayload);
            ps.setLong(5, nowMs);
            ps.setString(6, task.taskId());
            ps.setString(7, task.status().name());
            ps.setLong(8, task.claimEpoch());
            return ps.executeUpdate() == 1;
        }
    }

    /**
     * Back to the queue. The claim epoch is kept so that the next claim supersedes the old owner.
     */
    public boolean requeue(Connection c, String taskId, TaskStatus expected, long expectedEpoch, long nowMs)
            throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,claimed_by=NULL,claimed_at_ms=NULL,started_at_ms=NULL,updated_at_ms=?
                WHERE task_id=? AND status=? AND claim_epoch=?
                """)) {
            ps.setString(1, TaskStatus.PENDING.name());
            ps.setLong(2, nowMs);
            ps.setString(3, taskId);
            ps.setString(4, expected.name());
            ps.setLong(5, expectedEpoch);
            return ps.executeUpdate() == 1;
        }
    }

    public boolean markDead(Connection c, String taskId, long expectedEpoch, long nowMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                UPDATE tasks SET status=?,completed_at_ms=?,updated_at_ms=?
                WHERE task_id=? AND status=? AND claim_epoch=?
                """)) {
            ps.setString(1, TaskStatus.DEAD.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, nowMs);
            ps.setString(4, taskId);
            ps.setString(5, TaskStatus.FAILED.name());
            ps.setLong(6, expectedEpoch);
            return ps.executeUpdate() == 1;
        }
    }

    public List<Task> listByStatusOlderThan(Connection c, TaskStatus status, String timeColumn, long cutoffMs, int limit)
            throws SQLException {
        if (!"claimed_at_ms".equals(timeColumn) && !"started_at_ms".equals(timeColumn)) {
            throw new IllegalArgumentException("unsupported time column: " + timeColumn);
        }
        List<Task> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("SELECT " + COLUMNS
                + " FROM tasks WHERE status=? AND " + timeColumn + "<=? ORDER BY " + timeColumn + " ASC LIMIT ?")) {
            ps.setString(1, status.name());
            ps.setLong(2, cutoffMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
        }
        return out;
    }

    public List<Task> list(TaskStatus status, int limit) {
        return backoff.call("list tasks", () -> {
            List<Task> out = new ArrayList<>();
            String sql = status == null
                    ? "SELECT " + COLUMNS + " FROM tasks ORDER BY seq DESC LIMIT ?"
                    : "SELECT " + COLUMNS + " FROM tasks WHERE status=? ORDER BY seq DESC LIMIT ?";
            try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
                int idx = 1;
                if (status != null) {
                    ps.setString(idx++, status.name());
                }
                ps.setInt(idx, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(map(rs));
                    }
                }
            }
            return out;
        });
    }

    public TaskCounts counts() {
        return backoff.call("count tasks", () -> {
            Map<TaskStatus, Long> byStatus = new EnumMap<>(TaskStatus.class);
            Map<String, Long> pendingByTier = new LinkedHashMap<>();
            for (RoutingTier tier : List.of(RoutingTier.HIGH, RoutingTier.MEDIUM, RoutingTier.LOW)) {
                pendingByTier.put(tier.name(), 0L);
            }
            try (Connection c = database.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("SELECT status, COUNT(1) FROM tasks GROUP BY status")) {
                    while (rs.next()) {
                        byStatus.put(TaskStatus.valueOf(rs.getString(1)), rs.getLong(2));
                    }
                }
                try (ResultSet rs = st.executeQuery(
                        "SELECT tier, COUNT(1) FROM tasks WHERE status='PENDING' GROUP BY tier")) {
                    while (rs.next()) {
                        pendingByTier.put(rs.getString(1), rs.getLong(2));
                    }
                }
            }
            return new TaskCounts(
                    byStatus.getOrDefault(TaskStatus.PENDING, 0L),
                    byStatus.getOrDefault(TaskStatus.CLAIMED, 0L),
                    byStatus.getOrDefault(TaskStatus.IN_PROGRESS, 0L),
                    byStatus.getOrDefault(TaskStatus.COMPLETED, 0L),
                    byStatus.getOrDefault(TaskStatus.FAILED, 0L),
                    byStatus.getOrDefault(TaskStatus.DEAD, 0L),
                    Map.copyOf(pendingByTier)
            );
        });
    }

    private static void setNullableString(PreparedStatement ps, int idx, String value) throws SQLException {
        if (value == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, value);
        }
    }

    private static Instant instantOrNull(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private Task map(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("task_id"),
                rs.getLong("seq"),
                rs.getString("request_id"),
                rs.getString("source_agent_id"),
                rs.getString("claimed_by"),
                rs.getString("payload"),
                RoutingTier.valueOf(rs.getString("tier")),
                new PlacementRank(rs.getLong("placement_rank")),
                rs.getInt("user_priority"),
                TaskStatus.valueOf(rs.getString("status")),
                rs.getLong("claim_epoch"),
                rs.getInt("attempt_count"),
                rs.getInt("max_retries"),
                rs.getString("result_payload"),
                rs.getString("last_error"),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                instantOrNull(rs, "claimed_at_ms"),
                instantOrNull(rs, "started_at_ms"),
                instantOrNull(rs, "completed_at_ms"),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms"))
        );
    }
}
