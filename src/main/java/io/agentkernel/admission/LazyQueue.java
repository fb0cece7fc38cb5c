package io.agentkernel.admission;

import io.agentkernel.scheduler.Task;
import io.agentkernel.scheduler.TaskSettlementListener;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Bounded, persistent backlog for LOW work. A slot is taken when a LOW request is admitted and
 * given back once its task is COMPLETED or DEAD, so the capacity bounds LOW work in flight.
 */
public final class LazyQueue implements TaskSettlementListener {
    private static final Logger log = LoggerFactory.getLogger(LazyQueue.class);

    private final Database database;
    private final Backoff backoff;
    private final int capacity;

    public LazyQueue(Database database, Backoff backoff, int capacity) {
        this.database = database;
        this.backoff = backoff;
        this.capacity = Math.max(1, capacity);
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Takes a slot inside the caller's write transaction. False when the queue is full.
     */
    public boolean tryReserve(Connection c, String requestId, String taskId, long nowMs) throws SQLException {
        if (depth(c) >= capacity) {
            return false;
        }
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO lazy_queue(request_id,task_id,enqueued_at_ms) VALUES(?,?,?)")) {
            ps.setString(1, requestId);
            ps.setString(2, taskId);
            ps.setLong(3, nowMs);
            ps.executeUpdate();
        }
        return true;
    }

    public int depth() {
        return backoff.call("lazy queue depth", () -> {
            try (Connection c = database.openConnection()) {
                return depth(c);
            }
        });
    }

    private int depth(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT COUNT(1) FROM lazy_queue");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    @Override
    public void onTaskSettled(Connection c, Task task) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM lazy_queue WHERE task_id=?")) {
            ps.setString(1, task.taskId());
            if (ps.executeUpdate() > 0) {
                log.debug("Lazy queue slot released by task {} ({})", task.taskId(), task.status());
            }
        }
    }
}
