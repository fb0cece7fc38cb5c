package io.agentkernel.scheduler;

import io.agentkernel.governance.AgentDirectory;
import io.agentkernel.ledger.LedgerEventType;
import io.agentkernel.ledger.LedgeredTransactor;
import io.agentkernel.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of task state. Selection and claim happen under {@link #claimLock} inside one immediate
 * transaction, so concurrent callers never receive the same task. Each transition is recorded on
 * the ledger before its row change commits.
 */
public final class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);
    static final String SYSTEM_ACTOR = "scheduler";
    private static final int SWEEP_BATCH = 500;

    private final TaskStore store;
    private final LedgeredTransactor transactor;
    private final AgentDirectory directory;
    private final long claimTimeoutMs;
    private final long inProgressDeadlineMs;
    private final ReentrantLock claimLock = new ReentrantLock();
    private final List<TaskSettlementListener> settlementListeners = new CopyOnWriteArrayList<>();

    public TaskScheduler(TaskStore store, LedgeredTransactor transactor, AgentDirectory directory,
                         long claimTimeoutMs, long inProgressDeadlineMs) {
        this.store = store;
        this.transactor = transactor;
        this.directory = directory;
        this.claimTimeoutMs = claimTimeoutMs;
        this.inProgressDeadlineMs = inProgressDeadlineMs;
    }

    public void addSettlementListener(TaskSettlementListener listener) {
        settlementListeners.add(listener);
    }

    /**
     * Creates a PENDING task inside the caller's transaction and records TASK_CREATED.
     */
    public Task createTask(Connection c, LedgeredTransactor.Recorder recorder, TaskDraft draft) throws SQLException {
        long nowMs = System.currentTimeMillis();
        store.insert(c, draft, nowMs);
        Task task = store.find(c, draft.taskId()).orElseThrow();
        Map<String, Object> payload = taskPayload(task);
        payload.put("request_id", task.requestId());
        payload.put("source_agent_id", task.sourceAgentId());
        payload.put("max_retries", task.maxRetries());
        recorder.record(LedgerEventType.TASK_CREATED, payload, SYSTEM_ACTOR);
        return task;
    }

    public Optional<Task> getNextTask(String agentId) {
        if (agentId == null || agentId.isBlank() || !directory.isSworn(agentId)) {
            log.debug("Agent {} is not sworn, no task handed out", agentId);
            return Optional.empty();
        }
        claimLock.lock();
        try {
            return transactor.inTransaction("claim next task for " + agentId, (c, recorder) -> {
                Optional<Task> candidate = store.nextPending(c);
                if (candidate.isEmpty()) {
                    return Optional.<Task>empty();
                }
                long nowMs = System.currentTimeMillis();
                if (!store.claim(c, candidate.get().taskId(), agentId, nowMs)) {
                    return Optional.<Task>empty();
                }
                Task claimed = store.find(c, candidate.get().taskId()).orElseThrow();
                Map<String, Object> payload = taskPayload(claimed);
                payload.put("agent_id", agentId);
                payload.put("claim_epoch", claimed.claimEpoch());
                recorder.record(LedgerEventType.TASK_CLAIMED, payload, agentId);
                return Optional.of(claimed);
            });
        } finally {
            claimLock.unlock();
        }
    }

    /**
     * CLAIMED to IN_PROGRESS for the owning agent.
     */
    public Task startTask(String taskId, String agentId) {
        return transactor.inTransaction("start task " + taskId, (c, recorder) -> {
            Task task = requireOwned(c, taskId, agentId);
            if (task.status() != TaskStatus.CLAIMED) {
                throw new SchedulingException(SchedulingError.INVALID_STATE, taskId,
                        "task " + taskId + " is " + task.status() + ", expected CLAIMED");
            }
            return start(c, recorder, task, agentId, System.currentTimeMillis(), false);
        });
    }

    /**
     * Settles a CLAIMED or IN_PROGRESS task owned by {@code agentId}. A report on a CLAIMED task
     * first records the start it skipped, marked {@code implicit}, so the ledger always shows
     * IN_PROGRESS before the outcome.
     */
    public Task reportTaskResult(String taskId, String agentId, ReportStatus status, String resultPayload) {
        if (status == null) {
            throw new IllegalArgumentException("report status is required");
        }
        Task result = transactor.inTransaction("report task " + taskId, (c, recorder) -> {
            Task owned = requireOwned(c, taskId, agentId);
            long nowMs = System.currentTimeMillis();
            Task task = owned.status() == TaskStatus.CLAIMED
                    ? start(c, recorder, owned, agentId, nowMs, true)
                    : owned;
            if (status == ReportStatus.COMPLETED) {
                if (!store.markCompleted(c, task, resultPayload, nowMs)) {
                    throw conflict(taskId);
                }
                Task completed = store.find(c, taskId).orElseThrow();
                Map<String, Object> payload = taskPayload(completed);
                payload.put("agent_id", agentId);
                payload.put("result_hash", resultPayload == null ? null : Hashing.sha256Hex(resultPayload));
                recorder.record(LedgerEventType.TASK_COMPLETED, payload, agentId);
                settle(c, completed);
                return completed;
            }
            return fail(c, recorder, task, "agent_reported_failure", resultPayload, agentId, nowMs);
        });
        log.info("Task {} reported {} by {} -> {}", taskId, status, agentId, result.status());
        return result;
    }

    /**
     * Returns claims nobody started within the claim timeout to the queue.
     */
    public int reclaimExpiredClaims() {
        long nowMs = System.currentTimeMillis();
        int reclaimed = transactor.inTransaction("reclaim expired claims", (c, recorder) -> {
            int count = 0;
            List<Task> expired = store.listByStatusOlderThan(c, TaskStatus.CLAIMED, "claimed_at_ms",
                    nowMs - claimTimeoutMs, SWEEP_BATCH);
            for (Task task : expired) {
                if (!store.requeue(c, task.taskId(), TaskStatus.CLAIMED, task.claimEpoch(), nowMs)) {
                    continue;
                }
                Map<String, Object> payload = taskPayload(store.find(c, task.taskId()).orElseThrow());
                payload.put("reason", "claim_timeout");
                payload.put("previous_agent_id", task.agentId());
                recorder.record(LedgerEventType.TASK_REQUEUED, payload, SYSTEM_ACTOR);
                count++;
            }
            return count;
        });
        if (reclaimed > 0) {
            log.warn("Reclaimed {} task(s) whose claim expired after {} ms", reclaimed, claimTimeoutMs);
        }
        return reclaimed;
    }

    /**
     * Fails IN_PROGRESS tasks past their deadline. Agents are not interrupted; a late report hits
     * INVALID_STATE or NOT_OWNER.
     */
    public int failOverdue() {
        long nowMs = System.currentTimeMillis();
        int failed = transactor.inTransaction("fail overdue tasks", (c, recorder) -> {
            int count = 0;
            List<Task> overdue = store.listByStatusOlderThan(c, TaskStatus.IN_PROGRESS, "started_at_ms",
                    nowMs - inProgressDeadlineMs, SWEEP_BATCH);
            for (Task task : overdue) {
                fail(c, recorder, task, "deadline_exceeded", null, SYSTEM_ACTOR, nowMs);
                count++;
            }
            return count;
        });
        if (failed > 0) {
            log.warn("Failed {} task(s) that ran past the {} ms deadline", failed, inProgressDeadlineMs);
        }
        return failed;
    }

    private Task start(Connection c, LedgeredTransactor.Recorder recorder, Task task, String agentId, long nowMs,
                       boolean implicit) throws SQLException {
        if (!store.markStarted(c, task, nowMs)) {
            throw conflict(task.taskId());
        }
        Task started = store.find(c, task.taskId()).orElseThrow();
        Map<String, Object> payload = taskPayload(started);
        payload.put("agent_id", agentId);
        if (implicit) {
            payload.put("implicit", true);
        }
        recorder.record(LedgerEventType.TASK_STARTED, payload, agentId);
        return started;
    }

    public Optional<Task> getTask(String taskId) {
        return store.find(taskId);
    }

    public List<Task> listTasks(TaskStatus status, int limit) {
        return store.list(status, limit);
    }

    public TaskCounts counts() {
        return store.counts();
    }

    private Task fail(Connection c, LedgeredTransactor.Recorder recorder, Task task, String error,
                      String resultPayload, String actor, long nowMs) throws SQLException {
        int attempts = task.attemptCount() + 1;
        if (!store.markFailed(c, task, attempts, error, resultPayload, nowMs)) {
            throw conflict(task.taskId());
        }
        Map<String, Object> failedPayload = taskPayload(store.find(c, task.taskId()).orElseThrow());
        failedPayload.put("agent_id", task.agentId());
        failedPayload.put("error", error);
        recorder.record(LedgerEventType.TASK_FAILED, failedPayload, actor);

        if (attempts < task.maxRetries()) {
            if (!store.requeue(c, task.taskId(), TaskStatus.FAILED, task.claimEpoch(), nowMs)) {
                throw conflict(task.taskId());
            }
            Task requeued = store.find(c, task.taskId()).orElseThrow();
            Map<String, Object> payload = taskPayload(requeued);
            payload.put("reason", "retry");
            payload.put("previous_agent_id", task.agentId());
            recorder.record(LedgerEventType.TASK_REQUEUED, payload, SYSTEM_ACTOR);
            return requeued;
        }
        if (!store.markDead(c, task.taskId(), task.claimEpoch(), nowMs)) {
            throw conflict(task.taskId());
        }
        Task dead = store.find(c, task.taskId()).orElseThrow();
        Map<String, Object> payload = taskPayload(dead);
        payload.put("last_error", error);
        recorder.record(LedgerEventType.TASK_DEAD, payload, SYSTEM_ACTOR);
        settle(c, dead);
        log.warn("Task {} is DEAD after {} failed attempt(s)", task.taskId(), attempts);
        return dead;
    }

    private Task requireOwned(Connection c, String taskId, String agentId) throws SQLException {
        Task task = store.find(c, taskId)
                .orElseThrow(() -> new SchedulingException(SchedulingError.NOT_FOUND, taskId,
                        "task " + taskId + " does not exist"));
        if (!task.status().isClaimed()) {
            throw new SchedulingException(SchedulingError.INVALID_STATE, taskId,
                    "task " + taskId + " is " + task.status() + ", expected CLAIMED or IN_PROGRESS");
        }
        if (agentId == null || !agentId.equals(task.agentId())) {
            throw new SchedulingException(SchedulingError.NOT_OWNER, taskId,
                    "task " + taskId + " is not owned by " + agentId);
        }
        return task;
    }

    private void settle(Connection c, Task task) throws SQLException {
        for (TaskSettlementListener listener : settlementListeners) {
            listener.onTaskSettled(c, task);
        }
    }

    private static SchedulingException conflict(String taskId) {
        return new SchedulingException(SchedulingError.INVALID_STATE, taskId,
                "task " + taskId + " changed concurrently, re-read it before retrying");
    }

    private static Map<String, Object> taskPayload(Task task) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", task.taskId());
        payload.put("status", task.status().name());
        payload.put("tier", task.tier().name());
        payload.put("placement_rank", task.placementRank().value());
        payload.put("user_priority", task.userPriority());
        payload.put("attempt_count", task.attemptCount());
        return payload;
    }
}
