package io.agentkernel.admission;

import io.agentkernel.ledger.LedgerEventType;
import io.agentkernel.ledger.LedgeredTransactor;
import io.agentkernel.scheduler.PlacementRank;
import io.agentkernel.scheduler.PlacementService;
import io.agentkernel.scheduler.TaskDraft;
import io.agentkernel.scheduler.TaskScheduler;
import io.agentkernel.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns raw input into a {@link RoutingDecision}: security filter, intent classification, then a
 * task for HIGH and MEDIUM work or a lazy-queue slot plus task for LOW work. Every outcome is
 * recorded as exactly one REQUEST_ADMITTED or REQUEST_BLOCKED event.
 */
public final class AdmissionRouter {
    private static final Logger log = LoggerFactory.getLogger(AdmissionRouter.class);

    public static final String REASON_QUEUE_SATURATED = "queue_saturated";
    public static final String REASON_CLASSIFIER_TIMEOUT = "classifier_timeout";
    public static final String REASON_CLASSIFIER_ERROR = "classifier_error";
    public static final int DEFAULT_USER_PRIORITY = 0;
    static final String ACTOR = "router";

    private final SecurityFilter securityFilter;
    private final IntentClassifier classifier;
    private final ExecutorService classifierExecutor;
    private final ExecutorService routerPool;
    private final LazyQueue lazyQueue;
    private final RoutingDecisionStore decisions;
    private final TaskScheduler scheduler;
    private final PlacementService placement;
    private final LedgeredTransactor transactor;
    private final Options options;

    public AdmissionRouter(SecurityFilter securityFilter,
                           IntentClassifier classifier,
                           ExecutorService classifierExecutor,
                           ExecutorService routerPool,
                           LazyQueue lazyQueue,
                           RoutingDecisionStore decisions,
                           TaskScheduler scheduler,
                           PlacementService placement,
                           LedgeredTransactor transactor,
                           Options options) {
        this.securityFilter = securityFilter;
        this.classifier = classifier;
        this.classifierExecutor = classifierExecutor;
        this.routerPool = routerPool;
        this.lazyQueue = lazyQueue;
        this.decisions = decisions;
        this.scheduler = scheduler;
        this.placement = placement == null ? PlacementService.uniform() : placement;
        this.transactor = transactor;
        this.options = options;
    }

    public RoutingDecision admit(String rawInput, String sourceAgentId) {
        return admit(rawInput, sourceAgentId, DEFAULT_USER_PRIORITY, Instant.now());
    }

    public RoutingDecision admit(String rawInput, String sourceAgentId, int userPriority) {
        return admit(rawInput, sourceAgentId, userPriority, Instant.now());
    }

    public RoutingDecision admit(String rawInput, String sourceAgentId, int userPriority, Instant arrival) {
        String raw = rawInput == null ? "" : rawInput;
        String source = sourceAgentId == null || sourceAgentId.isBlank() ? "unknown" : sourceAgentId.trim();
        Instant arrivedAt = arrival == null ? Instant.now() : arrival;
        String requestId = requestId(raw, arrivedAt);
        String contentKey = contentKey(source, raw);
        long arrivedAtMs = arrivedAt.toEpochMilli();
        long windowStartMs = arrivedAtMs - options.idempotencyWindowMs();

        Optional<RoutingDecision> replay = decisions.findReplay(requestId, contentKey, windowStartMs);
        if (replay.isPresent()) {
            log.debug("Request {} from {} replayed decision {}", requestId, source, replay.get().requestId());
            return replay.get().asReplay();
        }

        SecurityVerdict verdict = securityFilter.inspect(raw);
        if (verdict.blocked()) {
            return recordBlocked(requestId, contentKey, source, raw, arrivedAtMs, windowStartMs, verdict);
        }

        Classification classification = classify(raw);
        PlacementRank rank = placement.rankFor(source, raw, classification.tier());
        return recordAccepted(requestId, contentKey, source, raw, userPriority, arrivedAtMs, windowStartMs,
                classification, rank);
    }

    /**
     * Runs {@link #admit(String, String, int)} on the bounded router pool.
     */
    public CompletableFuture<RoutingDecision> admitAsync(String rawInput, String sourceAgentId, int userPriority) {
        Instant arrival = Instant.now();
        return CompletableFuture.supplyAsync(() -> admit(rawInput, sourceAgentId, userPriority, arrival), routerPool);
    }

    public Optional<RoutingDecision> findDecision(String requestId) {
        return decisions.find(requestId);
    }

    /**
     * Drops stored decisions whose request arrived more than one idempotency window before
     * {@code now}.
     */
    public int purgeExpiredDecisions(Instant now) {
        long cutoffMs = now.toEpochMilli() - options.idempotencyWindowMs();
        int purged = decisions.purgeArrivedBefore(cutoffMs);
        if (purged > 0) {
            log.info("Purged {} routing decision(s) that arrived before {}", purged, Instant.ofEpochMilli(cutoffMs));
        }
        return purged;
    }

    public int lazyQueueDepth() {
        return lazyQueue.depth();
    }

    public int lazyQueueCapacity() {
        return lazyQueue.capacity();
    }

    public static String requestId(String rawInput, Instant arrival) {
        return Hashing.sha256Hex(rawInput + "\n" + arrival.toEpochMilli());
    }

    static String contentKey(String sourceAgentId, String rawInput) {
        return Hashing.sha256Hex(sourceAgentId + "\n" + rawInput);
    }

    private RoutingDecision recordBlocked(String requestId, String contentKey, String source, String raw,
                                          long arrivedAtMs, long windowStartMs, SecurityVerdict verdict) {
        RoutingDecision outcome = transactor.inTransaction("block request " + requestId, (c, recorder) -> {
            Optional<RoutingDecision> replay = decisions.findReplay(c, requestId, contentKey, windowStartMs);
            if (replay.isPresent()) {
                return replay.get().asReplay();
            }
            RoutingDecision decision = new RoutingDecision(requestId, RoutingTier.BLOCKED, verdict.reason(), null,
                    SecurityRejection.MALICIOUS_INPUT, List.of(), Instant.now(), false);
            Map<String, Object> payload = requestPayload(decision, source, raw);
            payload.put("pattern", verdict.pattern());
            recorder.record(LedgerEventType.REQUEST_BLOCKED, payload, source);
            decisions.insert(c, decision, contentKey, source, arrivedAtMs);
            return decision;
        });
        if (!outcome.deduplicated()) {
            log.warn("Request {} from {} blocked: {}", requestId, source, verdict.reason());
        }
        return outcome;
    }

    private RoutingDecision recordAccepted(String requestId, String contentKey, String source, String raw,
                                           int userPriority, long arrivedAtMs, long windowStartMs,
                                           Classification classification, PlacementRank rank) {
        RoutingDecision outcome = transactor.inTransaction("admit request " + requestId, (c, recorder) -> {
            Optional<RoutingDecision> replay = decisions.findReplay(c, requestId, contentKey, windowStartMs);
            if (replay.isPresent()) {
                return replay.get().asReplay();
            }
            long nowMs = System.currentTimeMillis();
            String taskId = UUID.randomUUID().toString();
            if (classification.tier() == RoutingTier.LOW
                    && !lazyQueue.tryReserve(c, requestId, taskId, nowMs)) {
                return saturated(recorder, requestId, source, raw, classification);
            }
            RoutingDecision decision = new RoutingDecision(requestId, classification.tier(), classification.reason(),
                    taskId, null, classification.concepts(), Instant.ofEpochMilli(nowMs), false);
            recorder.record(LedgerEventType.REQUEST_ADMITTED, requestPayload(decision, source, raw), source);
            scheduler.createTask(c, recorder, new TaskDraft(taskId, requestId, source, raw, classification.tier(), rank,
                    userPriority, options.defaultMaxRetries()));
            decisions.insert(c, decision, contentKey, source, arrivedAtMs);
            return decision;
        });
        if (!outcome.deduplicated()) {
            if (outcome.isBlocked()) {
                log.warn("Request {} from {} rejected: lazy queue full ({} slots)",
                        requestId, source, lazyQueue.capacity());
            } else {
                log.info("Request {} from {} admitted as {} -> task {}",
                        requestId, source, outcome.tier(), outcome.createdTaskId());
            }
        }
        return outcome;
    }

    /**
     * Saturation is not stored as a decision, so the same input can be retried once slots free up.
     */
    private RoutingDecision saturated(LedgeredTransactor.Recorder recorder, String requestId, String source,
                                      String raw, Classification classification) {
        RoutingDecision decision = new RoutingDecision(requestId, RoutingTier.BLOCKED, REASON_QUEUE_SATURATED, null,
                SecurityRejection.QUEUE_SATURATED, classification.concepts(), Instant.now(), false);
        Map<String, Object> payload = requestPayload(decision, source, raw);
        payload.put("queue_capacity", lazyQueue.capacity());
        recorder.record(LedgerEventType.REQUEST_BLOCKED, payload, source);
        return decision;
    }

    private Classification classify(String raw) {
        Future<Classification> future = classifierExecutor.submit(() -> classifier.classify(raw));
        try {
            Classification result = future.get(options.classifierTimeoutMs(), TimeUnit.MILLISECONDS);
            if (result == null || result.tier() == null || result.tier() == RoutingTier.BLOCKED) {
                log.warn("Classifier returned no usable tier ({}), falling back to LOW", result);
                return fallback(REASON_CLASSIFIER_ERROR);
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Classifier exceeded {} ms, falling back to LOW", options.classifierTimeoutMs());
            return fallback(REASON_CLASSIFIER_TIMEOUT);
        } catch (ExecutionException e) {
            log.warn("Classifier failed, falling back to LOW: {}", String.valueOf(e.getCause()));
            return fallback(REASON_CLASSIFIER_ERROR);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return fallback(REASON_CLASSIFIER_ERROR);
        }
    }

    private static Classification fallback(String reason) {
        return new Classification(RoutingTier.LOW, List.of(), reason);
    }

    private static Map<String, Object> requestPayload(RoutingDecision decision, String source, String raw) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("request_id", decision.requestId());
        payload.put("source_agent_id", source);
        payload.put("tier", decision.tier().name());
        payload.put("reason", decision.reason());
        if (decision.rejection() != null) {
            payload.put("rejection", decision.rejection().name());
        }
        if (decision.createdTaskId() != null) {
            payload.put("task_id", decision.createdTaskId());
        }
        payload.put("concepts", decision.concepts());
        payload.put("input_hash", Hashing.sha256Hex(raw));
        payload.put("input_length", raw.length());
        return payload;
    }

    public record Options(long classifierTimeoutMs, long idempotencyWindowMs, int defaultMaxRetries) {
    }
}
