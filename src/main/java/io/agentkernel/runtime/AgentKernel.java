package io.agentkernel.runtime;

import io.agentkernel.admission.AdmissionRouter;
import io.agentkernel.admission.HeuristicIntentClassifier;
import io.agentkernel.admission.IntentClassifier;
import io.agentkernel.admission.LazyQueue;
import io.agentkernel.admission.RoutingDecision;
import io.agentkernel.admission.RoutingDecisionStore;
import io.agentkernel.admission.SecurityFilter;
import io.agentkernel.config.KernelConfig;
import io.agentkernel.config.KernelSettings;
import io.agentkernel.error.HaltSwitch;
import io.agentkernel.error.LedgerCorruptionException;
import io.agentkernel.governance.AgentRecord;
import io.agentkernel.governance.AgentStore;
import io.agentkernel.governance.Ed25519SignatureVerifier;
import io.agentkernel.governance.FilePolicyDocumentProvider;
import io.agentkernel.governance.GovernanceGate;
import io.agentkernel.governance.PolicyDocumentProvider;
import io.agentkernel.governance.SignatureVerifier;
import io.agentkernel.ledger.ChainVerification;
import io.agentkernel.ledger.Ledger;
import io.agentkernel.ledger.LedgerHead;
import io.agentkernel.ledger.LedgeredTransactor;
import io.agentkernel.scheduler.PlacementService;
import io.agentkernel.scheduler.ReportStatus;
import io.agentkernel.scheduler.Task;
import io.agentkernel.scheduler.TaskCounts;
import io.agentkernel.scheduler.TaskScheduler;
import io.agentkernel.scheduler.TaskStore;
import io.agentkernel.storage.Database;
import io.agentkernel.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns every kernel component and their lifecycle. Nothing is static: tests and the CLI each build
 * their own kernel over a data root, call {@link #boot()}, and {@link #shutdown()} when done.
 */
public final class AgentKernel implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentKernel.class);

    private final KernelConfig config;
    private final KernelSettings settings;
    private final KernelCapabilities capabilities;
    private final HaltSwitch halt;
    private final Database database;
    private final Ledger ledger;
    private final GovernanceGate governance;
    private final LazyQueue lazyQueue;
    private final TaskScheduler scheduler;
    private final AdmissionRouter router;
    private final ExecutorService routerPool;
    private final ExecutorService classifierPool;
    private final SignatureVerifier verifier;
    private final List<BootPhase> completedPhases = new ArrayList<>();
    private ScheduledExecutorService maintenance;
    private volatile boolean booted;
    private boolean shutDown;

    public AgentKernel(KernelConfig config) {
        this(config, KernelSettings.load(config.settingsFile()), Collaborators.defaults());
    }

    public AgentKernel(KernelConfig config, KernelSettings settings, Collaborators collaborators) {
        this.config = config;
        this.settings = settings;
        Collaborators plugged = collaborators == null ? Collaborators.defaults() : collaborators;
        IntentClassifier classifier = plugged.classifier() == null ? new HeuristicIntentClassifier() : plugged.classifier();
        PlacementService placement = plugged.placement() == null ? PlacementService.uniform() : plugged.placement();
        PolicyDocumentProvider policy = plugged.policy() == null
                ? new FilePolicyDocumentProvider(config.policyFile())
                : plugged.policy();
        this.verifier = plugged.verifier() == null ? new Ed25519SignatureVerifier() : plugged.verifier();
        this.capabilities = new KernelCapabilities(
                Ed25519SignatureVerifier.available(),
                verifier.algorithm(),
                plugged.classifier() != null,
                plugged.placement() != null,
                plugged.policy() != null,
                settings.maintenanceIntervalMs() > 0L
        );

        Backoff backoff = new Backoff(settings.persistenceMaxAttempts(), settings.persistenceBaseBackoffMs(),
                settings.persistenceMaxBackoffMs());
        this.halt = new HaltSwitch();
        this.database = new Database(config);
        this.ledger = new Ledger(config.ledgerFile(), halt, backoff);
        LedgeredTransactor transactor = new LedgeredTransactor(database, ledger, backoff, halt);
        this.governance = new GovernanceGate(new AgentStore(database, backoff), transactor, policy, verifier);
        this.lazyQueue = new LazyQueue(database, backoff, settings.lazyQueueCapacity());
        this.scheduler = new TaskScheduler(new TaskStore(database, backoff), transactor, governance,
                settings.claimTimeoutMs(), settings.inProgressDeadlineMs());
        this.routerPool = Executors.newFixedThreadPool(settings.routerThreads(), namedThreads("kernel-router"));
        this.classifierPool = Executors.newFixedThreadPool(settings.routerThreads(), namedThreads("kernel-classifier"));
        this.router = new AdmissionRouter(
                new SecurityFilter(settings.maxInputChars()),
                classifier,
                classifierPool,
                routerPool,
                lazyQueue,
                new RoutingDecisionStore(database, backoff),
                scheduler,
                placement,
                transactor,
                new AdmissionRouter.Options(settings.classifierTimeoutMs(), settings.idempotencyWindowMs(),
                        settings.defaultMaxRetries())
        );
    }

    /**
     * Runs every {@link BootPhase} in order. A corrupted ledger stops the boot in the LEDGER phase.
     */
    public synchronized void boot() {
        if (booted) {
            return;
        }
        if (shutDown) {
            throw new IllegalStateException("A kernel that was shut down can not boot again");
        }
        for (BootPhase phase : BootPhase.values()) {
            runPhase(phase);
            completedPhases.add(phase);
            log.info("Boot phase {} complete", phase);
        }
        booted = true;
        log.info("Kernel booted at {} (ledger head #{}, capabilities {})",
                config.rootDir(), ledger.head().sequenceNumber(), capabilities);
    }

    private void runPhase(BootPhase phase) {
        switch (phase) {
            case STORAGE -> database.init();
            case LEDGER -> openLedger();
            case GOVERNANCE -> {
                if (verifier instanceof Ed25519SignatureVerifier && !capabilities.ed25519Available()) {
                    throw new IllegalStateException("No Ed25519 provider in this JVM, oaths can not be verified");
                }
                log.info("Governing policy hash {}", governance.currentPolicyHash());
            }
            case ADMISSION -> log.info("Admission router ready: {} router threads, lazy queue {}/{}",
                    settings.routerThreads(), lazyQueue.depth(), lazyQueue.capacity());
            case SCHEDULER -> {
                scheduler.addSettlementListener(lazyQueue);
                int reclaimed = scheduler.reclaimExpiredClaims();
                if (reclaimed > 0) {
                    log.info("Recovered {} claim(s) left over from the previous run", reclaimed);
                }
            }
            case MAINTENANCE -> startMaintenance();
        }
    }

    private void openLedger() {
        ledger.open();
        if (ledger.head().isEmpty() && database.hasKernelState()) {
            halt.trip("ledger is empty but the kernel store holds agents or tasks", -1L);
            throw new LedgerCorruptionException(
                    "Refusing to start a new chain over existing kernel state at " + config.rootDir(), -1L);
        }
        ChainVerification verification = ledger.verifyChainIntegrity();
        if (!verification.ok()) {
            throw new LedgerCorruptionException("Ledger chain broken: " + verification.reason(),
                    verification.brokenSequence());
        }
        log.info("Ledger verified: {} event(s) intact", verification.checked());
    }

    private void startMaintenance() {
        if (!capabilities.maintenanceLoop()) {
            log.info("Maintenance loop disabled");
            return;
        }
        maintenance = Executors.newSingleThreadScheduledExecutor(namedThreads("kernel-maintenance"));
        long interval = settings.maintenanceIntervalMs();
        maintenance.scheduleWithFixedDelay(this::maintenanceTick, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void maintenanceTick() {
        if (halt.isHalted()) {
            return;
        }
        try {
            runMaintenance();
        } catch (RuntimeException e) {
            // The executor cancels a task that throws; keep sweeping on the next tick.
            log.error("Maintenance sweep failed", e);
        }
    }

    /**
     * Registers (or re-verifies) agents before any work is handed out. Any governance failure
     * aborts the caller.
     */
    public List<AgentRecord> bootAgents(List<AgentRegistration> registrations) {
        requireBooted();
        List<AgentRecord> out = new ArrayList<>();
        for (AgentRegistration registration : registrations) {
            if (governance.isSworn(registration.agentId())) {
                governance.verify(registration.agentId());
                out.add(governance.find(registration.agentId()).orElseThrow());
                continue;
            }
            out.add(governance.register(registration.agentId(), registration.publicKey(),
                    registration.capabilities(), registration.oathSignature()));
        }
        return out;
    }

    public RoutingDecision admit(String rawInput, String sourceAgentId) {
        requireBooted();
        return router.admit(rawInput, sourceAgentId);
    }

    public RoutingDecision admit(String rawInput, String sourceAgentId, int userPriority) {
        requireBooted();
        return router.admit(rawInput, sourceAgentId, userPriority);
    }

    public AgentHandle agentHandle(String agentId) {
        requireBooted();
        return new SchedulerAgentHandle(agentId, scheduler);
    }

    public MaintenanceOutcome runMaintenance() {
        requireBooted();
        int reclaimed = scheduler.reclaimExpiredClaims();
        int failed = scheduler.failOverdue();
        Instant now = Instant.now();
        int purged = router.purgeExpiredDecisions(now);
        return new MaintenanceOutcome(reclaimed, failed, purged, now.toString());
    }

    public QueueStatus queueStatus() {
        requireBooted();
        HaltSwitch.Halt current = halt.current();
        return new QueueStatus(
                scheduler.counts(),
                lazyQueue.depth(),
                lazyQueue.capacity(),
                current != null,
                current == null ? null : current.cause(),
                ledger.size()
        );
    }

    public ChainVerification verifyChain() {
        requireBooted();
        return ledger.verifyChainIntegrity();
    }

    public HealthOutcome health() {
        boolean dbOk;
        try (Connection ignored = database.openConnection()) {
            dbOk = true;
        } catch (Exception e) {
            log.warn("Kernel store unreachable: {}", e.getMessage());
            dbOk = false;
        }
        HaltSwitch.Halt current = halt.current();
        boolean degraded = current != null;
        LedgerHead head = ledger.head();
        return new HealthOutcome(
                booted && dbOk && !degraded,
                booted,
                dbOk,
                degraded,
                current == null ? null : current.cause(),
                current == null ? null : current.sequenceNumber(),
                head.sequenceNumber(),
                List.copyOf(completedPhases),
                capabilities,
                Instant.now().toString()
        );
    }

    public synchronized void shutdown() {
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        routerPool.shutdown();
        classifierPool.shutdownNow();
        try {
            if (!routerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                routerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            routerPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        booted = false;
        shutDown = true;
        log.info("Kernel at {} shut down", config.rootDir());
    }

    @Override
    public void close() {
        shutdown();
    }

    public KernelConfig config() {
        return config;
    }

    public KernelSettings settings() {
        return settings;
    }

    public KernelCapabilities capabilities() {
        return capabilities;
    }

    public GovernanceGate governance() {
        return governance;
    }

    public AdmissionRouter router() {
        return router;
    }

    public TaskScheduler scheduler() {
        return scheduler;
    }

    public Ledger ledger() {
        return ledger;
    }

    public boolean isHalted() {
        return halt.isHalted();
    }

    private void requireBooted() {
        if (!booted) {
            throw new IllegalStateException("Kernel is not booted");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record SchedulerAgentHandle(String agentId, TaskScheduler scheduler) implements AgentHandle {
        @Override
        public Optional<Task> nextTask() {
            return scheduler.getNextTask(agentId);
        }

        @Override
        public Task start(String taskId) {
            return scheduler.startTask(taskId, agentId);
        }

        @Override
        public Task complete(String taskId, String resultPayload) {
            return scheduler.reportTaskResult(taskId, agentId, ReportStatus.COMPLETED, resultPayload);
        }

        @Override
        public Task fail(String taskId, String errorPayload) {
            return scheduler.reportTaskResult(taskId, agentId, ReportStatus.FAILED, errorPayload);
        }
    }

    public record QueueStatus(
            TaskCounts tasks,
            int lazyQueueDepth,
            int lazyQueueCapacity,
            boolean degraded,
            String haltCause,
            long ledgerSize
    ) {
    }

    public record HealthOutcome(
            boolean ok,
            boolean booted,
            boolean dbOk,
            boolean degraded,
            String haltCause,
            Long haltSequence,
            long ledgerHead,
            List<BootPhase> completedPhases,
            KernelCapabilities capabilities,
            String timestamp
    ) {
    }

    public record MaintenanceOutcome(int reclaimedClaims, int failedOverdue, int purgedDecisions, String timestamp) {
    }
}
