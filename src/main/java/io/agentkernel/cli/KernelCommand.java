package io.agentkernel.cli;

import io.agentkernel.admission.RoutingDecision;
import io.agentkernel.config.KernelConfig;
import io.agentkernel.config.KernelSettings;
import io.agentkernel.error.KernelException;
import io.agentkernel.governance.AgentRecord;
import io.agentkernel.governance.Ed25519Keys;
import io.agentkernel.governance.GovernanceException;
import io.agentkernel.governance.OathRecord;
import io.agentkernel.ledger.ChainVerification;
import io.agentkernel.ledger.LedgerEvent;
import io.agentkernel.runtime.AgentKernel;
import io.agentkernel.runtime.Collaborators;
import io.agentkernel.scheduler.ReportStatus;
import io.agentkernel.scheduler.SchedulingException;
import io.agentkernel.scheduler.Task;
import io.agentkernel.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "agentkernel",
        mixinStandardHelpOptions = true,
        description = "Agent admission, scheduling and ledger kernel CLI",
        subcommands = {
                KernelCommand.InitCommand.class,
                KernelCommand.PolicyHashCommand.class,
                KernelCommand.KeygenCommand.class,
                KernelCommand.SignOathCommand.class,
                KernelCommand.RegisterCommand.class,
                KernelCommand.VerifyOathCommand.class,
                KernelCommand.AgentsCommand.class,
                KernelCommand.AdmitCommand.class,
                KernelCommand.NextTaskCommand.class,
                KernelCommand.StartCommand.class,
                KernelCommand.ReportCommand.class,
                KernelCommand.TaskCommand.class,
                KernelCommand.QueueStatusCommand.class,
                KernelCommand.MaintenanceCommand.class,
                KernelCommand.EventsCommand.class,
                KernelCommand.VerifyChainCommand.class,
                KernelCommand.HealthCommand.class
        }
)
public final class KernelCommand implements Runnable {
    @Option(names = {"--root"}, description = "Kernel data root directory", defaultValue = KernelConfig.DEFAULT_ROOT)
    String root;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: init | policy-hash | keygen | sign-oath | register | verify-oath | agents | admit | next-task | start | report | task | queue-status | maintenance | events | verify-chain | health");
    }

    KernelConfig config() {
        return KernelConfig.fromRoot(root);
    }

    /**
     * A booted kernel for one command. The background sweep is off; {@code maintenance} runs it
     * on demand.
     */
    AgentKernel kernel() {
        KernelConfig config = config();
        KernelSettings settings = KernelSettings.load(config.settingsFile()).withMaintenanceIntervalMs(0L);
        AgentKernel kernel = new AgentKernel(config, settings, Collaborators.defaults());
        kernel.boot();
        return kernel;
    }

    void print(Object value) {
        out.println(Jsons.toJson(value));
    }

    int error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        print(body);
        return 1;
    }

    int kernelError(KernelException e) {
        if (e instanceof GovernanceException g) {
            return error(g.error().name(), g.getMessage());
        }
        if (e instanceof SchedulingException s) {
            return error(s.error().name(), s.getMessage());
        }
        return error(e.getClass().getSimpleName(), e.getMessage());
    }

    static String readSecret(String inline, Path file, String name) {
        if (inline != null && !inline.isBlank()) {
            return inline.trim();
        }
        if (file == null) {
            throw new IllegalArgumentException("--" + name + " or --" + name + "-file is required");
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read " + file, e);
        }
    }

    @Command(name = "init", description = "Create the data root, kernel store and ledger")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                Map<String, Object> body = new LinkedHashMap<>();
                body.put("root", kernel.config().rootDir().toString());
                body.put("policy_file", kernel.config().policyFile().toString());
                body.put("policy_hash", kernel.governance().currentPolicyHash());
                body.put("ledger_size", kernel.ledger().size());
                parent.print(body);
                return 0;
            }
        }
    }

    @Command(name = "policy-hash", description = "Print the hash every oath must sign")
    static final class PolicyHashCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                parent.print(Map.of("policy_hash", kernel.governance().currentPolicyHash()));
                return 0;
            }
        }
    }

    @Command(name = "keygen", description = "Generate an Ed25519 key pair for an agent")
    static final class KeygenCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id, used to name the key files")
        String agent;

        @Option(names = {"--out"}, description = "Directory for <agent>.pub and <agent>.key (default: <root>/keys)")
        Path outDir;

        @Override
        public Integer call() throws IOException {
            Ed25519Keys.EncodedKeyPair pair = Ed25519Keys.generate();
            Path dir = outDir == null ? parent.config().keysRoot() : outDir;
            Files.createDirectories(dir);
            Path pub = dir.resolve(agent + ".pub");
            Path key = dir.resolve(agent + ".key");
            Files.writeString(pub, pair.publicKey() + System.lineSeparator(), StandardCharsets.UTF_8);
            Files.writeString(key, pair.privateKey() + System.lineSeparator(), StandardCharsets.UTF_8);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("agent_id", agent);
            body.put("public_key", pair.publicKey());
            body.put("public_key_file", pub.toString());
            body.put("private_key_file", key.toString());
            parent.print(body);
            return 0;
        }
    }

    @Command(name = "sign-oath", description = "Sign the current policy hash with an agent's private key")
    static final class SignOathCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--private-key"}, description = "Base64 PKCS#8 private key")
        String privateKey;

        @Option(names = {"--private-key-file"}, description = "File holding the Base64 private key")
        Path privateKeyFile;

        @Option(names = {"--policy-hash"}, description = "Hash to sign (default: current policy hash)")
        String policyHash;

        @Override
        public Integer call() {
            String key = readSecret(privateKey, privateKeyFile, "private-key");
            String hash = policyHash;
            if (hash == null || hash.isBlank()) {
                try (AgentKernel kernel = parent.kernel()) {
                    hash = kernel.governance().currentPolicyHash();
                }
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("policy_hash", hash);
            body.put("signature", Ed25519Keys.signOath(key, hash));
            parent.print(body);
            return 0;
        }
    }

    @Command(name = "register", description = "Register an agent with its oath signature")
    static final class RegisterCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent id")
        String agent;

        @Option(names = {"--public-key"}, description = "Base64 X.509 Ed25519 public key")
        String publicKey;

        @Option(names = {"--public-key-file"}, description = "File holding the Base64 public key")
        Path publicKeyFile;

        @Option(names = {"--signature"}, required = true, description = "Base64 oath signature over the policy hash")
        String signature;

        @Option(names = {"--capability"}, description = "Capability tag, repeatable")
        List<String> capabilities = new ArrayList<>();

        @Override
        public Integer call() {
            String key = readSecret(publicKey, publicKeyFile, "public-key");
            try (AgentKernel kernel = parent.kernel()) {
                AgentRecord agentRecord = kernel.governance().register(agent, key,
                        new LinkedHashSet<>(capabilities), signature);
                parent.print(agentRecord);
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "verify-oath", description = "Check an agent's oath against the current policy")
    static final class VerifyOathCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Agent id")
        String agent;

        @Option(names = {"--all"}, description = "Verify every sworn agent")
        boolean all;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                if (all) {
                    List<String> stale = kernel.governance().verifyAll();
                    parent.print(Map.of("stale_agents", stale));
                    return stale.isEmpty() ? 0 : 1;
                }
                if (agent == null || agent.isBlank()) {
                    return parent.error("usage", "agent id or --all is required");
                }
                OathRecord oath = kernel.governance().verify(agent);
                parent.print(oath);
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "agents", description = "List registered agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--history"}, description = "Show the oath history of this agent instead")
        String historyOf;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                if (historyOf != null && !historyOf.isBlank()) {
                    parent.print(kernel.governance().oathHistory(historyOf));
                } else {
                    parent.print(kernel.governance().listAgents());
                }
                return 0;
            }
        }
    }

    @Command(name = "admit", description = "Route a raw request through the admission gates")
    static final class AdmitCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--source"}, required = true, description = "Submitting agent id")
        String source;

        @Option(names = {"--input"}, required = true, description = "Raw request text")
        String input;

        @Option(names = {"--priority"}, defaultValue = "0", description = "User priority, higher is more urgent")
        int priority;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                RoutingDecision decision = kernel.admit(input, source, priority);
                parent.print(decision);
                return decision.isBlocked() ? 3 : 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "next-task", description = "Claim the most urgent pending task for an agent")
    static final class NextTaskCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Claiming agent id")
        String agent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                Optional<Task> task = kernel.agentHandle(agent).nextTask();
                if (task.isEmpty()) {
                    parent.print(Map.of("task", "none"));
                    return 0;
                }
                parent.print(task.get());
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "start", description = "Mark a claimed task as in progress")
    static final class StartCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, required = true, description = "Owning agent id")
        String agent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                parent.print(kernel.agentHandle(agent).start(taskId));
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "report", description = "Report the result of a claimed task")
    static final class ReportCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Option(names = {"--agent"}, required = true, description = "Owning agent id")
        String agent;

        @Option(names = {"--status"}, required = true, description = "completed|failed")
        String status;

        @Option(names = {"--result"}, description = "Result or error payload")
        String result;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                Task task = kernel.scheduler().reportTaskResult(taskId, agent, ReportStatus.fromString(status), result);
                parent.print(task);
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "task", description = "Show a task by id")
    static final class TaskCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                Optional<Task> task = kernel.scheduler().getTask(taskId);
                if (task.isEmpty()) {
                    return parent.error("NOT_FOUND", "task not found");
                }
                parent.print(task.get());
                return 0;
            }
        }
    }

    @Command(name = "queue-status", description = "Task counts, lazy queue depth and halt state")
    static final class QueueStatusCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                AgentKernel.QueueStatus status = kernel.queueStatus();
                parent.print(status);
                return status.degraded() ? 2 : 0;
            }
        }
    }

    @Command(name = "maintenance", description = "Reclaim expired claims and fail overdue tasks once")
    static final class MaintenanceCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                parent.print(kernel.runMaintenance());
                return 0;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "events", description = "Print ledger events from a sequence number")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Option(names = {"--since"}, defaultValue = "0", description = "First sequence number")
        long since;

        @Option(names = {"--limit"}, defaultValue = "100", description = "Max events")
        int limit;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                List<LedgerEvent> events = new ArrayList<>();
                for (LedgerEvent event : kernel.ledger().eventsSince(since)) {
                    if (events.size() >= Math.max(1, limit)) {
                        break;
                    }
                    events.add(event);
                }
                parent.print(events);
                return 0;
            }
        }
    }

    @Command(name = "verify-chain", description = "Recompute every ledger hash from genesis")
    static final class VerifyChainCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            try (AgentKernel kernel = parent.kernel()) {
                ChainVerification verification = kernel.verifyChain();
                parent.print(verification);
                return verification.ok() ? 0 : 2;
            } catch (KernelException e) {
                return parent.kernelError(e);
            }
        }
    }

    @Command(name = "health", description = "Kernel health and degraded flag")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        KernelCommand parent;

        @Override
        public Integer call() {
            AgentKernel kernel = new AgentKernel(parent.config(),
                    KernelSettings.load(parent.config().settingsFile()).withMaintenanceIntervalMs(0L),
                    Collaborators.defaults());
            try {
                kernel.boot();
            } catch (KernelException e) {
                // Report the halt below instead of failing the command.
                parent.out.println(Jsons.toJson(Map.of("boot_error", String.valueOf(e.getMessage()))));
            }
            try {
                AgentKernel.HealthOutcome health = kernel.health();
                parent.print(health);
                return health.ok() ? 0 : 2;
            } finally {
                kernel.shutdown();
            }
        }
    }
}
