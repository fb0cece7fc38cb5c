package io.agentkernel.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * On-disk layout of one kernel instance. Everything lives under a single root directory.
 */
public final class KernelConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "kernel-settings.json";
    public static final String POLICY_FILE = "CONSTITUTION.md";

    private final Path rootDir;

    public KernelConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static KernelConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new KernelConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("kernel.db");
    }

    public Path ledgerRoot() {
        return rootDir.resolve("ledger");
    }

    public Path ledgerFile() {
        return ledgerRoot().resolve("ledger.db");
    }

    public Path policyRoot() {
        return rootDir.resolve("policy");
    }

    public Path policyFile() {
        return policyRoot().resolve(POLICY_FILE);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path keysRoot() {
        return rootDir.resolve("keys");
    }
}
