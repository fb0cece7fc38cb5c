package io.agentkernel.governance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the policy from disk on every call so that edits are picked up by the next verification.
 * A missing file stands for the bootstrap policy {@code GENESIS}.
 */
public final class FilePolicyDocumentProvider implements PolicyDocumentProvider {
    private static final Logger log = LoggerFactory.getLogger(FilePolicyDocumentProvider.class);
    static final byte[] GENESIS_POLICY = "GENESIS".getBytes(StandardCharsets.US_ASCII);

    private final Path policyFile;

    public FilePolicyDocumentProvider(Path policyFile) {
        this.policyFile = policyFile;
    }

    @Override
    public byte[] currentPolicy() {
        if (!Files.isRegularFile(policyFile)) {
            log.debug("Policy file {} not found, using bootstrap policy", policyFile);
            return GENESIS_POLICY.clone();
        }
        try {
            return Files.readAllBytes(policyFile);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read policy file: " + policyFile, e);
        }
    }

    public Path policyFile() {
        return policyFile;
    }
}
