package io.agentkernel.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentkernel.KernelFixtures;
import io.agentkernel.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class KernelCommandTest {

    @Test
    void operatorFlowFromKeygenToCompletedTask() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-cli-");
        try {
            Assertions.assertEquals(0, run(root, "init").code());

            Run keygen = run(root, "keygen", "--agent", "worker");
            Assertions.assertEquals(0, keygen.code());
            Path publicKeyFile = Path.of(keygen.json().path("public_key_file").asText());
            Path privateKeyFile = Path.of(keygen.json().path("private_key_file").asText());
            Assertions.assertTrue(Files.exists(publicKeyFile));
            Assertions.assertTrue(Files.exists(privateKeyFile));

            Run signed = run(root, "sign-oath", "--private-key-file", privateKeyFile.toString());
            Assertions.assertEquals(0, signed.code());
            Assertions.assertEquals(run(root, "policy-hash").json().path("policy_hash").asText(),
                    signed.json().path("policy_hash").asText());

            Run registered = run(root, "register", "--agent", "worker",
                    "--public-key-file", publicKeyFile.toString(),
                    "--signature", signed.json().path("signature").asText(),
                    "--capability", "summarize");
            Assertions.assertEquals(0, registered.code());
            Assertions.assertEquals("SWORN", registered.json().path("oathStatus").asText());

            Run admitted = run(root, "admit", "--source", "agent-a", "--input", "Summarize the outage timeline");
            Assertions.assertEquals(0, admitted.code());
            String taskId = admitted.json().path("createdTaskId").asText();

            Run claimed = run(root, "next-task", "--agent", "worker");
            Assertions.assertEquals(taskId, claimed.json().path("taskId").asText());
            Assertions.assertEquals(0, run(root, "start", taskId, "--agent", "worker").code());
            Run reported = run(root, "report", taskId, "--agent", "worker", "--status", "completed", "--result", "done");
            Assertions.assertEquals("COMPLETED", reported.json().path("status").asText());

            Assertions.assertEquals(0, run(root, "verify-chain").code());
            Run status = run(root, "queue-status");
            Assertions.assertEquals(1L, status.json().path("tasks").path("completed").asLong());
            Assertions.assertTrue(run(root, "events", "--since", "0", "--limit", "3").json().isArray());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    @Test
    void errorsAreReportedAsJsonWithNonZeroExit() throws Exception {
        Path root = Files.createTempDirectory("agentkernel-test-cli-errors-");
        try {
            Run blocked = run(root, "admit", "--source", "agent-a", "--input", "'; DROP TABLE tasks; --");
            Assertions.assertEquals(3, blocked.code());
            Assertions.assertEquals("BLOCKED", blocked.json().path("tier").asText());

            Run missing = run(root, "task", "nope");
            Assertions.assertEquals(1, missing.code());
            Assertions.assertEquals("NOT_FOUND", missing.json().path("error").asText());

            Run unknown = run(root, "verify-oath", "ghost");
            Assertions.assertEquals(1, unknown.code());
            Assertions.assertEquals("UNKNOWN_AGENT", unknown.json().path("error").asText());
        } finally {
            KernelFixtures.deleteRecursively(root);
        }
    }

    private static Run run(Path root, String... args) throws Exception {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        KernelCommand command = new KernelCommand();
        command.out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        String[] full = new String[args.length + 2];
        full[0] = "--root";
        full[1] = root.toString();
        System.arraycopy(args, 0, full, 2, args.length);
        int code = new CommandLine(command).execute(full);
        return new Run(code, buffer.toString(StandardCharsets.UTF_8));
    }

    private record Run(int code, String output) {
        JsonNode json() throws Exception {
            return Jsons.mapper().readTree(output);
        }
    }
}
