package io.agentkernel;

import io.agentkernel.cli.KernelCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new KernelCommand()).execute(args);
        System.exit(code);
    }
}
