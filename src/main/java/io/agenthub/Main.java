package io.agenthub;

import io.agenthub.cli.AgentHubCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new AgentHubCommand()).execute(args);
        System.exit(code);
    }
}
