package io.guildflow;

import io.guildflow.cli.GuildFlowCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new GuildFlowCommand()).execute(args);
        System.exit(code);
    }
}
