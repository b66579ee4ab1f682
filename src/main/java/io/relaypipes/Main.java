package io.relaypipes;

import io.relaypipes.cli.RelayPipesCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RelayPipesCommand()).execute(args);
        System.exit(code);
    }
}
