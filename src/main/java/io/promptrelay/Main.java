package io.promptrelay;

import io.promptrelay.cli.PromptRelayCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PromptRelayCommand()).execute(args);
        System.exit(code);
    }
}
