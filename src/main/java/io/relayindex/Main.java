package io.relayindex;

import io.relayindex.cli.RelayIndexCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new RelayIndexCommand()).execute(args);
        System.exit(code);
    }
}
