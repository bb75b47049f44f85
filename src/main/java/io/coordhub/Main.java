package io.coordhub;

import io.coordhub.cli.CoordHubCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new CoordHubCommand()).execute(args);
        System.exit(code);
    }
}
