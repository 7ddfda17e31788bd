package io.maubotoperator;

import io.maubotoperator.cli.OperatorCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new OperatorCommand()).execute(args);
        System.exit(code);
    }
}
