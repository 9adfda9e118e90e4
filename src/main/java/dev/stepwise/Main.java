package dev.stepwise;

import dev.stepwise.cli.StepwiseCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new StepwiseCli()).execute(args);
        System.exit(exitCode);
    }
}
