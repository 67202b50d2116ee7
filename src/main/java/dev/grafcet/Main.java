package dev.grafcet;

import dev.grafcet.cli.GrafcetCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new GrafcetCli()).execute(args);
        System.exit(exitCode);
    }
}
