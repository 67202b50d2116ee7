package dev.grafcet.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * CLI entry point for grafcet-conduct.
 */
@Command(
    name = "grafcet-conduct",
    mixinStandardHelpOptions = true,
    description = "Synthesize GRAFCET conduct programs from GSRSM mode graphs and verify compiled SFC programs.",
    subcommands = {SynthesizeCommand.class, VerifyCommand.class, VerifyProjectCommand.class}
)
public class GrafcetCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_FAILED_VERIFICATION = 2;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getErr().println(
            "Error: a command is required (synthesize, verify, verify-project). Use --help for usage.");
        return EXIT_ERROR;
    }
}
