package dev.grafcet.cli;

import dev.grafcet.engine.FeedbackFormatter;
import dev.grafcet.engine.IoVocabularyLoader;
import dev.grafcet.engine.ModeGraphLoader;
import dev.grafcet.engine.ModeVerificationPlan;
import dev.grafcet.engine.ModeVerificationRunner;
import dev.grafcet.engine.ProjectLoader;
import dev.grafcet.model.ConductOptions;
import dev.grafcet.model.IoVocabulary;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.ModeResult;
import dev.grafcet.model.ValidationSummary;
import dev.grafcet.model.VerificationRules;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(
    name = "verify-project",
    mixinStandardHelpOptions = true,
    description = "Verify the compiled program of every activated mode of a project directory."
)
public class VerifyProjectCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Project directory containing gsrsm.json, io.json and modes/")
    private Path projectDir;

    @Option(names = "--sub-program", defaultValue = ConductOptions.DEFAULT_SUB_PROGRAM,
        description = "Sub-program file verified for each mode (default: ${DEFAULT-VALUE})")
    private String subProgram;

    @Option(names = "--threads", description = "Worker threads (default: number of processors, at least 2)")
    private Integer threads;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ModeVerificationPlan plan;
        IoVocabulary vocabulary;
        try {
            ModeGraph graph = ModeGraphLoader.loadFromFile(projectDir.resolve(ProjectLoader.GSRSM_FILE));
            vocabulary = IoVocabularyLoader.loadFromFile(projectDir.resolve(ProjectLoader.IO_FILE));
            plan = ModeVerificationPlan.register(graph, ProjectLoader.loadPrograms(projectDir, graph, subProgram));
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return GrafcetCli.EXIT_ERROR;
        }

        ModeVerificationRunner runner;
        try {
            runner = threads == null
                ? new ModeVerificationRunner()
                : new ModeVerificationRunner(threads, VerificationRules.defaults());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return GrafcetCli.EXIT_ERROR;
        }

        ValidationSummary summary = runner.run(plan, vocabulary);
        for (ModeResult result : summary.results()) {
            if (!result.passed()) {
                out.println(FeedbackFormatter.feedback(result));
            }
        }
        out.println(FeedbackFormatter.summary(summary));
        out.flush();
        return summary.allPassed() ? GrafcetCli.EXIT_OK : GrafcetCli.EXIT_FAILED_VERIFICATION;
    }
}
