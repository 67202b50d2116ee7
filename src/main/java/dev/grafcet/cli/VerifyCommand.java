package dev.grafcet.cli;

import dev.grafcet.engine.CompiledProgramLoader;
import dev.grafcet.engine.FeedbackFormatter;
import dev.grafcet.engine.IoVocabularyLoader;
import dev.grafcet.engine.StaticVerifier;
import dev.grafcet.model.CompiledProgram;
import dev.grafcet.model.IoVocabulary;
import dev.grafcet.model.Issue;
import dev.grafcet.model.ModeCategory;
import dev.grafcet.model.VerificationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
    name = "verify",
    mixinStandardHelpOptions = true,
    description = "Statically verify one compiled SFC program."
)
public class VerifyCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VerifyCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Compiled SFC JSON file")
    private Path programFile;

    @Option(names = "--io", description = "IO vocabulary JSON file (variables and actions)")
    private Path ioFile;

    @Option(names = "--mode", description = "Mode id the program belongs to, e.g. D1 (enables mode-specific checks)")
    private String modeId;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompiledProgram program;
        IoVocabulary vocabulary;
        try {
            program = CompiledProgramLoader.loadFromFile(programFile);
            if (ioFile != null) {
                vocabulary = IoVocabularyLoader.loadFromFile(ioFile);
            } else {
                log.warn("No IO vocabulary given, every variable and action will be reported as undefined");
                vocabulary = IoVocabulary.empty();
            }
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return GrafcetCli.EXIT_ERROR;
        }

        var report = new VerificationReport(StaticVerifier.verify(program, vocabulary, ModeCategory.of(modeId)));
        for (Issue issue : report.issues()) {
            out.print(FeedbackFormatter.issueLines(issue));
        }
        out.println("Status: %s (%d errors, %d warnings)".formatted(
            report.status(), report.errorCount(), report.warningCount()));
        if (!report.passed()) {
            out.println();
            FeedbackFormatter.corrections(report).forEach(out::println);
        }
        out.flush();
        return report.passed() ? GrafcetCli.EXIT_OK : GrafcetCli.EXIT_FAILED_VERIFICATION;
    }
}
