package dev.grafcet.cli;

import dev.grafcet.engine.ConductSynthesizer;
import dev.grafcet.engine.ModeGraphLoader;
import dev.grafcet.engine.ProgramStructureChecker;
import dev.grafcet.engine.ProgramWriter;
import dev.grafcet.model.ConductOptions;
import dev.grafcet.model.ModeGraph;
import dev.grafcet.model.Program;
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
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "synthesize",
    mixinStandardHelpOptions = true,
    description = "Print the conduct program synthesized from a GSRSM mode description."
)
public class SynthesizeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SynthesizeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "GSRSM JSON file (modes and transitions)")
    private Path gsrsmFile;

    @Option(names = "--title", defaultValue = ConductOptions.DEFAULT_TITLE,
        description = "Program title (default: ${DEFAULT-VALUE})")
    private String title;

    @Option(names = "--sub-program", defaultValue = ConductOptions.DEFAULT_SUB_PROGRAM,
        description = "Sub-program each macro step links to (default: ${DEFAULT-VALUE})")
    private String subProgram;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ModeGraph graph;
        try {
            graph = ModeGraphLoader.loadFromFile(gsrsmFile);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: cannot read GSRSM description " + gsrsmFile + ": " + e.getMessage());
            return GrafcetCli.EXIT_ERROR;
        }

        Program program = ConductSynthesizer.synthesize(graph, new ConductOptions(title, subProgram));
        List<String> violations = ProgramStructureChecker.check(program);
        if (!violations.isEmpty()) {
            violations.forEach(v -> err.println("Error: " + v));
            return GrafcetCli.EXIT_ERROR;
        }

        log.info("Synthesized conduct program for {} activated modes", graph.modes().size());
        out.print(ProgramWriter.write(program));
        out.flush();
        return GrafcetCli.EXIT_OK;
    }
}
