package dev.grafcet.engine;

import dev.grafcet.model.CompiledProgram;
import dev.grafcet.model.ModeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a project directory laid out as
 * <pre>
 * gsrsm.json
 * io.json
 * modes/&lt;modeId&gt;/&lt;subProgram&gt;.sfc
 * </pre>
 */
public final class ProjectLoader {

    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

    public static final String GSRSM_FILE = "gsrsm.json";
    public static final String IO_FILE = "io.json";
    public static final String MODES_DIR = "modes";

    private ProjectLoader() {}

    public static Path programPath(Path projectDir, String modeId, String subProgramName) {
        return projectDir.resolve(MODES_DIR).resolve(modeId).resolve(subProgramName + ".sfc");
    }

    /**
     * Load the compiled program of every activated mode that has one. Missing files are
     * left out of the map; unreadable files fail the whole load.
     */
    public static Map<String, CompiledProgram> loadPrograms(Path projectDir, ModeGraph graph,
                                                            String subProgramName) throws IOException {
        var programs = new LinkedHashMap<String, CompiledProgram>();
        for (String modeId : graph.activatedModesInPriorityOrder()) {
            Path path = programPath(projectDir, modeId, subProgramName);
            if (!Files.isRegularFile(path)) {
                log.warn("Compiled program not found for mode {}: {}", modeId, path);
                continue;
            }
            try {
                programs.put(modeId, CompiledProgramLoader.loadFromFile(path));
            } catch (IOException e) {
                throw new IOException("Failed to load compiled program from " + path, e);
            }
        }
        return programs;
    }
}
