package com.phillippitts.avifconverter.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static description of one pipeline stage.
 *
 * <p>Argument templates may contain {@link #INPUT_PLACEHOLDER} and {@link #OUTPUT_PLACEHOLDER};
 * they are substituted with absolute artifact paths when the stage runs. Specs carry no
 * per-request state and are shared across requests.
 *
 * @param name          logical stage name ("decode", "encode")
 * @param tool          logical tool name, also used for availability probes
 * @param executable    executable to launch (path or bare name)
 * @param argTemplate   fixed argument list, placeholders included
 * @param inputRole     artifact the stage reads
 * @param outputRole    artifact the stage writes
 */
public record StageSpec(
        String name,
        String tool,
        String executable,
        List<String> argTemplate,
        ArtifactRole inputRole,
        ArtifactRole outputRole
) {
    public static final String INPUT_PLACEHOLDER = "{input}";
    public static final String OUTPUT_PLACEHOLDER = "{output}";

    public StageSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(executable, "executable");
        argTemplate = argTemplate == null ? List.of() : List.copyOf(argTemplate);
        Objects.requireNonNull(inputRole, "inputRole");
        Objects.requireNonNull(outputRole, "outputRole");
        if (inputRole == outputRole) {
            throw new IllegalArgumentException("Stage " + name + " reads and writes " + inputRole);
        }
    }

    /**
     * Builds the full command line for concrete artifact paths.
     *
     * @param input  absolute path of the input artifact
     * @param output absolute path of the output artifact
     * @return executable followed by resolved arguments
     */
    public List<String> command(String input, String output) {
        List<String> cmd = new ArrayList<>(argTemplate.size() + 1);
        cmd.add(executable);
        for (String arg : argTemplate) {
            cmd.add(arg.replace(INPUT_PLACEHOLDER, input).replace(OUTPUT_PLACEHOLDER, output));
        }
        return cmd;
    }
}
