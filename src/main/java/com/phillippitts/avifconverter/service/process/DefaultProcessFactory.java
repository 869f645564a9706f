package com.phillippitts.avifconverter.service.process;

import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 *
 * <p>Stdin is closed for the child; codec tools read their input from files in the scratch area.
 */
@Component
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        // Keep stderr separate from stdout (we capture both)
        pb.redirectErrorStream(false);
        pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
        return pb.start();
    }

    private static java.io.File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new java.io.File(windows ? "NUL" : "/dev/null");
    }
}
