package com.phillippitts.avifconverter.service.process;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.service.pipeline.CodecTool;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Cheap "is this codec installed" probe, for health checks.
 *
 * <p>Runs {@code <executable> <probe-arg>} (usually {@code --version}) with a bounded wait.
 * Launch failure, timeout or a non-zero exit all mean "not available". Never runs a conversion.
 */
@Component
public class ToolAvailabilityChecker {

    private static final Logger LOG = LogManager.getLogger(ToolAvailabilityChecker.class);
    private static final int PROBE_OUTPUT_CAP = 4096;
    private static final String DEFAULT_PROBE_ARG = "--version";

    private final ProcessFactory processFactory;
    private final ConverterProperties properties;
    private final long timeoutMs;

    @Autowired
    public ToolAvailabilityChecker(ProcessFactory processFactory, ConverterProperties properties) {
        this(processFactory, properties, TimeUnit.SECONDS.toMillis(properties.toolProbeTimeoutSeconds()));
    }

    ToolAvailabilityChecker(ProcessFactory processFactory, ConverterProperties properties, long timeoutMs) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.timeoutMs = timeoutMs;
    }

    /**
     * @param toolName logical tool name ("avifenc", "heif-dec", "ffmpeg") or a bare executable
     * @return true if the tool launched and exited 0 within the probe timeout
     */
    public boolean isAvailable(String toolName) {
        Objects.requireNonNull(toolName, "toolName");
        String executable = properties.executableFor(toolName);
        String probeArg = CodecTool.fromName(toolName).map(CodecTool::probeArgument).orElse(DEFAULT_PROBE_ARG);
        List<String> command = List.of(executable, probeArg);

        Process process;
        try {
            process = processFactory.start(command, null);
        } catch (IOException e) {
            LOG.debug("Tool {} not launchable at {}: {}", toolName, executable, e.getMessage());
            return false;
        }

        new StreamGobbler(process.getInputStream(), "probe-" + toolName + "-out", PROBE_OUTPUT_CAP).start();
        new StreamGobbler(process.getErrorStream(), "probe-" + toolName + "-err", PROBE_OUTPUT_CAP).start();
        try {
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                LOG.warn("Tool probe for {} timed out after {}ms", toolName, timeoutMs);
                ProcessExecutor.destroyProcess(process);
                return false;
            }
            int exit = process.exitValue();
            LOG.debug("Tool probe {} {} exited {}", executable, probeArg, exit);
            return exit == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ProcessExecutor.destroyProcess(process);
            return false;
        }
    }
}
