package com.phillippitts.avifconverter.service.process;

import com.phillippitts.avifconverter.config.ConverterProperties;
import com.phillippitts.avifconverter.domain.MemorySnapshot;
import com.phillippitts.avifconverter.domain.StageResult;
import com.phillippitts.avifconverter.domain.StageResult.Termination;
import com.phillippitts.avifconverter.domain.StageSpec;
import com.phillippitts.avifconverter.exception.ToolNotFoundException;
import com.phillippitts.avifconverter.service.instrumentation.ResourceInstrumentation;
import com.phillippitts.avifconverter.util.ProcessTimeouts;
import com.phillippitts.avifconverter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs one external codec command and reports how it went.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently (capped)
 * - Optionally sample resident memory while the child runs ({@link #runMonitored})
 * - Enforce the optional stage timeout and terminate runaway or abandoned processes
 * - Report non-zero exits as a {@link StageResult}, never as an exception
 *
 * <p>A launch failure (executable missing or not executable) is the one condition raised as an
 * exception, {@link ToolNotFoundException}, so that host misconfiguration is never mistaken for
 * a stage failure.
 *
 * <p><b>Thread Safety:</b> stateless; all per-run state is local to the call, so one instance
 * serves every concurrent conversion.
 *
 * <p><b>Cancellation:</b> if the calling thread is interrupted while waiting, the child is
 * destroyed (gracefully, then forcibly), the interrupt flag is restored and the result carries
 * {@link Termination#CANCELLED}.
 */
@Component
public class ProcessExecutor {

    private static final Logger LOG = LogManager.getLogger(ProcessExecutor.class);

    private final ProcessFactory processFactory;
    private final ResourceInstrumentation instrumentation;
    private final long sampleIntervalMs;
    private final int stageTimeoutSeconds;
    private final int maxStdoutBytes;

    @Autowired
    public ProcessExecutor(ProcessFactory processFactory,
                           ResourceInstrumentation instrumentation,
                           ConverterProperties properties) {
        this(processFactory, instrumentation, properties.sampleIntervalMs(),
                properties.stageTimeoutSeconds(), properties.maxStdoutBytes());
    }

    ProcessExecutor(ProcessFactory processFactory,
                    ResourceInstrumentation instrumentation,
                    long sampleIntervalMs,
                    int stageTimeoutSeconds,
                    int maxStdoutBytes) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.instrumentation = Objects.requireNonNull(instrumentation, "instrumentation");
        if (sampleIntervalMs <= 0) {
            throw new IllegalArgumentException("sampleIntervalMs must be positive");
        }
        this.sampleIntervalMs = sampleIntervalMs;
        this.stageTimeoutSeconds = Math.max(0, stageTimeoutSeconds);
        this.maxStdoutBytes = maxStdoutBytes;
    }

    /**
     * Runs the stage and blocks until it exits; no memory sampling during the run.
     *
     * @param stage   stage being executed
     * @param command resolved command line (executable first)
     * @param workdir working directory (the request's scratch area)
     * @return result, successful or not
     * @throws ToolNotFoundException if the executable cannot be launched
     */
    public StageResult run(StageSpec stage, List<String> command, Path workdir) {
        return execute(stage, command, workdir, false);
    }

    /**
     * Runs the stage while a sampler thread records its peak resident size every
     * {@code converter.sample-interval-ms}.
     *
     * @param stage   stage being executed
     * @param command resolved command line (executable first)
     * @param workdir working directory (the request's scratch area)
     * @return result, successful or not, with {@link StageResult#peakMemoryBytes()} filled in
     * @throws ToolNotFoundException if the executable cannot be launched
     */
    public StageResult runMonitored(StageSpec stage, List<String> command, Path workdir) {
        return execute(stage, command, workdir, true);
    }

    private StageResult execute(StageSpec stage, List<String> command, Path workdir, boolean monitored) {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(command, "command");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }

        MemorySnapshot before = instrumentation.snapshot();
        long startTime = System.nanoTime();
        Process process = launch(stage, command, workdir);

        StreamGobbler out = new StreamGobbler(process.getInputStream(), stage.name() + "-out", maxStdoutBytes);
        StreamGobbler err = new StreamGobbler(process.getErrorStream(), stage.name() + "-err",
                ProcessConstants.STDERR_MAX_BYTES);
        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outThread = out.start();
        Thread errThread = err.start();
        MemorySampler sampler = monitored
                ? new MemorySampler(process, instrumentation, sampleIntervalMs).start(stage.name() + "-mem")
                : null;

        Termination termination = Termination.EXITED;
        try {
            termination = waitForExit(process);
        } finally {
            if (termination != Termination.EXITED || process.isAlive()) {
                destroyProcess(process);
            }
            if (sampler != null) {
                sampler.stop(ProcessTimeouts.SAMPLER_JOIN_TIMEOUT.toMillis());
            }
            Duration gobblerWait = termination == Termination.EXITED
                    ? ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT
                    : ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT;
            joinQuietly(outThread, gobblerWait);
            joinQuietly(errThread, gobblerWait);
        }

        long durationMs = TimeUtils.elapsedMillis(startTime);
        int exitCode = termination == Termination.EXITED ? process.exitValue() : ProcessConstants.NO_EXIT_CODE;
        MemorySnapshot after = instrumentation.snapshot();
        long peak = sampler != null ? sampler.peakBytes() : 0L;

        StageResult result = new StageResult(stage.name(), command.get(0), exitCode, out.content(), err.content(),
                durationMs, peak, before, after, termination);
        if (result.succeeded()) {
            LOG.debug("Stage finished: {}", result.summary());
        } else {
            LOG.warn("Stage failed: {}", result.summary());
        }
        return result;
    }

    private Process launch(StageSpec stage, List<String> command, Path workdir) {
        try {
            return processFactory.start(command, workdir);
        } catch (IOException e) {
            LOG.error("Cannot launch {} for stage {}: {}", command.get(0), stage.name(), e.getMessage());
            throw new ToolNotFoundException(stage.tool(), command.get(0), e);
        }
    }

    /**
     * Blocks until the process exits, the stage timeout expires, or the caller is interrupted.
     */
    private Termination waitForExit(Process process) {
        try {
            if (stageTimeoutSeconds > 0) {
                boolean finished = process.waitFor(stageTimeoutSeconds, TimeUnit.SECONDS);
                return finished ? Termination.EXITED : Termination.TIMED_OUT;
            }
            process.waitFor();
            return Termination.EXITED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for stage process; terminating it");
            return Termination.CANCELLED;
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Destroys a process, gracefully first. Safe to call on an already exited process.
     * Runs with the interrupt flag cleared so that a cancelled caller still waits for the kill.
     */
    static void destroyProcess(Process process) {
        boolean interrupted = Thread.interrupted();
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            LOG.warn("Interrupted while destroying process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying process: {}", e.toString());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
