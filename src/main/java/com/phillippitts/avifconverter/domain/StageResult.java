package com.phillippitts.avifconverter.domain;

import java.util.Objects;

/**
 * What one external stage run produced.
 *
 * <p>A non-zero exit is a normal result here; classification happens later.
 *
 * @param stageName       logical stage name
 * @param command         executable that was launched
 * @param exitCode        process exit status (-1 when the process was killed or never exited)
 * @param stdout          captured stdout (capped)
 * @param stderr          captured stderr (capped)
 * @param durationMs      wall-clock duration
 * @param peakMemoryBytes highest resident size seen while the stage ran, 0 if not sampled
 * @param before          memory snapshot taken before launch
 * @param after           memory snapshot taken after exit
 * @param termination     how the process ended
 */
public record StageResult(
        String stageName,
        String command,
        int exitCode,
        String stdout,
        String stderr,
        long durationMs,
        long peakMemoryBytes,
        MemorySnapshot before,
        MemorySnapshot after,
        Termination termination
) {
    public StageResult {
        Objects.requireNonNull(stageName, "stageName");
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        Objects.requireNonNull(termination, "termination");
    }

    public boolean succeeded() {
        return termination == Termination.EXITED && exitCode == 0;
    }

    public double peakMemoryMb() {
        return MemorySnapshot.toMb(peakMemoryBytes);
    }

    /**
     * Summary for log lines, without captured output.
     */
    public String summary() {
        return stageName + "[exit=" + exitCode + ", termination=" + termination
                + ", durationMs=" + durationMs + ", peakMb=" + peakMemoryMb() + "]";
    }

    /**
     * How a stage process ended.
     */
    public enum Termination {
        /** Process exited by itself; {@code exitCode} is meaningful. */
        EXITED,
        /** Process exceeded the configured stage timeout and was destroyed. */
        TIMED_OUT,
        /** The waiting thread was interrupted and the process was destroyed. */
        CANCELLED
    }
}
