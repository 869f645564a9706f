package com.phillippitts.avifconverter.util;

import java.time.Duration;

/**
 * Standard timeout values for process and thread management.
 *
 * <p><b>Usage:</b> Used by {@link com.phillippitts.avifconverter.service.process.ProcessExecutor}
 * and {@link com.phillippitts.avifconverter.service.process.ToolAvailabilityChecker}
 * for subprocess and helper thread lifecycle.
 *
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Timeout for stream gobbler threads to flush buffered output after process completion.
     *
     * <p>500ms is sufficient for typical codec stdout/stderr volumes (&lt;100KB).
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for stream gobbler threads during cleanup (best-effort). Gobblers are daemon
     * threads, so stragglers die with the JVM.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the memory sampler thread to notice process exit and stop.
     *
     * <p>Must exceed the largest sensible sampling interval; the sampler checks the exit flag
     * once per interval.
     */
    public static final Duration SAMPLER_JOIN_TIMEOUT = Duration.ofMillis(2000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
