package com.phillippitts.avifconverter.service.process;

/**
 * Constants for stage process management and stream handling.
 *
 * <p><b>STDERR_MAX_BYTES (256KB):</b> enough for any codec diagnostic while keeping a runaway
 * tool from growing the heap. <b>ERROR_SNIPPET_MAX_CHARS (2KB):</b> roughly the first 30 lines
 * of stderr, attached to classified failures and log lines.
 *
 * @see ProcessExecutor
 * @since 1.0
 */
public final class ProcessConstants {

    /**
     * Maximum bytes to capture from stderr per stage.
     */
    public static final int STDERR_MAX_BYTES = 256 * 1024;

    /**
     * Maximum characters of stderr carried in a failure outcome.
     */
    public static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    /**
     * Exit code reported when the process never exited by itself (timeout, cancellation).
     */
    public static final int NO_EXIT_CODE = -1;

    private ProcessConstants() {
        // Utility class - prevent instantiation
    }
}
