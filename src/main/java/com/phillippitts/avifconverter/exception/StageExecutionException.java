package com.phillippitts.avifconverter.exception;

/**
 * Thrown when a pipeline stage cannot be executed to completion for reasons other than
 * a missing tool, such as a conversion cancelled between stages.
 */
public class StageExecutionException extends AvifConverterException {

    private final String stageName;
    private final int exitCode;

    public StageExecutionException(String message, String stageName, int exitCode) {
        super(message + " (stage: " + stageName + ")");
        this.stageName = stageName;
        this.exitCode = exitCode;
    }

    public String getStageName() {
        return stageName;
    }

    public int getExitCode() {
        return exitCode;
    }
}
