package com.phillippitts.avifconverter.domain;

/**
 * Uniform failure categories of a conversion.
 */
public enum ErrorKind {
    /** Caller's fault: unsupported or missing format. */
    INPUT_ERROR(true),
    /** Host misconfiguration: required tool absent, scratch area unavailable. */
    ENVIRONMENT_ERROR(false),
    /** A pipeline stage ran and failed (non-zero exit, timeout, cancellation). */
    STAGE_FAILURE(false),
    /** Reading or writing an artifact failed independently of the external tool. */
    IO_ERROR(false);

    private final boolean clientError;

    ErrorKind(boolean clientError) {
        this.clientError = clientError;
    }

    public boolean isClientError() {
        return clientError;
    }

    /** Lower-case tag for metrics and logs. */
    public String tag() {
        return name().toLowerCase().replace('_', '-');
    }
}
