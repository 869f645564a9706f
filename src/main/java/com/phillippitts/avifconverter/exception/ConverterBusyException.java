package com.phillippitts.avifconverter.exception;

/**
 * Thrown when no conversion permit becomes available within the configured wait.
 */
public class ConverterBusyException extends AvifConverterException {

    private final long waitedMs;

    public ConverterBusyException(long waitedMs) {
        super("Conversion capacity exhausted after " + waitedMs + "ms wait");
        this.waitedMs = waitedMs;
    }

    public ConverterBusyException(String message, Throwable cause) {
        super(message, cause);
        this.waitedMs = 0;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
