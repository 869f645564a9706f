package com.phillippitts.avifconverter.exception;

/**
 * Thrown when a per-request scratch directory cannot be created (disk full, permissions).
 * Never retried.
 */
public class ScratchAreaException extends AvifConverterException {

    private final String root;

    public ScratchAreaException(String root, Throwable cause) {
        super("Cannot create scratch area under: " + root, cause);
        this.root = root;
    }

    public String getRoot() {
        return root;
    }
}
