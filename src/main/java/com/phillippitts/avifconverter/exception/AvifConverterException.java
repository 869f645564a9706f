package com.phillippitts.avifconverter.exception;

/**
 * Base exception for all avif-converter application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AvifConverterException extends RuntimeException {

    public AvifConverterException(String message) {
        super(message);
    }

    public AvifConverterException(String message, Throwable cause) {
        super(message, cause);
    }

    public AvifConverterException(Throwable cause) {
        super(cause);
    }
}
