package com.phillippitts.avifconverter.exception;

/**
 * Thrown when the declared input format is missing or not one of the supported formats
 * (jpeg, heic).
 */
public class UnsupportedFormatException extends AvifConverterException {

    private final String declaredFormat;

    public UnsupportedFormatException(String declaredFormat) {
        super("Unsupported input format: " + declaredFormat + " (expected jpeg or heic)");
        this.declaredFormat = declaredFormat;
    }

    public String getDeclaredFormat() {
        return declaredFormat;
    }
}
