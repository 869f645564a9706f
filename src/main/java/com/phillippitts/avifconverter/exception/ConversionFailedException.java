package com.phillippitts.avifconverter.exception;

import com.phillippitts.avifconverter.domain.ConversionFailure;

import java.util.Objects;

/**
 * Raised by the HTTP layer to hand a classified failure outcome to the exception handler.
 * The orchestrator itself returns failures as values and never throws this.
 */
public class ConversionFailedException extends AvifConverterException {

    private final transient ConversionFailure failure;

    public ConversionFailedException(ConversionFailure failure) {
        super(Objects.requireNonNull(failure, "failure").diagnostic());
        this.failure = failure;
    }

    public ConversionFailure getFailure() {
        return failure;
    }
}
