package com.phillippitts.avifconverter.domain;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Either a {@link ConversionResult} or a {@link ConversionFailure}, never both.
 */
public final class ConversionOutcome {

    private final ConversionResult result;
    private final ConversionFailure failure;

    private ConversionOutcome(ConversionResult result, ConversionFailure failure) {
        this.result = result;
        this.failure = failure;
    }

    public static ConversionOutcome success(ConversionResult result) {
        return new ConversionOutcome(Objects.requireNonNull(result, "result"), null);
    }

    public static ConversionOutcome failure(ConversionFailure failure) {
        return new ConversionOutcome(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess() {
        return result != null;
    }

    /**
     * @return the conversion result
     * @throws NoSuchElementException if this outcome is a failure
     */
    public ConversionResult result() {
        if (result == null) {
            throw new NoSuchElementException("Outcome is a failure: " + failure.kind());
        }
        return result;
    }

    /**
     * @return the classified failure
     * @throws NoSuchElementException if this outcome is a success
     */
    public ConversionFailure failure() {
        if (failure == null) {
            throw new NoSuchElementException("Outcome is a success");
        }
        return failure;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ConversionOutcome[success, outputSize=" + result.outputSize()
                    + ", stages=" + result.stages().size() + "]";
        }
        return "ConversionOutcome[failure, " + failure.diagnostic() + "]";
    }
}
