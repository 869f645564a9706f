package com.phillippitts.avifconverter.service.orchestration;

/**
 * Lifecycle states of one conversion.
 */
public enum ConversionState {
    START,
    STAGED,
    RUNNING_STAGE,
    FAILED,
    COMPLETED;

    public boolean isTerminal() {
        return this == FAILED || this == COMPLETED;
    }
}
