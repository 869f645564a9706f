package com.phillippitts.avifconverter.service.orchestration;

/**
 * Tracks the lifecycle of a single conversion and rejects illegal transitions.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * START → STAGED → RUNNING_STAGE(0) → RUNNING_STAGE(1) → ... → COMPLETED
 * START | STAGED | RUNNING_STAGE(i) → FAILED
 * </pre>
 *
 * <p>One instance per request, confined to the converting thread; no locking.
 */
final class ConversionStateMachine {

    private ConversionState state = ConversionState.START;
    private int stageIndex = -1;

    ConversionState state() {
        return state;
    }

    /**
     * @return index of the stage currently or last running, -1 before the first stage
     */
    int stageIndex() {
        return stageIndex;
    }

    void staged() {
        require(state == ConversionState.START, "staged");
        state = ConversionState.STAGED;
    }

    /**
     * Enters the given stage; stages must be entered in order starting at 0.
     */
    void runningStage(int index) {
        boolean first = state == ConversionState.STAGED && index == 0;
        boolean next = state == ConversionState.RUNNING_STAGE && index == stageIndex + 1;
        require(first || next, "runningStage(" + index + ")");
        state = ConversionState.RUNNING_STAGE;
        stageIndex = index;
    }

    void completed(int plannedStages) {
        require(state == ConversionState.RUNNING_STAGE && stageIndex == plannedStages - 1, "completed");
        state = ConversionState.COMPLETED;
    }

    void failed() {
        require(!state.isTerminal(), "failed");
        state = ConversionState.FAILED;
    }

    private void require(boolean legal, String transition) {
        if (!legal) {
            throw new IllegalStateException("Illegal transition " + transition + " from " + state
                    + (state == ConversionState.RUNNING_STAGE ? "(" + stageIndex + ")" : ""));
        }
    }

    @Override
    public String toString() {
        return state == ConversionState.RUNNING_STAGE ? state + "(" + stageIndex + ")" : state.name();
    }
}
