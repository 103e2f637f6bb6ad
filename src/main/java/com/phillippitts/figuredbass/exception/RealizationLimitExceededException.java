package com.phillippitts.figuredbass.exception;

/**
 * Thrown when a slot produces more realizations than the configured cap. The search is
 * aborted rather than truncated.
 */
public class RealizationLimitExceededException extends FiguredBassException {

    private final int slotIndex;
    private final int limit;

    public RealizationLimitExceededException(String message, int slotIndex, int limit) {
        super(message);
        this.slotIndex = slotIndex;
        this.limit = limit;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public int getLimit() {
        return limit;
    }
}
