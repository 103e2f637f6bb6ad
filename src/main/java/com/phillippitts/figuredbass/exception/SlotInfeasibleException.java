package com.phillippitts.figuredbass.exception;

/**
 * Thrown when one chord slot admits no realization under its own local constraints
 * (ranges, spacing, crossing, completeness, doubling).
 */
public class SlotInfeasibleException extends FiguredBassException {

    private final int slotIndex;
    private final String bass;
    private final String figure;

    public SlotInfeasibleException(int slotIndex, String bass, String figure) {
        super("No realization possible for slot " + slotIndex
                + " (bass=" + bass + ", figure=\"" + figure + "\")");
        this.slotIndex = slotIndex;
        this.bass = bass;
        this.figure = figure;
    }

    public SlotInfeasibleException(String message, int slotIndex, String bass, String figure) {
        super(message);
        this.slotIndex = slotIndex;
        this.bass = bass;
        this.figure = figure;
    }

    public int getSlotIndex() {
        return slotIndex;
    }

    public String getBass() {
        return bass;
    }

    public String getFigure() {
        return figure;
    }
}
