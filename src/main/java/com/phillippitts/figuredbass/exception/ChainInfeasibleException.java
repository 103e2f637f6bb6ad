package com.phillippitts.figuredbass.exception;

/**
 * Thrown after pruning when every slot is locally satisfiable but no progression
 * connects the first bass note to the last one.
 */
public class ChainInfeasibleException extends FiguredBassException {

    private final int emptiedSlotIndex;
    private final String firstBass;
    private final String firstFigure;
    private final String lastBass;
    private final String lastFigure;

    public ChainInfeasibleException(String message, int emptiedSlotIndex,
                                    String firstBass, String firstFigure,
                                    String lastBass, String lastFigure) {
        super(message);
        this.emptiedSlotIndex = emptiedSlotIndex;
        this.firstBass = firstBass;
        this.firstFigure = firstFigure;
        this.lastBass = lastBass;
        this.lastFigure = lastFigure;
    }

    /** Latest slot (counting backward from the end) that pruning emptied. */
    public int getEmptiedSlotIndex() {
        return emptiedSlotIndex;
    }

    public String getFirstBass() {
        return firstBass;
    }

    public String getFirstFigure() {
        return firstFigure;
    }

    public String getLastBass() {
        return lastBass;
    }

    public String getLastFigure() {
        return lastFigure;
    }
}
