package com.phillippitts.figuredbass.exception;

/**
 * Thrown when a chain is queried or advanced out of order, e.g. counting before pruning
 * has completed.
 */
public class ChainNotReadyException extends FiguredBassException {

    private final String state;

    public ChainNotReadyException(String operation, String state) {
        super("Cannot " + operation + " while chain is " + state);
        this.state = state;
    }

    public String getState() {
        return state;
    }
}
