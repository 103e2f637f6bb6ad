package com.phillippitts.figuredbass.exception;

/**
 * Thrown when a realization request is rejected before any slot is built:
 * an empty bass line, an empty voice list, or malformed bass/figure text.
 */
public class InvalidInputException extends FiguredBassException {

    private final String reason;

    public InvalidInputException(String reason) {
        super("Invalid realization input: " + reason);
        this.reason = reason;
    }

    public InvalidInputException(String reason, Throwable cause) {
        super("Invalid realization input: " + reason, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
