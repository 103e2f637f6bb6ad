package com.phillippitts.figuredbass.exception;

/**
 * Thrown when a figure string cannot be parsed.
 */
public class InvalidNotationException extends InvalidInputException {

    private final String notation;

    public InvalidNotationException(String notation, String reason) {
        super("figure \"" + notation + "\": " + reason);
        this.notation = notation;
    }

    public String getNotation() {
        return notation;
    }
}
