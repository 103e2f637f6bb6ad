package com.phillippitts.figuredbass.exception;

/**
 * Base exception for all figured-bass realization errors.
 * All domain exceptions extend this class so callers can handle realization failures in one place.
 */
public class FiguredBassException extends RuntimeException {

    public FiguredBassException(String message) {
        super(message);
    }

    public FiguredBassException(String message, Throwable cause) {
        super(message, cause);
    }

    public FiguredBassException(Throwable cause) {
        super(cause);
    }
}
