package com.phillippitts.figuredbass.music.notation;

/**
 * Turns figure strings into structured {@link Notation}.
 */
public interface NotationService {

    /**
     * Parses a figure string.
     *
     * @param figureString comma-separated figures, null or empty for a plain triad
     * @return structured notation in longhand
     * @throws com.phillippitts.figuredbass.exception.InvalidNotationException if malformed
     */
    Notation parseFigure(String figureString);
}
