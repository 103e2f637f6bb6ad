package com.phillippitts.figuredbass.music.notation;

import java.util.Objects;

/**
 * One interval above the bass together with its accidental.
 *
 * @param number   generic interval above the bass (3, 5, 6, 7, ...)
 * @param modifier accidental applied to the resulting pitch
 */
public record Figure(int number, Modifier modifier) {

    public Figure {
        if (number < 1) {
            throw new IllegalArgumentException("Figure number must be positive, got: " + number);
        }
        Objects.requireNonNull(modifier, "Modifier must not be null");
    }

    public static Figure of(int number) {
        return new Figure(number, Modifier.NONE);
    }
}
