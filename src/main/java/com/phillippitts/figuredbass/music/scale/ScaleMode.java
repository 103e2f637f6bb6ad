package com.phillippitts.figuredbass.music.scale;

import java.util.Locale;

/**
 * Diatonic modes accepted for realization keys.
 *
 * <p>Hypophrygian shares the phrygian pitch collection; only the ambitus differs, which does
 * not affect pitch spelling.
 */
public enum ScaleMode {
    MAJOR(2, 2, 1, 2, 2, 2, 1),
    MINOR(2, 1, 2, 2, 1, 2, 2),
    DORIAN(2, 1, 2, 2, 2, 1, 2),
    PHRYGIAN(1, 2, 2, 2, 1, 2, 2),
    HYPOPHRYGIAN(1, 2, 2, 2, 1, 2, 2);

    private final int[] offsets = new int[7];

    ScaleMode(int... steps) {
        int total = 0;
        for (int i = 0; i < 7; i++) {
            offsets[i] = total;
            total += steps[i];
        }
    }

    /** Semitones from the tonic to the given 0-based degree. */
    public int semitonesAbove(int degree) {
        return offsets[Math.floorMod(degree, 7)];
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for unsupported modes
     */
    public static ScaleMode fromString(String text) {
        try {
            return valueOf(text.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unsupported scale mode: " + text, e);
        }
    }
}
