package com.phillippitts.figuredbass.music.scale;

import com.phillippitts.figuredbass.music.PitchName;

import java.util.Objects;

/**
 * Tonic and mode of a realization.
 *
 * @param tonic tonic pitch name
 * @param mode  diatonic mode
 */
public record Key(PitchName tonic, ScaleMode mode) {

    public Key {
        Objects.requireNonNull(tonic, "Tonic must not be null");
        Objects.requireNonNull(mode, "Mode must not be null");
    }

    public static Key of(String tonic, ScaleMode mode) {
        return new Key(PitchName.parse(tonic), mode);
    }

    public static Key major(String tonic) {
        return of(tonic, ScaleMode.MAJOR);
    }

    public static Key minor(String tonic) {
        return of(tonic, ScaleMode.MINOR);
    }

    /**
     * Parses {@code "C major"}, {@code "g minor"}, {@code "E phrygian"}.
     */
    public static Key parse(String text) {
        Objects.requireNonNull(text, "Key text must not be null");
        String[] parts = text.strip().split("\\s+");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Key must be '<tonic> <mode>', got: " + text);
        }
        String tonic = parts[0].substring(0, 1).toUpperCase() + parts[0].substring(1);
        return new Key(PitchName.parse(tonic), ScaleMode.fromString(parts[1]));
    }

    @Override
    public String toString() {
        return tonic.name() + " " + mode.name().toLowerCase();
    }
}
