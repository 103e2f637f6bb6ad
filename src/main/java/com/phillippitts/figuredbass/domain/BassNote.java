package com.phillippitts.figuredbass.domain;

import com.phillippitts.figuredbass.music.Pitch;

import java.util.Objects;

/**
 * One note of a figured bass line.
 *
 * @param pitch  bass pitch, sounded exactly by the bass voice
 * @param figure figure text as written under the note; empty for a plain triad
 */
public record BassNote(Pitch pitch, String figure) {

    public BassNote {
        Objects.requireNonNull(pitch, "Bass pitch must not be null");
        figure = figure == null ? "" : figure.strip();
    }

    public static BassNote of(String pitch, String figure) {
        return new BassNote(Pitch.parse(pitch), figure);
    }

    public static BassNote of(String pitch) {
        return of(pitch, "");
    }

    @Override
    public String toString() {
        return figure.isEmpty() ? pitch.nameWithOctave() : pitch.nameWithOctave() + " " + figure;
    }
}
