package com.phillippitts.figuredbass.service.voice;

import com.phillippitts.figuredbass.music.Interval;

import java.util.Comparator;
import java.util.Objects;

/**
 * One part of the realization.
 *
 * <p>Voices order highest first by sounding range, ties broken by label.
 *
 * @param label         unique name such as "Soprano"
 * @param writtenRange  range as notated
 * @param transposition interval from written to sounding pitch, or null if the voice sounds as written
 * @param maxSeparation largest allowed distance in semitones to the voice directly above, or null for no limit
 * @param clef          default clef for rendering
 */
public record Voice(String label, Range writtenRange, Interval transposition,
                    Integer maxSeparation, Clef clef) implements Comparable<Voice> {

    public static final int DEFAULT_MAX_SEPARATION = 12;

    private static final Comparator<Voice> HIGHEST_FIRST =
            Comparator.comparing(Voice::soundingRange).reversed().thenComparing(Voice::label);

    public Voice {
        Objects.requireNonNull(label, "Voice label must not be null");
        if (label.isBlank()) {
            throw new IllegalArgumentException("Voice label must not be blank");
        }
        Objects.requireNonNull(writtenRange, "Voice range must not be null");
        if (maxSeparation != null && maxSeparation < 0) {
            throw new IllegalArgumentException("Max separation must not be negative, got: " + maxSeparation);
        }
        clef = clef == null ? Clef.TREBLE : clef;
    }

    public static Voice of(String label, String low, String high) {
        return new Voice(label, Range.of(low, high), null, DEFAULT_MAX_SEPARATION, Clef.TREBLE);
    }

    /** Range the voice actually sounds in. */
    public Range soundingRange() {
        return transposition == null ? writtenRange : writtenRange.transpose(transposition);
    }

    public Voice withMaxSeparation(Integer semitones) {
        return new Voice(label, writtenRange, transposition, semitones, clef);
    }

    @Override
    public int compareTo(Voice other) {
        return HIGHEST_FIRST.compare(this, other);
    }

    @Override
    public String toString() {
        return label + soundingRange();
    }
}
