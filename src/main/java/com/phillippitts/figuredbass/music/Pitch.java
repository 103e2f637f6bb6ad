package com.phillippitts.figuredbass.music;

import java.util.Comparator;
import java.util.Objects;

/**
 * Immutable spelled pitch with octave, e.g. {@code C4} (middle C, MIDI 60).
 *
 * <p>Two pitches are {@link #equals(Object) equal} only when their spelling matches; use
 * {@link #midi()} or {@link #isEnharmonicWith(Pitch)} to compare sounding pitch.
 * The natural ordering is by sounding pitch, then by diatonic position.
 *
 * @param name   spelled pitch name
 * @param octave scientific octave number (C4 = middle C)
 */
public record Pitch(PitchName name, int octave) implements Comparable<Pitch> {

    private static final Comparator<Pitch> ORDER =
            Comparator.comparingInt(Pitch::midi).thenComparingInt(Pitch::diatonicNumber);

    public Pitch {
        Objects.requireNonNull(name, "Pitch name must not be null");
    }

    public static Pitch of(PitchName name, int octave) {
        return new Pitch(name, octave);
    }

    /**
     * Parses text like {@code "C4"}, {@code "F#3"}, {@code "B-2"} or {@code "Eb5"}.
     *
     * @param text pitch with trailing octave number
     * @return parsed pitch
     * @throws IllegalArgumentException if the text cannot be parsed
     */
    public static Pitch parse(String text) {
        Objects.requireNonNull(text, "Pitch text must not be null");
        String trimmed = text.trim();
        int digitStart = trimmed.length();
        while (digitStart > 0 && Character.isDigit(trimmed.charAt(digitStart - 1))) {
            digitStart--;
        }
        if (digitStart == trimmed.length() || digitStart == 0) {
            throw new IllegalArgumentException("Pitch must have a letter and an octave: " + text);
        }
        PitchName pitchName = PitchName.parse(trimmed.substring(0, digitStart));
        return new Pitch(pitchName, Integer.parseInt(trimmed.substring(digitStart)));
    }

    /** MIDI note number; C4 = 60. */
    public int midi() {
        return (octave + 1) * 12 + PitchName.STEP_SEMITONES[name.step()] + name.alter();
    }

    /** Diatonic position counting letter steps from C0. */
    public int diatonicNumber() {
        return octave * 7 + name.step();
    }

    public PitchName pitchName() {
        return name;
    }

    public int pitchClass() {
        return name.pitchClass();
    }

    /**
     * Transposes by a spelled interval, keeping correct spelling.
     *
     * @param interval interval to move by (descending intervals have negative generic size)
     * @return transposed pitch
     */
    public Pitch transpose(Interval interval) {
        int targetDiatonic = diatonicNumber() + interval.diatonicSteps();
        int targetMidi = midi() + interval.semitones();
        int step = Math.floorMod(targetDiatonic, 7);
        int newOctave = Math.floorDiv(targetDiatonic, 7);
        int naturalMidi = (newOctave + 1) * 12 + PitchName.STEP_SEMITONES[step];
        return new Pitch(new PitchName(step, targetMidi - naturalMidi), newOctave);
    }

    public boolean isEnharmonicWith(Pitch other) {
        return other != null && midi() == other.midi();
    }

    public boolean isHigherThan(Pitch other) {
        return midi() > other.midi();
    }

    public boolean isLowerThan(Pitch other) {
        return midi() < other.midi();
    }

    /** Spelled name with octave, e.g. {@code "B-2"}. */
    public String nameWithOctave() {
        return name.name() + octave;
    }

    @Override
    public int compareTo(Pitch other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return nameWithOctave();
    }
}
