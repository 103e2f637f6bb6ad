package com.phillippitts.figuredbass.music;

import java.util.Objects;

/**
 * Octave-less spelled pitch name such as {@code F#} or {@code B-}.
 *
 * <p>Flats are written with {@code -} and sharps with {@code #}, so {@code B--} is B double flat.
 *
 * @param step  diatonic step index, 0 = C through 6 = B
 * @param alter chromatic alteration in semitones (-2..2 in practice)
 */
public record PitchName(int step, int alter) {

    static final String STEP_LETTERS = "CDEFGAB";
    static final int[] STEP_SEMITONES = {0, 2, 4, 5, 7, 9, 11};

    public PitchName {
        if (step < 0 || step > 6) {
            throw new IllegalArgumentException("Step must be between 0 and 6, got: " + step);
        }
        if (Math.abs(alter) > 4) {
            throw new IllegalArgumentException("Unsupported alteration: " + alter);
        }
    }

    /**
     * Parses a name like {@code "C"}, {@code "F#"}, {@code "B-"} or {@code "Eb"}.
     *
     * @param text pitch name without octave
     * @return parsed name
     * @throws IllegalArgumentException if the text is not a pitch name
     */
    public static PitchName parse(String text) {
        Objects.requireNonNull(text, "Pitch name must not be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Pitch name must not be blank");
        }
        int step = STEP_LETTERS.indexOf(Character.toUpperCase(trimmed.charAt(0)));
        if (step < 0) {
            throw new IllegalArgumentException("Unknown pitch letter in: " + text);
        }
        return new PitchName(step, parseAccidental(trimmed.substring(1), text));
    }

    static int parseAccidental(String accidental, String source) {
        int alter = 0;
        for (char c : accidental.toCharArray()) {
            switch (c) {
                case '#' -> alter++;
                case '-', 'b' -> alter--;
                default -> throw new IllegalArgumentException("Unknown accidental '" + c + "' in: " + source);
            }
        }
        return alter;
    }

    /** Pitch class 0..11 with C = 0. */
    public int pitchClass() {
        return Math.floorMod(STEP_SEMITONES[step] + alter, 12);
    }

    public char letter() {
        return STEP_LETTERS.charAt(step);
    }

    public PitchName withAlter(int newAlter) {
        return new PitchName(step, newAlter);
    }

    /**
     * Transposes this name by a spelled interval, ignoring octave placement.
     */
    public PitchName transpose(Interval interval) {
        return Pitch.of(this, 4).transpose(interval).pitchName();
    }

    /** Returns {@code true} if both names sound the same pitch class. */
    public boolean isEnharmonicWith(PitchName other) {
        return other != null && pitchClass() == other.pitchClass();
    }

    /** Spelled name, e.g. {@code "B-"}. */
    public String name() {
        StringBuilder sb = new StringBuilder().append(letter());
        char symbol = alter > 0 ? '#' : '-';
        for (int i = 0; i < Math.abs(alter); i++) {
            sb.append(symbol);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name();
    }
}
