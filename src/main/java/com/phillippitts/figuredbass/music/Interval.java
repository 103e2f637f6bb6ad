package com.phillippitts.figuredbass.music;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spelled (diatonic) interval such as {@code m2}, {@code -M2}, {@code P4}, {@code A1} or {@code d1}.
 *
 * <p>The generic size is 1 for a unison, 2 for a second and so on; a leading {@code -} makes
 * the interval descending. Compound sizes (9, 10, ...) are accepted.
 *
 * @param name      canonical name as parsed
 * @param generic   signed generic size, never 0 (descending intervals are negative)
 * @param semitones signed size in semitones
 */
public record Interval(String name, int generic, int semitones) {

    private static final Pattern FORMAT = Pattern.compile("(-?)(P|M|m|A|d)(\\d+)");
    private static final int[] MAJOR_OR_PERFECT = {0, 2, 4, 5, 7, 9, 11};

    public static final Interval PERFECT_UNISON = parse("P1");
    public static final Interval MINOR_SECOND = parse("m2");
    public static final Interval MAJOR_SECOND = parse("M2");
    public static final Interval PERFECT_FOURTH = parse("P4");
    public static final Interval PERFECT_FIFTH = parse("P5");

    public Interval {
        Objects.requireNonNull(name, "Interval name must not be null");
        if (generic == 0) {
            throw new IllegalArgumentException("Generic interval size must not be 0");
        }
    }

    /**
     * Parses a spelled interval name.
     *
     * @param text interval like {@code "M3"} or {@code "-m2"}
     * @return parsed interval
     * @throws IllegalArgumentException on unknown quality or impossible quality/size pairs
     */
    public static Interval parse(String text) {
        Objects.requireNonNull(text, "Interval text must not be null");
        Matcher m = FORMAT.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed interval: " + text);
        }
        boolean descending = !m.group(1).isEmpty();
        char quality = m.group(2).charAt(0);
        int size = Integer.parseInt(m.group(3));
        if (size < 1) {
            throw new IllegalArgumentException("Interval size must be positive: " + text);
        }
        int simple = (size - 1) % 7;
        int octaves = (size - 1) / 7;
        boolean perfectType = simple == 0 || simple == 3 || simple == 4;
        int offset = switch (quality) {
            case 'P' -> {
                requireKind(perfectType, text);
                yield 0;
            }
            case 'M' -> {
                requireKind(!perfectType, text);
                yield 0;
            }
            case 'm' -> {
                requireKind(!perfectType, text);
                yield -1;
            }
            case 'A' -> 1;
            case 'd' -> perfectType ? -1 : -2;
            default -> throw new IllegalArgumentException("Unknown interval quality: " + text);
        };
        int semis = MAJOR_OR_PERFECT[simple] + 12 * octaves + offset;
        int sign = descending ? -1 : 1;
        return new Interval(text.trim(), sign * size, sign * semis);
    }

    private static void requireKind(boolean ok, String text) {
        if (!ok) {
            throw new IllegalArgumentException("Quality does not fit interval size: " + text);
        }
    }

    /** Number of letter steps moved; 0 for a unison. */
    public int diatonicSteps() {
        return generic > 0 ? generic - 1 : generic + 1;
    }

    public boolean isDescending() {
        return generic < 0;
    }

    @Override
    public String toString() {
        return name;
    }
}
