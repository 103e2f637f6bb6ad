package com.phillippitts.figuredbass.service.voice;

import com.phillippitts.figuredbass.music.Interval;
import com.phillippitts.figuredbass.music.Pitch;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive pitch range [low, high], compared by sounding pitch.
 *
 * <p>Ordering is lexicographic on (low, high).
 *
 * @param low  lowest allowed pitch
 * @param high highest allowed pitch
 */
public record Range(Pitch low, Pitch high) implements Comparable<Range> {

    private static final Comparator<Range> ORDER =
            Comparator.comparing(Range::low).thenComparing(Range::high);

    public Range {
        Objects.requireNonNull(low, "Low pitch must not be null");
        Objects.requireNonNull(high, "High pitch must not be null");
        if (low.midi() > high.midi()) {
            throw new IllegalArgumentException("Range low " + low + " is above high " + high);
        }
    }

    public static Range of(String low, String high) {
        return new Range(Pitch.parse(low), Pitch.parse(high));
    }

    public boolean contains(Pitch pitch) {
        return pitch.midi() >= low.midi() && pitch.midi() <= high.midi();
    }

    /** Pitches of {@code candidates} inside this range, in their original order. */
    public List<Pitch> filter(List<Pitch> candidates) {
        return candidates.stream().filter(this::contains).toList();
    }

    public Range transpose(Interval interval) {
        return new Range(low.transpose(interval), high.transpose(interval));
    }

    @Override
    public int compareTo(Range other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
