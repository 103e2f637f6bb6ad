package com.phillippitts.figuredbass.domain;

import com.phillippitts.figuredbass.music.Pitch;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable assignment of one sounding pitch to every voice at one moment.
 *
 * <p>Pitches follow the voice order of the ensemble: highest voice first, bass last.
 *
 * @param pitches one pitch per voice, bass last (must not be null or shorter than two)
 */
public record Possibility(List<Pitch> pitches) {

    /**
     * Compact constructor with validation.
     *
     * @throws NullPointerException if pitches or any pitch is null
     * @throws IllegalArgumentException if fewer than two pitches are given
     */
    public Possibility {
        Objects.requireNonNull(pitches, "Pitches must not be null");
        pitches = List.copyOf(pitches);
        if (pitches.size() < 2) {
            throw new IllegalArgumentException("A possibility needs a bass and at least one upper voice");
        }
    }

    public static Possibility of(Pitch... pitches) {
        return new Possibility(List.of(pitches));
    }

    /** Parses space-separated pitches, highest first: {@code "G4 E4 C4 C3"}. */
    public static Possibility parse(String text) {
        Objects.requireNonNull(text, "Possibility text must not be null");
        return new Possibility(Arrays.stream(text.strip().split("\\s+")).map(Pitch::parse).toList());
    }

    public Pitch pitch(int voiceIndex) {
        return pitches.get(voiceIndex);
    }

    public Pitch bass() {
        return pitches.get(pitches.size() - 1);
    }

    public int size() {
        return pitches.size();
    }

    /** Upper voices only, highest first. */
    public List<Pitch> upperPitches() {
        return pitches.subList(0, pitches.size() - 1);
    }

    @Override
    public String toString() {
        return pitches.stream().map(Pitch::nameWithOctave).collect(Collectors.joining(" ", "(", ")"));
    }
}
