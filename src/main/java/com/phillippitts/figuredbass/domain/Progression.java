package com.phillippitts.figuredbass.domain;

import com.phillippitts.figuredbass.music.Pitch;

import java.util.List;
import java.util.Objects;

/**
 * Realized harmonization: the index path through a chain together with its possibilities.
 *
 * @param indices       realization index per slot
 * @param possibilities realization per slot, in slot order
 */
public record Progression(IndexProgression indices, List<Possibility> possibilities) {

    public Progression {
        Objects.requireNonNull(indices, "Indices must not be null");
        Objects.requireNonNull(possibilities, "Possibilities must not be null");
        possibilities = List.copyOf(possibilities);
        if (indices.length() != possibilities.size()) {
            throw new IllegalArgumentException("Index count " + indices.length()
                    + " does not match possibility count " + possibilities.size());
        }
    }

    public int length() {
        return possibilities.size();
    }

    /** Bass pitch of every slot, in order. */
    public List<Pitch> bassLine() {
        return possibilities.stream().map(Possibility::bass).toList();
    }

    /** The melodic line of one voice across all slots. */
    public List<Pitch> voiceLine(int voiceIndex) {
        return possibilities.stream().map(p -> p.pitch(voiceIndex)).toList();
    }
}
