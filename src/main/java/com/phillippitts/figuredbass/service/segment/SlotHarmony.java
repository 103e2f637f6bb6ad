package com.phillippitts.figuredbass.service.segment;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.chord.ChordAnalysis;
import com.phillippitts.figuredbass.music.notation.Notation;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Harmonic content of one bass note: what must sound above it, before any voicing is chosen.
 *
 * @param index        0-based position in the bass line
 * @param bass         bass pitch, sounded exactly by the bass voice
 * @param notation     parsed figures
 * @param pitchNames   required pitch names, bass name first
 * @param alteredNames pitch names produced by an explicit figure accidental
 * @param chord        tertian analysis of {@code pitchNames}
 */
public record SlotHarmony(
        int index,
        Pitch bass,
        Notation notation,
        List<PitchName> pitchNames,
        Set<PitchName> alteredNames,
        ChordAnalysis chord
) {

    public SlotHarmony {
        if (index < 0) {
            throw new IllegalArgumentException("Slot index must not be negative, got: " + index);
        }
        Objects.requireNonNull(bass, "Bass must not be null");
        Objects.requireNonNull(notation, "Notation must not be null");
        pitchNames = List.copyOf(Objects.requireNonNull(pitchNames, "Pitch names must not be null"));
        alteredNames = Set.copyOf(Objects.requireNonNull(alteredNames, "Altered names must not be null"));
        Objects.requireNonNull(chord, "Chord must not be null");
    }

    /** Original figure text. */
    public String figure() {
        return notation.source();
    }

    @Override
    public String toString() {
        return "slot " + index + " " + bass + " \"" + figure() + "\" " + pitchNames;
    }
}
