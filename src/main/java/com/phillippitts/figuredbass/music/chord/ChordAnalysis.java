package com.phillippitts.figuredbass.music.chord;

import com.phillippitts.figuredbass.music.PitchName;

import java.util.List;
import java.util.Objects;

/**
 * Tertian reading of a slot's pitch names.
 *
 * @param names     distinct pitch names, bass first
 * @param root      root found by stacking thirds (the bass when no stacking fits)
 * @param third     chord third, or null
 * @param fifth     chord fifth, or null
 * @param seventh   chord seventh, or null
 * @param inversion 0 for root position, 1 for the third in the bass and so on; -1 if unknown
 * @param quality   recognised chord type
 */
public record ChordAnalysis(
        List<PitchName> names,
        PitchName root,
        PitchName third,
        PitchName fifth,
        PitchName seventh,
        int inversion,
        ChordQuality quality
) {

    public ChordAnalysis {
        names = List.copyOf(Objects.requireNonNull(names, "Names must not be null"));
        Objects.requireNonNull(root, "Root must not be null");
        Objects.requireNonNull(quality, "Quality must not be null");
    }

    public PitchName bass() {
        return names.get(0);
    }

    public boolean isDominantSeventh() {
        return quality == ChordQuality.DOMINANT_SEVENTH;
    }

    public boolean isDiminishedSeventh() {
        return quality == ChordQuality.DIMINISHED_SEVENTH;
    }

    public boolean isMajorTriad() {
        return quality == ChordQuality.MAJOR_TRIAD;
    }

    public boolean isMinorTriad() {
        return quality == ChordQuality.MINOR_TRIAD;
    }

    /** Returns {@code true} if the pitch class of {@code name} equals this chord's root. */
    public boolean hasRoot(PitchName name) {
        return root.isEnharmonicWith(name);
    }
}
