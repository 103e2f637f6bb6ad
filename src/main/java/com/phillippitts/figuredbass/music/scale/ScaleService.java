package com.phillippitts.figuredbass.music.scale;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.notation.Notation;

import java.util.Collection;
import java.util.List;

/**
 * Key and scale membership queries used to turn figures into concrete pitches.
 */
public interface ScaleService {

    /**
     * Spelled scale pitch for a 0-based degree of the key.
     */
    PitchName pitchNameForDegree(Key key, int degree);

    /**
     * 0-based degree of a pitch name's letter within the key.
     */
    int degreeOf(Key key, PitchName name);

    /**
     * Pitch names implied by a bass note and its figures: the bass name first, followed by
     * the figured intervals from the lowest number up.
     *
     * @param key     key of the realization
     * @param bass    bass pitch (its spelling is kept as given)
     * @param figures parsed figures
     * @return distinct pitch names, bass first
     */
    List<PitchName> pitchNamesFor(Key key, Pitch bass, Notation figures);

    /**
     * All pitches spelled with one of the given names inside [low, high], ascending.
     */
    List<Pitch> pitchesInRange(Collection<PitchName> names, Pitch low, Pitch high);
}
