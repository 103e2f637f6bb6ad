package com.phillippitts.figuredbass.music.scale;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.notation.Figure;
import com.phillippitts.figuredbass.music.notation.Notation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * {@link ScaleService} over the seven-note diatonic modes.
 *
 * <p>Every diatonic mode holds each letter exactly once, so a bass note's degree follows from
 * its letter alone. A chromatic bass (say F# in C major) therefore counts from the F of the
 * key signature, and the figures above it are spelled from the key.
 */
@Component
public class DiatonicScaleService implements ScaleService {

    @Override
    public PitchName pitchNameForDegree(Key key, int degree) {
        int d = Math.floorMod(degree, 7);
        int step = (key.tonic().step() + d) % 7;
        int target = key.tonic().pitchClass() + key.mode().semitonesAbove(d);
        int natural = new PitchName(step, 0).pitchClass();
        int alter = Math.floorMod(target - natural, 12);
        if (alter > 6) {
            alter -= 12;
        }
        return new PitchName(step, alter);
    }

    @Override
    public int degreeOf(Key key, PitchName name) {
        return Math.floorMod(name.step() - key.tonic().step(), 7);
    }

    @Override
    public List<PitchName> pitchNamesFor(Key key, Pitch bass, Notation figures) {
        int bassDegree = degreeOf(key, bass.pitchName());
        List<Figure> ordered = new ArrayList<>(figures.figures());
        Collections.reverse(ordered);

        Set<PitchName> names = new LinkedHashSet<>();
        names.add(bass.pitchName());
        for (Figure figure : ordered) {
            PitchName diatonic = pitchNameForDegree(key, bassDegree + figure.number() - 1);
            names.add(figure.modifier().apply(diatonic));
        }
        return List.copyOf(names);
    }

    @Override
    public List<Pitch> pitchesInRange(Collection<PitchName> names, Pitch low, Pitch high) {
        List<Pitch> pitches = new ArrayList<>();
        for (int octave = low.octave() - 1; octave <= high.octave() + 1; octave++) {
            for (PitchName name : names) {
                Pitch candidate = Pitch.of(name, octave);
                if (candidate.midi() >= low.midi() && candidate.midi() <= high.midi()) {
                    pitches.add(candidate);
                }
            }
        }
        pitches.sort(null);
        return pitches;
    }
}
