package com.phillippitts.figuredbass.service.movement.resolution;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;

import java.util.Objects;

/**
 * Accepts the motions out of an Italian sixth that could be its resolution.
 *
 * <p>Voice by voice: the fifth holds or moves by M3, m3, M2 up or m2 down; the bass pitch
 * falls a minor second; the root rises a minor second; an upper-voice third falls a minor
 * second. With restricted doublings the root may appear only once and the third only in
 * the bass. Other pitches are unconstrained.
 *
 * @param bass               bass pitch of the sixth chord
 * @param root               chord root (the raised fourth degree)
 * @param third              chord third (the bass name)
 * @param fifth              chord fifth (the tonic)
 * @param restrictDoublings  whether root and third may be doubled
 */
public record ItalianSixthFilter(Pitch bass, PitchName root, PitchName third, PitchName fifth,
                                 boolean restrictDoublings) {

    public ItalianSixthFilter {
        Objects.requireNonNull(bass, "Bass must not be null");
        Objects.requireNonNull(root, "Root must not be null");
        Objects.requireNonNull(third, "Third must not be null");
        Objects.requireNonNull(fifth, "Fifth must not be null");
    }

    public boolean allows(Possibility from, Possibility to) {
        boolean rootResolved = false;
        for (int i = 0; i < from.size(); i++) {
            Pitch a = from.pitch(i);
            Pitch b = to.pitch(i);
            int motion = b.midi() - a.midi();
            PitchName name = a.pitchName();
            if (name.equals(fifth)) {
                if (motion != 0 && !isStepOrThird(a, b)) {
                    return false;
                }
            } else if (a.equals(bass)) {
                if (!fallsMinorSecond(a, b)) {
                    return false;
                }
            } else if (name.equals(root)) {
                if (rootResolved && restrictDoublings) {
                    return false;
                }
                if (motion != 1 || b.diatonicNumber() - a.diatonicNumber() != 1) {
                    return false;
                }
                rootResolved = true;
            } else if (name.equals(third)) {
                if (restrictDoublings || !fallsMinorSecond(a, b)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean fallsMinorSecond(Pitch a, Pitch b) {
        return a.midi() - b.midi() == 1 && a.diatonicNumber() - b.diatonicNumber() == 1;
    }

    // M3 and m3 span two letter steps up, M2 one up, m2 one down
    private static boolean isStepOrThird(Pitch a, Pitch b) {
        int steps = b.diatonicNumber() - a.diatonicNumber();
        int motion = b.midi() - a.midi();
        return switch (motion) {
            case 4, 3 -> steps == 2;
            case 2 -> steps == 1;
            case -1 -> steps == -1;
            default -> false;
        };
    }
}
