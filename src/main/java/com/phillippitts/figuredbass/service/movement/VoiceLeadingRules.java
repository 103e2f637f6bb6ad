package com.phillippitts.figuredbass.service.movement;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;

import java.util.Map;

/**
 * Rules over a pair of consecutive possibilities. Methods named {@code hasX} return
 * {@code true} when the fault is present.
 *
 * <p>Pitches are compared by MIDI number, so enharmonic respellings count as the same pitch.
 * Voice 0 is the highest voice and the last voice is the bass.
 */
public final class VoiceLeadingRules {

    private VoiceLeadingRules() {
        // Utility class - prevent instantiation
    }

    /** Both voices move in the same direction, neither holds. */
    static boolean similarMotion(int higherA, int lowerA, int higherB, int lowerB) {
        int higherMove = Integer.signum(higherB - higherA);
        int lowerMove = Integer.signum(lowerB - lowerA);
        return higherMove != 0 && higherMove == lowerMove;
    }

    public static boolean isParallelFifth(int higherA, int lowerA, int higherB, int lowerB) {
        return Math.abs(higherA - lowerA) % 12 == 7
                && Math.abs(higherB - lowerB) % 12 == 7
                && similarMotion(higherA, lowerA, higherB, lowerB);
    }

    /** Octaves or compound octaves; unisons are checked separately. */
    public static boolean isParallelOctave(int higherA, int lowerA, int higherB, int lowerB) {
        int before = Math.abs(higherA - lowerA);
        int after = Math.abs(higherB - lowerB);
        return before > 0 && after > 0 && before % 12 == 0 && after % 12 == 0
                && similarMotion(higherA, lowerA, higherB, lowerB);
    }

    public static boolean isParallelUnison(int higherA, int lowerA, int higherB, int lowerB) {
        return higherA == lowerA && higherB == lowerB && higherA != higherB;
    }

    /** Similar motion into a fifth from anything other than a fifth. */
    public static boolean isHiddenFifth(int higherA, int lowerA, int higherB, int lowerB) {
        return Math.abs(higherB - lowerB) % 12 == 7
                && Math.abs(higherA - lowerA) % 12 != 7
                && similarMotion(higherA, lowerA, higherB, lowerB);
    }

    /** Similar motion into an octave from anything other than an octave. */
    public static boolean isHiddenOctave(int higherA, int lowerA, int higherB, int lowerB) {
        return Math.abs(higherB - lowerB) % 12 == 0
                && Math.abs(higherA - lowerA) % 12 != 0
                && similarMotion(higherA, lowerA, higherB, lowerB);
    }

    /** A voice moves past where its neighbour just was. */
    public static boolean isOverlap(int higherA, int lowerA, int higherB, int lowerB) {
        return lowerB > higherA || higherB < lowerA;
    }

    public static boolean hasParallelFifths(Possibility a, Possibility b) {
        for (int i = 0; i < a.size() - 1; i++) {
            for (int j = i + 1; j < a.size(); j++) {
                if (isParallelFifth(midi(a, i), midi(a, j), midi(b, i), midi(b, j))) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean hasParallelOctaves(Possibility a, Possibility b) {
        for (int i = 0; i < a.size() - 1; i++) {
            for (int j = i + 1; j < a.size(); j++) {
                if (isParallelOctave(midi(a, i), midi(a, j), midi(b, i), midi(b, j))) {
                    return true;
                }
            }
        }
        return false;
    }

    public static boolean hasParallelUnisons(Possibility a, Possibility b) {
        for (int i = 0; i < a.size() - 1; i++) {
            for (int j = i + 1; j < a.size(); j++) {
                if (isParallelUnison(midi(a, i), midi(a, j), midi(b, i), midi(b, j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Hidden fifth between the highest voice and the bass. */
    public static boolean hasHiddenFifth(Possibility a, Possibility b) {
        int bass = a.size() - 1;
        return isHiddenFifth(midi(a, 0), midi(a, bass), midi(b, 0), midi(b, bass));
    }

    /** Hidden octave between the highest voice and the bass. */
    public static boolean hasHiddenOctave(Possibility a, Possibility b) {
        int bass = a.size() - 1;
        return isHiddenOctave(midi(a, 0), midi(a, bass), midi(b, 0), midi(b, bass));
    }

    public static boolean hasVoiceOverlap(Possibility a, Possibility b) {
        for (int i = 0; i < a.size() - 1; i++) {
            for (int j = i + 1; j < a.size(); j++) {
                if (isOverlap(midi(a, i), midi(a, j), midi(b, i), midi(b, j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Checks per-voice movement limits.
     *
     * @param limits max semitones per voice label; voices without an entry are unlimited
     * @return {@code true} if every limited voice moves no further than its limit
     */
    public static boolean partMovementsWithinLimits(Possibility a, Possibility b, VoiceEnsemble voices,
                                                    Map<String, Integer> limits) {
        for (Map.Entry<String, Integer> limit : limits.entrySet()) {
            int index = voices.indexOf(limit.getKey());
            if (index < 0) {
                continue;
            }
            if (Math.abs(midi(b, index) - midi(a, index)) > limit.getValue()) {
                return false;
            }
        }
        return true;
    }

    private static int midi(Possibility possibility, int voice) {
        return possibility.pitch(voice).midi();
    }
}
