package com.phillippitts.figuredbass.service.segment;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Rules that apply to a single possibility. All methods return {@code true} when the rule is
 * satisfied unless their name says otherwise.
 */
public final class PossibilityRules {

    private PossibilityRules() {
        // Utility class - prevent instantiation
    }

    /** A higher voice sounding below a lower one. Unisons are not crossings. */
    public static boolean crosses(Pitch higherVoice, Pitch lowerVoice) {
        return higherVoice.midi() < lowerVoice.midi();
    }

    /** Whether two adjacent voices are further apart than {@code maxSeparation} (null means unlimited). */
    public static boolean exceedsSeparation(Pitch higherVoice, Pitch lowerVoice, Integer maxSeparation) {
        return maxSeparation != null && Math.abs(higherVoice.midi() - lowerVoice.midi()) > maxSeparation;
    }

    public static boolean hasVoiceCrossing(Possibility possibility) {
        for (int i = 0; i < possibility.size() - 1; i++) {
            for (int j = i + 1; j < possibility.size(); j++) {
                if (crosses(possibility.pitch(i), possibility.pitch(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /** Returns {@code true} if any required name is missing. */
    public static boolean isIncomplete(Possibility possibility, Collection<PitchName> required) {
        Set<PitchName> present = new HashSet<>();
        for (Pitch pitch : possibility.pitches()) {
            present.add(pitch.pitchName());
        }
        return !present.containsAll(required);
    }

    /** Whether the span of the upper voices is within {@code maxSemitones} (null means unlimited). */
    public static boolean upperPartsWithinLimit(Possibility possibility, Integer maxSemitones) {
        if (maxSemitones == null) {
            return true;
        }
        int highest = Integer.MIN_VALUE;
        int lowest = Integer.MAX_VALUE;
        for (Pitch pitch : possibility.upperPitches()) {
            highest = Math.max(highest, pitch.midi());
            lowest = Math.min(lowest, pitch.midi());
        }
        return highest - lowest <= maxSemitones;
    }

    /** Whether each voice stays within its max separation from the voice directly above. */
    public static boolean adjacentVoicesWithinSeparation(Possibility possibility, VoiceEnsemble ensemble) {
        for (int i = 1; i < possibility.size(); i++) {
            if (exceedsSeparation(possibility.pitch(i - 1), possibility.pitch(i), ensemble.get(i).maxSeparation())) {
                return false;
            }
        }
        return true;
    }

    /** Returns {@code true} if a name from {@code altered} sounds in more than one voice. */
    public static boolean hasDoubledAlteredTone(Possibility possibility, Collection<PitchName> altered) {
        Set<PitchName> seen = new HashSet<>();
        for (Pitch pitch : possibility.pitches()) {
            if (altered.contains(pitch.pitchName()) && !seen.add(pitch.pitchName())) {
                return true;
            }
        }
        return false;
    }
}
