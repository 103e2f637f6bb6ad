package com.phillippitts.figuredbass.music.chord;

import com.phillippitts.figuredbass.music.PitchName;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Finds root, members, inversion and quality of a set of pitch names.
 *
 * <p>Augmented sixth chords are recognised only with the flat sixth degree in the bass,
 * which is how figured bass writes them ({@code "#6"}, {@code "6,#4,3"}, {@code "6,5,#4"...}).
 */
@Component
public class ChordAnalyzer {

    /**
     * Analyzes distinct pitch names, bass first.
     *
     * @param names pitch names with the bass at index 0
     * @return analysis; never null
     * @throws IllegalArgumentException if names is empty
     */
    public ChordAnalysis analyze(List<PitchName> names) {
        Objects.requireNonNull(names, "Names must not be null");
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Cannot analyze an empty chord");
        }
        PitchName bass = names.get(0);
        PitchName root = findRoot(names);
        if (root == null) {
            return new ChordAnalysis(names, bass, null, null, null, -1, ChordQuality.OTHER);
        }

        PitchName third = memberAbove(root, names, 2);
        PitchName fifth = memberAbove(root, names, 4);
        PitchName seventh = memberAbove(root, names, 6);
        int inversion = inversionOf(bass, root, third, fifth, seventh);
        ChordQuality quality = augmentedSixthQuality(names);
        if (quality == null) {
            quality = tertianQuality(names.size(), root, third, fifth, seventh);
        }
        return new ChordAnalysis(names, root, third, fifth, seventh, inversion, quality);
    }

    private static PitchName findRoot(List<PitchName> names) {
        for (PitchName candidate : names) {
            boolean stacks = true;
            for (PitchName other : names) {
                int steps = Math.floorMod(other.step() - candidate.step(), 7);
                if (!other.equals(candidate) && steps != 2 && steps != 4 && steps != 6) {
                    stacks = false;
                    break;
                }
            }
            if (stacks) {
                return candidate;
            }
        }
        return null;
    }

    private static PitchName memberAbove(PitchName root, List<PitchName> names, int steps) {
        for (PitchName name : names) {
            if (Math.floorMod(name.step() - root.step(), 7) == steps) {
                return name;
            }
        }
        return null;
    }

    private static int inversionOf(PitchName bass, PitchName root, PitchName third,
                                   PitchName fifth, PitchName seventh) {
        if (bass.equals(root)) {
            return 0;
        }
        if (bass.equals(third)) {
            return 1;
        }
        if (bass.equals(fifth)) {
            return 2;
        }
        return bass.equals(seventh) ? 3 : -1;
    }

    private static ChordQuality tertianQuality(int size, PitchName root, PitchName third,
                                               PitchName fifth, PitchName seventh) {
        if (third == null || fifth == null) {
            return ChordQuality.OTHER;
        }
        int t = semitones(root, third);
        int f = semitones(root, fifth);
        if (size == 3 && seventh == null) {
            if (t == 4 && f == 7) {
                return ChordQuality.MAJOR_TRIAD;
            }
            if (t == 3 && f == 7) {
                return ChordQuality.MINOR_TRIAD;
            }
            if (t == 3 && f == 6) {
                return ChordQuality.DIMINISHED_TRIAD;
            }
            return t == 4 && f == 8 ? ChordQuality.AUGMENTED_TRIAD : ChordQuality.OTHER;
        }
        if (size == 4 && seventh != null) {
            int s = semitones(root, seventh);
            if (t == 4 && f == 7 && s == 10) {
                return ChordQuality.DOMINANT_SEVENTH;
            }
            if (t == 3 && f == 6 && s == 9) {
                return ChordQuality.DIMINISHED_SEVENTH;
            }
            if (t == 3 && f == 6 && s == 10) {
                return ChordQuality.HALF_DIMINISHED_SEVENTH;
            }
            return ChordQuality.OTHER_SEVENTH;
        }
        return ChordQuality.OTHER;
    }

    private static ChordQuality augmentedSixthQuality(List<PitchName> names) {
        PitchName bass = names.get(0);
        boolean majorThird = false;
        boolean augmentedSixth = false;
        boolean augmentedFourth = false;
        boolean perfectFifth = false;
        boolean doublyAugmentedFourth = false;
        for (PitchName name : names.subList(1, names.size())) {
            int generic = Math.floorMod(name.step() - bass.step(), 7) + 1;
            int semis = semitones(bass, name);
            if (generic == 3 && semis == 4) {
                majorThird = true;
            } else if (generic == 6 && semis == 10) {
                augmentedSixth = true;
            } else if (generic == 4 && semis == 6) {
                augmentedFourth = true;
            } else if (generic == 5 && semis == 7) {
                perfectFifth = true;
            } else if (generic == 4 && semis == 7) {
                doublyAugmentedFourth = true;
            } else {
                return null;
            }
        }
        if (!majorThird || !augmentedSixth) {
            return null;
        }
        if (names.size() == 3) {
            return ChordQuality.ITALIAN_AUGMENTED_SIXTH;
        }
        if (names.size() == 4 && augmentedFourth) {
            return ChordQuality.FRENCH_AUGMENTED_SIXTH;
        }
        if (names.size() == 4 && perfectFifth) {
            return ChordQuality.GERMAN_AUGMENTED_SIXTH;
        }
        if (names.size() == 4 && doublyAugmentedFourth) {
            return ChordQuality.SWISS_AUGMENTED_SIXTH;
        }
        return null;
    }

    private static int semitones(PitchName from, PitchName to) {
        return Math.floorMod(to.pitchClass() - from.pitchClass(), 12);
    }
}
