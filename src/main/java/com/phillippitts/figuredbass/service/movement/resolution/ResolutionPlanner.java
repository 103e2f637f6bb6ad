package com.phillippitts.figuredbass.service.movement.resolution;

import com.phillippitts.figuredbass.music.Interval;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.chord.ChordAnalysis;
import com.phillippitts.figuredbass.music.chord.ChordQuality;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.segment.SlotHarmony;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Chooses the {@link ResolutionPlan} for a pair of consecutive slots.
 *
 * <p>Dominant sevenths, diminished sevenths and augmented sixths are matched against the
 * following chord in a fixed order; the first resolution whose preconditions hold and whose
 * bass motion lands on the following bass pitch class wins. A tagged chord with no matching
 * resolution is logged and falls back to the ordinary rules.
 *
 * <p>Dominant seventh targets (tonic = root up a perfect fourth):
 * <ul>
 *   <li>major or minor tonic, in any inversion (V4/3 to I6 moves fifth and seventh up)</li>
 *   <li>submediant and subdominant, from root position only</li>
 * </ul>
 * Diminished seventh targets (tonic = root up a minor second): tonic and subdominant triads.
 * French, German and Swiss sixths (tonic = bass up a major third): the cadential six-four
 * and the dominant.
 */
@Component
public class ResolutionPlanner {
    private static final Logger LOG = LogManager.getLogger(ResolutionPlanner.class);

    /**
     * Plans the motion from {@code from} into {@code to}.
     *
     * @param from  earlier slot
     * @param to    later slot
     * @param rules rule snapshot
     * @return plan; never null
     */
    public ResolutionPlan plan(SlotHarmony from, SlotHarmony to, Rules rules) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(rules, "rules");
        ChordAnalysis chord = from.chord();

        if (rules.resolveDominantSeventhProperly() && chord.isDominantSeventh()) {
            return dominantSeventh(from, to, rules);
        }
        if (rules.resolveDiminishedSeventhProperly() && chord.isDiminishedSeventh()) {
            return diminishedSeventh(from, to, rules);
        }
        if (rules.resolveAugmentedSixthProperly() && chord.quality() == ChordQuality.ITALIAN_AUGMENTED_SIXTH) {
            return ResolutionPlan.italianSixth(new ItalianSixthFilter(from.bass(), chord.root(),
                    chord.third(), chord.fifth(), rules.restrictDoublingsInItalianA6Resolution()));
        }
        if (rules.resolveAugmentedSixthProperly() && chord.quality().isAugmentedSixth()) {
            return augmentedSixth(from, to, rules);
        }
        return ResolutionPlan.ordinary();
    }

    private ResolutionPlan dominantSeventh(SlotHarmony from, SlotHarmony to, Rules rules) {
        ChordAnalysis dom = from.chord();
        ChordAnalysis res = to.chord();
        PitchName root = dom.root();
        PitchName third = dom.third();
        PitchName fifth = dom.fifth();
        PitchName seventh = dom.seventh();

        PitchName tonic = root.transpose(Interval.PERFECT_FOURTH);
        PitchName subdominant = tonic.transpose(Interval.PERFECT_FOURTH);
        PitchName majorSubmediant = tonic.transpose(Interval.parse("M6"));
        PitchName minorSubmediant = tonic.transpose(Interval.parse("m6"));
        boolean rootPosition = dom.inversion() == 0;
        boolean v43ToI6 = dom.inversion() == 2 && res.inversion() == 1;

        boolean relax = rules.allowIncompleteDominantResolution() && rootPosition
                && res.root().equals(tonic) && res.quality().isTonicCandidate();

        List<Candidate> candidates = List.of(
                new Candidate(res.root().equals(tonic) && res.isMajorTriad(),
                        "dominantSeventhToMajorTonic", List.of(
                        ToneResolution.ofBassPitch(root, "P4"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, v43ToI6 ? "M2" : "-M2"),
                        ToneResolution.of(seventh, v43ToI6 ? "M2" : "-m2"))),
                new Candidate(res.root().equals(tonic) && res.isMinorTriad(),
                        "dominantSeventhToMinorTonic", List.of(
                        ToneResolution.ofBassPitch(root, "P4"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, v43ToI6 ? "m2" : "-M2"),
                        ToneResolution.of(seventh, v43ToI6 ? "M2" : "-M2"))),
                new Candidate(rootPosition && res.root().equals(majorSubmediant) && res.isMinorTriad(),
                        "dominantSeventhToMinorSubmediant", List.of(
                        ToneResolution.of(root, "M2"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, "-M2"),
                        ToneResolution.of(seventh, "-m2"))),
                new Candidate(rootPosition && res.root().equals(minorSubmediant) && res.isMajorTriad(),
                        "dominantSeventhToMajorSubmediant", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, "-M2"),
                        ToneResolution.of(seventh, "-M2"))),
                new Candidate(rootPosition && res.root().equals(subdominant) && res.isMajorTriad(),
                        "dominantSeventhToMajorSubdominant", List.of(
                        ToneResolution.of(root, "M2"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, "-M2"))),
                new Candidate(rootPosition && res.root().equals(subdominant) && res.isMinorTriad(),
                        "dominantSeventhToMinorSubdominant", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, "m2"),
                        ToneResolution.of(fifth, "-M2"))));

        return select(ResolutionKind.DOMINANT_SEVENTH, "Dominant seventh", from, to, rules, candidates, relax);
    }

    private ResolutionPlan diminishedSeventh(SlotHarmony from, SlotHarmony to, Rules rules) {
        ChordAnalysis dim = from.chord();
        ChordAnalysis res = to.chord();
        PitchName root = dim.root();
        PitchName third = dim.third();
        PitchName fifth = dim.fifth();
        PitchName seventh = dim.seventh();

        PitchName tonic = root.transpose(Interval.MINOR_SECOND);
        PitchName subdominant = tonic.transpose(Interval.PERFECT_FOURTH);

        boolean doubledRoot = rules.doubledRootInDim7();
        // six-five form: doubling follows the inversion of the resolution
        if (rules.inferDim7DoublingFromResolution() && dim.inversion() == 1) {
            if (res.inversion() == 0) {
                doubledRoot = true;
            } else if (res.inversion() == 1) {
                doubledRoot = false;
            }
        }

        List<Candidate> candidates = List.of(
                new Candidate(res.root().equals(tonic) && res.isMajorTriad(),
                        "diminishedSeventhToMajorTonic", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, doubledRoot ? "-M2" : "M2"),
                        ToneResolution.of(fifth, "-m2"),
                        ToneResolution.of(seventh, "-m2"))),
                new Candidate(res.root().equals(tonic) && res.isMinorTriad(),
                        "diminishedSeventhToMinorTonic", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, doubledRoot ? "-M2" : "m2"),
                        ToneResolution.of(fifth, "-M2"),
                        ToneResolution.of(seventh, "-m2"))),
                new Candidate(res.root().equals(subdominant) && res.isMajorTriad(),
                        "diminishedSeventhToMajorSubdominant", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, "-M2"),
                        ToneResolution.of(seventh, "A1"))),
                new Candidate(res.root().equals(subdominant) && res.isMinorTriad(),
                        "diminishedSeventhToMinorSubdominant", List.of(
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(third, "-M2"))));

        return select(ResolutionKind.DIMINISHED_SEVENTH, "Diminished seventh", from, to, rules, candidates, false);
    }

    private ResolutionPlan augmentedSixth(SlotHarmony from, SlotHarmony to, Rules rules) {
        ChordAnalysis aug = from.chord();
        ChordAnalysis res = to.chord();
        ChordQuality type = aug.quality();
        PitchName bass = aug.bass();

        // French and Swiss chords stack from the second above the bass, German from the raised fourth
        PitchName root;
        PitchName fifth;
        PitchName other;
        if (type == ChordQuality.GERMAN_AUGMENTED_SIXTH) {
            root = aug.root();
            fifth = aug.fifth();
            other = aug.seventh();
        } else {
            other = aug.root();
            root = aug.third();
            fifth = aug.seventh();
        }

        PitchName tonic = bass.transpose(Interval.parse("M3"));
        PitchName dominant = tonic.transpose(Interval.PERFECT_FIFTH);

        String toMajorTonicOther = switch (type) {
            case FRENCH_AUGMENTED_SIXTH -> "M2";
            case GERMAN_AUGMENTED_SIXTH -> "A1";
            default -> "m2";
        };
        String toMinorTonicOther = type == ChordQuality.SWISS_AUGMENTED_SIXTH ? "d2" : "m2";

        List<ToneResolution> toMajorTonic = List.of(
                ToneResolution.of(bass, "-m2"),
                ToneResolution.of(root, "m2"),
                ToneResolution.of(fifth, "P1"),
                ToneResolution.of(other, toMajorTonicOther));
        List<ToneResolution> toMinorTonic = type == ChordQuality.GERMAN_AUGMENTED_SIXTH
                ? List.of(
                        ToneResolution.of(bass, "-m2"),
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(fifth, "P1"))
                : List.of(
                        ToneResolution.of(bass, "-m2"),
                        ToneResolution.of(root, "m2"),
                        ToneResolution.of(fifth, "P1"),
                        ToneResolution.of(other, toMinorTonicOther));
        List<ToneResolution> toDominant = switch (type) {
            case SWISS_AUGMENTED_SIXTH -> List.of(
                    ToneResolution.of(bass, "-m2"),
                    ToneResolution.of(root, "m2"),
                    ToneResolution.of(fifth, "-m2"),
                    ToneResolution.of(other, "d1"));
            case GERMAN_AUGMENTED_SIXTH -> List.of(
                    ToneResolution.of(bass, "-m2"),
                    ToneResolution.of(root, "m2"),
                    ToneResolution.of(fifth, "-m2"),
                    ToneResolution.of(other, "-m2"));
            default -> List.of(
                    ToneResolution.of(bass, "-m2"),
                    ToneResolution.of(root, "m2"),
                    ToneResolution.of(fifth, "-m2"));
        };

        List<Candidate> candidates = List.of(
                new Candidate(res.inversion() == 2 && res.root().equals(tonic) && res.isMajorTriad(),
                        "augmentedSixthToMajorTonic", toMajorTonic),
                new Candidate(res.inversion() == 2 && res.root().equals(tonic) && res.isMinorTriad(),
                        "augmentedSixthToMinorTonic", toMinorTonic),
                new Candidate(res.bass().equals(dominant) && res.isMajorTriad(),
                        "augmentedSixthToDominant", toDominant));

        return select(ResolutionKind.AUGMENTED_SIXTH, "Augmented sixth", from, to, rules, candidates, false);
    }

    private ResolutionPlan select(ResolutionKind kind, String label, SlotHarmony from, SlotHarmony to,
                                  Rules rules, List<Candidate> candidates, boolean relaxTarget) {
        for (Candidate candidate : candidates) {
            if (!candidate.applies()) {
                continue;
            }
            ResolutionPlan plan = ResolutionPlan.mapped(kind, candidate.method(), candidate.tones(),
                    relaxTarget, rules.applyVoiceLeadingRulesToResolutions());
            Pitch resolvedBass = plan.resolve(from.bass(), from.bass());
            if (resolvedBass.pitchClass() != to.bass().pitchClass()) {
                LOG.debug("{} resolution {} moves bass {} to {}, but slot {} has bass {}; skipping",
                        label, candidate.method(), from.bass(), resolvedBass, to.index(), to.bass());
                continue;
            }
            LOG.debug("Slot {} -> {}: {}", from.index(), to.index(), candidate.method());
            return plan;
        }
        LOG.warn("{} resolution: no proper resolution available from slot {} ({} \"{}\") to slot {} ({} \"{}\"). "
                        + "Executing ordinary resolution.", label, from.index(), from.bass(), from.figure(),
                to.index(), to.bass(), to.figure());
        return relaxTarget ? ResolutionPlan.ordinaryRelaxed() : ResolutionPlan.ordinary();
    }

    private record Candidate(boolean applies, String method, List<ToneResolution> tones) {
    }
}
