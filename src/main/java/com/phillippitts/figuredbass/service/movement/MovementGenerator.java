package com.phillippitts.figuredbass.service.movement;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes which realizations of one slot may move to which realizations of the next.
 *
 * <p>The result is sparse: realization index in the earlier slot mapped to the set of
 * compatible indices in the later slot. Indices with no legal successor have no entry.
 * Only the two slots given are consulted.
 *
 * <p>Under an ordinary plan every voice pair is checked for overlap and parallel unisons,
 * fifths and octaves, the outer voices for hidden fifths and octaves, and each limited
 * voice for its movement limit. Under a mapped plan the only successor of a realization is
 * the one whose upper voices sound its resolution; the ordinary checks run as well when the
 * plan says so. An Italian sixth plan adds its filter to the ordinary checks.
 */
@Component
public class MovementGenerator {
    private static final Logger LOG = LogManager.getLogger(MovementGenerator.class);

    /**
     * Generates the adjacency between two slots.
     *
     * @param from   realizations of the earlier slot
     * @param to     realizations of the later slot
     * @param plan   resolution plan for this pair
     * @param voices ordered voices
     * @param rules  rule snapshot
     * @param cache  request-scoped cache for voice-pair verdicts
     * @return sparse adjacency; never null, possibly empty
     */
    public Map<Integer, BitSet> generate(List<Possibility> from, List<Possibility> to, ResolutionPlan plan,
                                         VoiceEnsemble voices, Rules rules, RealizationCache cache) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(cache, "cache");

        Map<Integer, BitSet> adjacency = new LinkedHashMap<>();
        Map<List<Integer>, BitSet> byUpperPitches = plan.isMapped() ? indexByUpperPitches(to) : Map.of();
        long edges = 0;

        for (int a = 0; a < from.size(); a++) {
            Possibility possibA = from.get(a);
            BitSet targets = new BitSet(to.size());
            if (plan.isMapped()) {
                BitSet resolutions = byUpperPitches.get(upperMidi(plan.resolve(possibA)));
                if (resolutions != null) {
                    for (int b = resolutions.nextSetBit(0); b >= 0; b = resolutions.nextSetBit(b + 1)) {
                        if (!plan.appliesVoiceLeadingRules() || isLegal(possibA, to.get(b), voices, rules, cache)) {
                            targets.set(b);
                        }
                    }
                }
            } else {
                for (int b = 0; b < to.size(); b++) {
                    Possibility possibB = to.get(b);
                    if (plan.isItalianSixth() && !plan.italianFilter().allows(possibA, possibB)) {
                        continue;
                    }
                    if (isLegal(possibA, possibB, voices, rules, cache)) {
                        targets.set(b);
                    }
                }
            }
            if (!targets.isEmpty()) {
                adjacency.put(a, targets);
                edges += targets.cardinality();
            }
        }

        LOG.debug("Movements via {}: {} of {} realizations continue, {} edges",
                plan.method(), adjacency.size(), from.size(), edges);
        return adjacency;
    }

    /**
     * Applies the ordinary consecutive rules to one pair of realizations.
     *
     * @return {@code true} if the motion from {@code a} to {@code b} is legal
     */
    public boolean isLegal(Possibility a, Possibility b, VoiceEnsemble voices, Rules rules, RealizationCache cache) {
        int size = a.size();
        for (int i = 0; i < size - 1; i++) {
            for (int j = i + 1; j < size; j++) {
                int higherA = a.pitch(i).midi();
                int lowerA = a.pitch(j).midi();
                int higherB = b.pitch(i).midi();
                int lowerB = b.pitch(j).midi();
                if (!cache.motion("pair", higherA, lowerA, higherB, lowerB,
                        () -> pairLegal(higherA, lowerA, higherB, lowerB, rules))) {
                    return false;
                }
            }
        }

        int highestA = a.pitch(0).midi();
        int bassA = a.bass().midi();
        int highestB = b.pitch(0).midi();
        int bassB = b.bass().midi();
        if (!cache.motion("outer", highestA, bassA, highestB, bassB,
                () -> outerLegal(highestA, bassA, highestB, bassB, rules))) {
            return false;
        }

        return rules.partMovementLimits().isEmpty()
                || VoiceLeadingRules.partMovementsWithinLimits(a, b, voices, rules.partMovementLimits());
    }

    private static boolean pairLegal(int higherA, int lowerA, int higherB, int lowerB, Rules rules) {
        if (rules.forbidVoiceOverlap() && VoiceLeadingRules.isOverlap(higherA, lowerA, higherB, lowerB)) {
            return false;
        }
        if (rules.forbidParallelUnisons() && VoiceLeadingRules.isParallelUnison(higherA, lowerA, higherB, lowerB)) {
            return false;
        }
        if (rules.forbidParallelFifths() && VoiceLeadingRules.isParallelFifth(higherA, lowerA, higherB, lowerB)) {
            return false;
        }
        return !rules.forbidParallelOctaves()
                || !VoiceLeadingRules.isParallelOctave(higherA, lowerA, higherB, lowerB);
    }

    private static boolean outerLegal(int highestA, int bassA, int highestB, int bassB, Rules rules) {
        if (rules.forbidHiddenFifths() && VoiceLeadingRules.isHiddenFifth(highestA, bassA, highestB, bassB)) {
            return false;
        }
        return !rules.forbidHiddenOctaves()
                || !VoiceLeadingRules.isHiddenOctave(highestA, bassA, highestB, bassB);
    }

    private static Map<List<Integer>, BitSet> indexByUpperPitches(List<Possibility> possibilities) {
        Map<List<Integer>, BitSet> index = new HashMap<>();
        for (int i = 0; i < possibilities.size(); i++) {
            index.computeIfAbsent(upperMidi(possibilities.get(i)), k -> new BitSet()).set(i);
        }
        return index;
    }

    private static List<Integer> upperMidi(Possibility possibility) {
        List<Integer> midi = new ArrayList<>(possibility.size() - 1);
        for (int i = 0; i < possibility.size() - 1; i++) {
            midi.add(possibility.pitch(i).midi());
        }
        return midi;
    }
}
