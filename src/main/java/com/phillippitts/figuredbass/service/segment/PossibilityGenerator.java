package com.phillippitts.figuredbass.service.segment;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.exception.RealizationExceptionBuilder;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.scale.ScaleService;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.voice.Voice;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Generates every legal voicing of one slot.
 *
 * <p>Each upper voice first gets its candidate pitches: the chord's pitch names inside the
 * voice's sounding range and not below the bass. Voices are then assigned highest first by
 * backtracking, and a partial assignment is abandoned as soon as it:
 * <ul>
 *   <li>crosses the voice above (when crossing is forbidden)</li>
 *   <li>lies further from the voice above than that voice's max separation</li>
 *   <li>spreads the upper voices wider than the configured span</li>
 *   <li>doubles a tone produced by an explicit figure accidental</li>
 *   <li>can no longer supply every required pitch name with the voices left</li>
 * </ul>
 *
 * <p>Candidates are tried in ascending pitch order, so output order is lexicographic over
 * (highest voice, ..., lowest upper voice) and identical inputs give identical indices.
 *
 * @since 1.0
 */
@Component
public class PossibilityGenerator {
    private static final Logger LOG = LogManager.getLogger(PossibilityGenerator.class);

    private final ScaleService scaleService;

    public PossibilityGenerator(ScaleService scaleService) {
        this.scaleService = Objects.requireNonNull(scaleService);
    }

    /**
     * Generates the realizations of one slot.
     *
     * @param harmony         what must sound above the bass
     * @param voices          ordered voices, bass last
     * @param rules           rule snapshot
     * @param requireComplete whether every pitch name must appear (the rule may be relaxed per slot)
     * @param cache           request-scoped cache
     * @param maxRealizations cap on the number of realizations
     * @return realizations in deterministic order, never empty
     * @throws com.phillippitts.figuredbass.exception.SlotInfeasibleException if none exist
     * @throws com.phillippitts.figuredbass.exception.RealizationLimitExceededException if the cap is exceeded
     */
    public List<Possibility> generate(SlotHarmony harmony, VoiceEnsemble voices, Rules rules,
                                      boolean requireComplete, RealizationCache cache, int maxRealizations) {
        Objects.requireNonNull(harmony, "harmony");
        Objects.requireNonNull(voices, "voices");
        Objects.requireNonNull(rules, "rules");
        Objects.requireNonNull(cache, "cache");

        Set<PitchName> names = new LinkedHashSet<>(harmony.pitchNames());
        int upperCount = voices.size() - 1;
        List<List<Pitch>> candidates = new ArrayList<>(upperCount);
        for (int i = 0; i < upperCount; i++) {
            Voice voice = voices.get(i);
            List<Pitch> forVoice = cache.candidates(voice, names, harmony.bass(),
                    () -> candidatePitches(voice, names, harmony.bass()));
            if (forVoice.isEmpty()) {
                throw RealizationExceptionBuilder.create("Voice cannot reach any chord tone")
                        .slot(harmony.index(), harmony.bass().nameWithOctave(), harmony.figure())
                        .metadata("voice", voice.label())
                        .metadata("range", voice.soundingRange())
                        .metadata("pitchNames", harmony.pitchNames())
                        .infeasible();
            }
            candidates.add(forVoice);
        }

        Search search = new Search(harmony, voices, rules, requireComplete, candidates, maxRealizations);
        search.assign(0);

        if (search.results.isEmpty()) {
            throw RealizationExceptionBuilder.create("No realization satisfies the slot's rules")
                    .slot(harmony.index(), harmony.bass().nameWithOctave(), harmony.figure())
                    .metadata("pitchNames", harmony.pitchNames())
                    .metadata("requireComplete", requireComplete)
                    .infeasible();
        }
        LOG.debug("Slot {} ({} \"{}\"): {} realizations", harmony.index(), harmony.bass(),
                harmony.figure(), search.results.size());
        return List.copyOf(search.results);
    }

    private List<Pitch> candidatePitches(Voice voice, Set<PitchName> names, Pitch bass) {
        Pitch low = voice.soundingRange().low();
        Pitch high = voice.soundingRange().high();
        if (high.midi() < bass.midi()) {
            return List.of();
        }
        Pitch floor = low.midi() < bass.midi() ? bass : low;
        return scaleService.pitchesInRange(names, floor, high);
    }

    /** Backtracking state for one slot. */
    private static final class Search {
        private final SlotHarmony harmony;
        private final VoiceEnsemble voices;
        private final Rules rules;
        private final boolean requireComplete;
        private final List<List<Pitch>> candidates;
        private final int maxRealizations;
        private final int upperCount;
        private final Pitch[] current;
        private final Map<PitchName, Integer> nameCounts = new HashMap<>();
        private final List<Possibility> results = new ArrayList<>();
        private final int requiredNames;

        Search(SlotHarmony harmony, VoiceEnsemble voices, Rules rules, boolean requireComplete,
               List<List<Pitch>> candidates, int maxRealizations) {
            this.harmony = harmony;
            this.voices = voices;
            this.rules = rules;
            this.requireComplete = requireComplete;
            this.candidates = candidates;
            this.maxRealizations = maxRealizations;
            this.upperCount = voices.size() - 1;
            this.current = new Pitch[voices.size()];
            this.current[upperCount] = harmony.bass();
            this.nameCounts.put(harmony.bass().pitchName(), 1);
            this.requiredNames = new LinkedHashSet<>(harmony.pitchNames()).size();
        }

        void assign(int voiceIndex) {
            if (voiceIndex == upperCount) {
                accept();
                return;
            }
            for (Pitch pitch : candidates.get(voiceIndex)) {
                if (!fits(voiceIndex, pitch)) {
                    continue;
                }
                current[voiceIndex] = pitch;
                nameCounts.merge(pitch.pitchName(), 1, Integer::sum);
                if (!requireComplete || missingNames() <= upperCount - voiceIndex - 1) {
                    assign(voiceIndex + 1);
                }
                nameCounts.merge(pitch.pitchName(), -1, Integer::sum);
                current[voiceIndex] = null;
            }
        }

        private boolean fits(int voiceIndex, Pitch pitch) {
            if (voiceIndex > 0) {
                Pitch above = current[voiceIndex - 1];
                if (rules.forbidVoiceCrossing() && PossibilityRules.crosses(above, pitch)) {
                    return false;
                }
                if (PossibilityRules.exceedsSeparation(above, pitch, voices.get(voiceIndex).maxSeparation())) {
                    return false;
                }
            }
            Integer span = rules.upperPartsMaxSemitoneSeparation();
            if (span != null) {
                for (int i = 0; i < voiceIndex; i++) {
                    if (Math.abs(current[i].midi() - pitch.midi()) > span) {
                        return false;
                    }
                }
            }
            return !rules.forbidDoubledAlteredTones()
                    || !harmony.alteredNames().contains(pitch.pitchName())
                    || nameCounts.getOrDefault(pitch.pitchName(), 0) == 0;
        }

        private int missingNames() {
            int present = 0;
            for (Map.Entry<PitchName, Integer> entry : nameCounts.entrySet()) {
                if (entry.getValue() > 0) {
                    present++;
                }
            }
            return requiredNames - present;
        }

        private void accept() {
            Pitch lowestUpper = current[upperCount - 1];
            if (PossibilityRules.exceedsSeparation(lowestUpper, current[upperCount],
                    voices.bass().maxSeparation())) {
                return;
            }
            if (requireComplete && missingNames() > 0) {
                return;
            }
            results.add(new Possibility(Arrays.asList(current.clone())));
            if (results.size() > maxRealizations) {
                throw RealizationExceptionBuilder.create("Realization search exceeded the per-slot cap")
                        .slot(harmony.index(), harmony.bass().nameWithOctave(), harmony.figure())
                        .metadata("voices", voices.size())
                        .limitExceeded(maxRealizations);
            }
        }
    }
}
