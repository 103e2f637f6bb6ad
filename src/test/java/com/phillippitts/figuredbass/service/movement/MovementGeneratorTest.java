package com.phillippitts.figuredbass.service.movement;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlanner;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.voice.StandardVoices;
import com.phillippitts.figuredbass.service.voice.Voice;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Map;

import static com.phillippitts.figuredbass.testutil.TestEngine.harmony;
import static org.assertj.core.api.Assertions.assertThat;

class MovementGeneratorTest {

    private final VoiceEnsemble threeVoices = VoiceEnsemble.of(
            Voice.of("S", "C4", "C6"),
            Voice.of("A", "G3", "G5"),
            Voice.of("B", "C2", "C4").withMaxSeparation(null));

    private MovementGenerator generator;
    private RealizationCache cache;

    @BeforeEach
    void setUp() {
        generator = new MovementGenerator();
        cache = new RealizationCache();
    }

    private static List<Possibility> list(String... texts) {
        return Arrays.stream(texts).map(Possibility::parse).toList();
    }

    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int i : indices) {
            set.set(i);
        }
        return set;
    }

    @Test
    void shouldKeepOnlyLegalOrdinaryMovements() {
        List<Possibility> from = list("G4 E4 C3");
        List<Possibility> to = list(
                "A4 F4 D3",   // parallel fifths with the bass
                "G4 D4 B2",
                "C5 G4 C4",   // hidden octave
                "F4 D4 B2");

        Map<Integer, BitSet> adjacency = generator.generate(from, to, ResolutionPlan.ordinary(),
                threeVoices, Rules.defaults(), cache);

        assertThat(adjacency).containsOnlyKeys(0);
        assertThat(adjacency.get(0)).isEqualTo(bits(1, 3));
    }

    @Test
    void shouldOmitRealizationsWithoutSuccessor() {
        List<Possibility> from = list("G4 E4 C3", "D5 G4 G3");
        List<Possibility> to = list("A4 F4 D3");

        Map<Integer, BitSet> adjacency = generator.generate(from, to, ResolutionPlan.ordinary(),
                threeVoices, Rules.defaults(), cache);

        assertThat(adjacency).doesNotContainKey(0);
        assertThat(adjacency.values()).noneMatch(BitSet::isEmpty);
    }

    @Test
    void shouldAllowFaultsWhoseRulesAreOff() {
        Rules lenient = Rules.builder()
                .forbidParallelFifths(false)
                .forbidHiddenOctaves(false)
                .build();

        Map<Integer, BitSet> adjacency = generator.generate(list("G4 E4 C3"),
                list("A4 F4 D3", "G4 D4 B2", "C5 G4 C4"), ResolutionPlan.ordinary(),
                threeVoices, lenient, cache);

        assertThat(adjacency.get(0)).isEqualTo(bits(0, 1, 2));
    }

    @Test
    void shouldApplyMovementLimits() {
        Rules limited = Rules.builder().partMovementLimit("S", 0).build();

        Map<Integer, BitSet> adjacency = generator.generate(list("G4 E4 C3"),
                list("G4 D4 B2", "F4 D4 B2"), ResolutionPlan.ordinary(), threeVoices, limited, cache);

        assertThat(adjacency.get(0)).isEqualTo(bits(0));
    }

    @Test
    void shouldMapDominantSeventhToItsResolution() {
        Rules rules = Rules.defaults();
        ResolutionPlan plan = new ResolutionPlanner().plan(harmony(0, "G2", "7"), harmony(1, "C3", ""), rules);
        List<Possibility> from = list("F4 D4 B3 G2", "G4 F4 B3 G2");
        List<Possibility> to = list("G4 E4 C4 C3", "E4 C4 C4 C3", "C5 G4 E4 C3");

        Map<Integer, BitSet> adjacency = generator.generate(from, to, plan, StandardVoices.satb(), rules, cache);

        assertThat(plan.isMapped()).isTrue();
        assertThat(adjacency.get(0)).isEqualTo(bits(1));
        assertThat(adjacency.get(1)).isEqualTo(bits(0));
    }

    @Test
    void shouldCheckResolutionsAgainstVoiceLeadingWhenAsked() {
        Rules rules = Rules.builder()
                .applyVoiceLeadingRulesToResolutions(true)
                .partMovementLimit("Soprano", 0)
                .build();
        ResolutionPlan plan = new ResolutionPlanner().plan(harmony(0, "G2", "7"), harmony(1, "C3", ""), rules);

        Map<Integer, BitSet> adjacency = generator.generate(list("F4 D4 B3 G2"), list("E4 C4 C4 C3"),
                plan, StandardVoices.satb(), rules, cache);

        assertThat(plan.appliesVoiceLeadingRules()).isTrue();
        assertThat(adjacency).isEmpty();
    }

    @Test
    void shouldCacheVoicePairVerdicts() {
        Possibility a = Possibility.parse("G4 E4 C3");
        Possibility b = Possibility.parse("G4 D4 B2");

        assertThat(generator.isLegal(a, b, threeVoices, Rules.defaults(), cache)).isTrue();
        long misses = cache.missCount();
        assertThat(generator.isLegal(a, b, threeVoices, Rules.defaults(), cache)).isTrue();

        assertThat(cache.missCount()).isEqualTo(misses);
        assertThat(cache.hitCount()).isEqualTo(4);
    }
}
