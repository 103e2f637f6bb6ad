package com.phillippitts.figuredbass.service.chain;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.voice.StandardVoices;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.phillippitts.figuredbass.testutil.TestEngine.harmony;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Two first-slot realizations: one with a single continuation, one with nine.
 */
class SamplingDistributionTest {

    private static final int SAMPLES = 10_000;
    private static final List<String> TONIC_LAYOUTS = List.of(
            "C4 G3 E3 C3", "E4 G3 E3 C3", "E4 G3 G3 C3", "E4 C4 G3 C3", "E4 E4 G3 C3",
            "G4 E4 G3 C3", "G4 E4 C4 C3", "G4 E4 E4 C3", "G4 G4 E4 C3", "C5 G4 E4 C3");

    private Chain chain;

    @BeforeEach
    void setUp() {
        chain = new Chain(List.of(harmony(0, "C3", ""), harmony(1, "C3", "")),
                StandardVoices.satb(), Rules.defaults(), SamplingStrategy.LOCAL_UNIFORM);

        List<Possibility> second = new ArrayList<>();
        for (String text : TONIC_LAYOUTS) {
            second.add(Possibility.parse(text));
        }
        chain.setRealizations(List.of(
                List.of(Possibility.parse("G4 E4 C4 C3"), Possibility.parse("C5 G4 E4 C3")),
                second));

        BitSet one = new BitSet();
        one.set(0);
        BitSet nine = new BitSet();
        nine.set(1, 10);
        Map<Integer, BitSet> movements = new LinkedHashMap<>();
        movements.put(0, one);
        movements.put(1, nine);
        chain.setMovements(List.of(ResolutionPlan.ordinary()), List.of(movements));
        chain.prune();
    }

    private double firstRealizationShare(SamplingStrategy strategy) {
        Random random = new Random(42);
        int hits = 0;
        for (int i = 0; i < SAMPLES; i++) {
            if (chain.sampleOne(random, strategy).indices().get(0) == 0) {
                hits++;
            }
        }
        return hits / (double) SAMPLES;
    }

    @Test
    void shouldCountBothBranches() {
        assertThat(chain.count()).isEqualTo(BigInteger.TEN);
        assertThat(chain.countFrom(0, 0)).isEqualTo(BigInteger.ONE);
        assertThat(chain.countFrom(0, 1)).isEqualTo(BigInteger.valueOf(9));
    }

    @Test
    void shouldFavorSparseBranchWhenSamplingLocally() {
        assertThat(firstRealizationShare(SamplingStrategy.LOCAL_UNIFORM)).isCloseTo(0.5, within(0.03));
    }

    @Test
    void shouldSampleProgressionsUniformlyWhenWeightedByCount() {
        assertThat(firstRealizationShare(SamplingStrategy.COUNT_WEIGHTED)).isCloseTo(0.1, within(0.03));
    }

    @Test
    void shouldUseChainStrategyByDefault() {
        Random random = new Random(42);
        int hits = 0;
        for (int i = 0; i < SAMPLES; i++) {
            if (chain.sampleOne(random).indices().get(0) == 0) {
                hits++;
            }
        }

        assertThat(hits / (double) SAMPLES).isCloseTo(0.5, within(0.03));
    }
}
