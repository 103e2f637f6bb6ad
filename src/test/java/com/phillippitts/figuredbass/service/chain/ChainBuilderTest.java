package com.phillippitts.figuredbass.service.chain;

import com.phillippitts.figuredbass.domain.BassNote;
import com.phillippitts.figuredbass.domain.FiguredBassLine;
import com.phillippitts.figuredbass.domain.IndexProgression;
import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.exception.ChainInfeasibleException;
import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.exception.RealizationLimitExceededException;
import com.phillippitts.figuredbass.exception.SlotInfeasibleException;
import com.phillippitts.figuredbass.music.scale.DiatonicScaleService;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.movement.MovementGenerator;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlanner;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.segment.PossibilityGenerator;
import com.phillippitts.figuredbass.service.segment.SlotHarmony;
import com.phillippitts.figuredbass.service.voice.StandardVoices;
import com.phillippitts.figuredbass.service.voice.Voice;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import com.phillippitts.figuredbass.testutil.TestEngine;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.figuredbass.testutil.TestEngine.C_MAJOR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainBuilderTest {

    private static final VoiceEnsemble SATB = StandardVoices.satb();

    private final ChainBuilder builder = TestEngine.chainBuilder();

    private Chain build(String line, Rules rules) {
        return builder.build(FiguredBassLine.parse(line).notes(), C_MAJOR, SATB, rules);
    }

    private Chain build(String line) {
        return build(line, Rules.defaults());
    }

    private static int[] aliveCounts(Chain chain) {
        return chain.slots().stream().mapToInt(ChordSlot::aliveCount).toArray();
    }

    @Test
    void shouldBuildAndPruneCadence() {
        Chain chain = build("C3 | F3 | G3 | C3");

        assertThat(chain.state()).isEqualTo(ChainState.PRUNED);
        assertThat(chain.slots()).extracting(slot -> slot.realizations().size()).containsExactly(13, 14, 10, 13);
        assertThat(aliveCounts(chain)).containsExactly(10, 7, 7, 9);
        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(81));
        assertThat(chain.slot(0).plan()).isNotNull();
        assertThat(chain.slot(2).plan()).isNotNull();
        assertThat(chain.slot(3).plan()).isNull();
    }

    @Test
    void shouldBuildIdenticalChainsForIdenticalInput() {
        Chain first = build("C3 | F3 | G3 | C3");
        Chain second = build("C3 | F3 | G3 | C3");

        assertThat(second.count()).isEqualTo(first.count());
        for (int i = 0; i < first.size(); i++) {
            assertThat(second.slot(i).realizations()).isEqualTo(first.slot(i).realizations());
            assertThat(second.slot(i).aliveIndices()).isEqualTo(first.slot(i).aliveIndices());
        }
        assertThat(indices(second)).isEqualTo(indices(first));
    }

    private static List<IndexProgression> indices(Chain chain) {
        List<IndexProgression> all = new ArrayList<>();
        chain.enumerateIndices().forEach(all::add);
        return all;
    }

    @Test
    void shouldBuildSingleSlotChain() {
        Chain chain = build("C3");

        assertThat(chain.size()).isEqualTo(1);
        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(13));
        assertThat(chain.slot(0).plan()).isNull();
    }

    @Test
    void shouldCountSimpleProgressions() {
        assertThat(build("C3 | G2").count()).isEqualTo(BigInteger.valueOf(22));
        assertThat(build("D3 | E3 6 | F3").count()).isEqualTo(BigInteger.valueOf(169));
    }

    @Test
    void shouldReportEmptiedSlotWhenLimitsLeaveNoPath() {
        Rules rules = Rules.builder()
                .partMovementLimit("Soprano", 0)
                .partMovementLimit("Alto", 0)
                .partMovementLimit("Tenor", 0)
                .build();

        assertThat(build("C3 | E3 6", rules).count()).isEqualTo(BigInteger.valueOf(5));
        assertThatThrownBy(() -> build("C3 | E3 6 | D3", rules))
                .isInstanceOfSatisfying(ChainInfeasibleException.class, e -> {
                    assertThat(e.getEmptiedSlotIndex()).isEqualTo(1);
                    assertThat(e.getFirstBass()).isEqualTo("C3");
                    assertThat(e.getLastBass()).isEqualTo("D3");
                    assertThat(e.getLastFigure()).isEmpty();
                });
    }

    @Test
    void shouldResolveDiminishedSeventhWithDoubledThirdByDefault() {
        Chain chain = build("B2 -7 | C3");

        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(4));
        assertThat(chain.slot(0).realizations()).extracting(Possibility::toString).containsExactly(
                "(D4 A-3 F3 B2)", "(F4 D4 A-3 B2)", "(A-4 F4 D4 B2)", "(D5 A-4 F4 B2)", "(F5 D5 A-4 B2)");
        assertThat(successorsOfFirst(chain)).containsExactly(Possibility.parse("E4 G3 E3 C3"));
    }

    @Test
    void shouldResolveDiminishedSeventhWithDoubledRootWhenConfigured() {
        Chain chain = build("B2 -7 | C3", Rules.defaults().toBuilder().doubledRootInDim7(true).build());

        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(5));
        assertThat(successorsOfFirst(chain)).containsExactly(Possibility.parse("C4 G3 E3 C3"));
    }

    @Test
    void shouldInferSixFiveDiminishedSeventhDoublingFromResolutionBass() {
        Rules thirdDoubled = Rules.defaults();
        Rules rootDoubled = Rules.defaults().toBuilder().doubledRootInDim7(true).build();

        Chain withThird = build("D3 6,-5 | C3", thirdDoubled);
        Chain withRoot = build("D3 6,-5 | C3", rootDoubled);

        assertThat(withThird.count()).isEqualTo(BigInteger.valueOf(4));
        assertThat(withRoot.count()).isEqualTo(BigInteger.valueOf(4));
        assertThat(successorsOfFirst(withThird)).containsExactly(Possibility.parse("E4 C4 G3 C3"));
        assertThat(successorsOfFirst(withRoot)).containsExactly(Possibility.parse("E4 C4 G3 C3"));
    }

    @Test
    void shouldHonorDiminishedSeventhDoublingWhenInferenceDisabled() {
        Rules noInference = Rules.defaults().toBuilder().inferDim7DoublingFromResolution(false).build();

        Chain withThird = build("D3 6,-5 | C3", noInference);
        Chain withRoot = build("D3 6,-5 | C3", noInference.toBuilder().doubledRootInDim7(true).build());

        assertThat(withThird.slot(0).realization(0)).isEqualTo(Possibility.parse("F4 B3 A-3 D3"));
        // doubled third would lift the bass to E, so the pair falls back to ordinary voice leading
        assertThat(withThird.count()).isEqualTo(BigInteger.valueOf(9));
        assertThat(successorsOfFirst(withThird)).containsExactlyInAnyOrder(
                Possibility.parse("E4 C4 G3 C3"), Possibility.parse("E4 E4 G3 C3"), Possibility.parse("G4 E4 G3 C3"));
        assertThat(withRoot.count()).isEqualTo(BigInteger.valueOf(4));
        assertThat(successorsOfFirst(withRoot)).containsExactly(Possibility.parse("E4 C4 G3 C3"));
    }

    private static List<Possibility> successorsOfFirst(Chain chain) {
        return chain.slot(0).successors(0).stream().mapToObj(chain.slot(1)::realization).toList();
    }

    @Test
    void shouldAllowIncompleteTonicAfterRootPositionDominantSeventh() {
        Chain chain = build("G2 7 | C3");

        assertThat(chain.count()).isEqualTo(BigInteger.valueOf(4));
        assertThat(chain.slot(1).realizations()).hasSize(42);
    }

    @Test
    void shouldFailDominantResolutionWhenTonicMustBeComplete() {
        Rules rules = Rules.defaults().toBuilder().allowIncompleteDominantResolution(false).build();

        assertThatThrownBy(() -> build("G2 7 | C3", rules))
                .isInstanceOfSatisfying(ChainInfeasibleException.class,
                        e -> assertThat(e.getEmptiedSlotIndex()).isZero());
    }

    @Test
    void shouldBuildInParallelWithSameResult() {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Chain chain = builder.build(FiguredBassLine.parse("C3 | F3 | G3 | C3").notes(), C_MAJOR, SATB,
                    Rules.defaults(), BuildOptions.defaults().withExecutor(executor), new RealizationCache());

            assertThat(chain.count()).isEqualTo(BigInteger.valueOf(81));
            assertThat(aliveCounts(chain)).containsExactly(10, 7, 7, 9);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldRejectEmptyBassLine() {
        assertThatThrownBy(() -> builder.build(List.of(), C_MAJOR, SATB, Rules.defaults()))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void shouldRejectMovementLimitForUnknownVoice() {
        Rules rules = Rules.builder().partMovementLimit("Descant", 2).build();

        assertThatThrownBy(() -> build("C3 | G2", rules))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("Descant");
    }

    @Test
    void shouldStopAtRealizationCap() {
        BuildOptions options = new BuildOptions(5, SamplingStrategy.LOCAL_UNIFORM, null);

        assertThatThrownBy(() -> builder.build(FiguredBassLine.parse("C3").notes(), C_MAJOR, SATB,
                Rules.defaults(), options, new RealizationCache()))
                .isInstanceOfSatisfying(RealizationLimitExceededException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(5));
    }

    @Test
    void shouldReportFirstSlotWithoutRealizations() {
        VoiceEnsemble narrow = VoiceEnsemble.of(List.of(
                Voice.of("S", "C4", "D4"),
                Voice.of("A", "C4", "D4"),
                Voice.of("B", "C2", "C4").withMaxSeparation(null)));

        assertThatThrownBy(() -> builder.build(FiguredBassLine.parse("C3 | D3 | G2").notes(), C_MAJOR, narrow,
                Rules.defaults()))
                .isInstanceOfSatisfying(SlotInfeasibleException.class,
                        e -> assertThat(e.getSlotIndex()).isZero());
    }

    @Test
    void shouldReportLaterSlotWhoseFigureNeedsMoreVoices() {
        VoiceEnsemble trio = VoiceEnsemble.of(List.of(
                Voice.of("Upper", "C4", "A5"),
                Voice.of("Middle", "F3", "D5"),
                Voice.of("Bass", "E2", "D4").withMaxSeparation(null)));
        List<BassNote> line = FiguredBassLine.parse("C3 | D3 7").notes();

        assertThat(builder.build(FiguredBassLine.parse("C3").notes(), C_MAJOR, trio, Rules.defaults()).count())
                .isEqualTo(BigInteger.valueOf(3));
        assertThatThrownBy(() -> builder.build(line, C_MAJOR, trio, Rules.defaults()))
                .isInstanceOfSatisfying(SlotInfeasibleException.class, e -> {
                    assertThat(e.getSlotIndex()).isEqualTo(1);
                    assertThat(e.getBass()).isEqualTo("D3");
                    assertThat(e.getFigure()).isEqualTo("7");
                });

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            assertThatThrownBy(() -> builder.build(line, C_MAJOR, trio, Rules.defaults(),
                    BuildOptions.defaults().withExecutor(executor), new RealizationCache()))
                    .isInstanceOfSatisfying(SlotInfeasibleException.class,
                            e -> assertThat(e.getSlotIndex()).isEqualTo(1));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldCancelRemainingSlotsAfterParallelFailure() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger lastSlotRuns = new AtomicInteger();
        PossibilityGenerator generator = new PossibilityGenerator(new DiatonicScaleService()) {
            @Override
            public List<Possibility> generate(SlotHarmony harmony, VoiceEnsemble voices, Rules rules,
                                              boolean requireComplete, RealizationCache cache, int maxRealizations) {
                if (harmony.index() == 0) {
                    throw new SlotInfeasibleException(0, "C3", "");
                }
                if (harmony.index() == 1) {
                    awaitQuietly(release);
                } else {
                    lastSlotRuns.incrementAndGet();
                }
                return super.generate(harmony, voices, rules, requireComplete, cache, maxRealizations);
            }
        };
        ChainBuilder failing = new ChainBuilder(TestEngine.harmonyFactory(), new ResolutionPlanner(), generator,
                new MovementGenerator());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            assertThatThrownBy(() -> failing.build(FiguredBassLine.parse("C3 | F3 | G3").notes(), C_MAJOR, SATB,
                    Rules.defaults(), BuildOptions.defaults().withExecutor(executor), new RealizationCache()))
                    .isInstanceOfSatisfying(SlotInfeasibleException.class,
                            e -> assertThat(e.getSlotIndex()).isZero());
        } finally {
            release.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }

        assertThat(lastSlotRuns).hasValue(0);
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("Latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    @Test
    void shouldShareCacheAcrossRepeatedSlots() {
        RealizationCache cache = new RealizationCache();

        builder.build(FiguredBassLine.parse("C3 | G2 | C3").notes(), C_MAJOR, SATB, Rules.defaults(),
                BuildOptions.defaults(), cache);

        assertThat(cache.hitCount()).isPositive();
    }
}
