package com.phillippitts.figuredbass.service.chain;

import com.phillippitts.figuredbass.domain.BassNote;
import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.exception.FiguredBassException;
import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.music.scale.Key;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.movement.MovementGenerator;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlanner;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.segment.PossibilityGenerator;
import com.phillippitts.figuredbass.service.segment.SlotHarmony;
import com.phillippitts.figuredbass.service.segment.SlotHarmonyFactory;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.IntFunction;

/**
 * Builds and prunes a {@link Chain} for one bass line.
 *
 * <p>Order of work:
 * <ol>
 *   <li>validate the input and analyze every bass note's figure</li>
 *   <li>plan the resolution of each consecutive pair (this may relax the completeness rule
 *       of the later slot)</li>
 *   <li>generate every slot's realizations</li>
 *   <li>generate the movements of every consecutive pair</li>
 *   <li>prune</li>
 * </ol>
 * Steps 3 and 4 touch no shared mutable state besides the request cache and may run on an
 * executor; pruning always runs on the calling thread after both complete.
 *
 * <p>Failures surface as {@link InvalidInputException} (before any slot is built),
 * {@link com.phillippitts.figuredbass.exception.SlotInfeasibleException} (step 3, lowest
 * failing slot) or {@link com.phillippitts.figuredbass.exception.ChainInfeasibleException}
 * (step 5).
 */
@Component
public class ChainBuilder {
    private static final Logger LOG = LogManager.getLogger(ChainBuilder.class);

    private final SlotHarmonyFactory harmonyFactory;
    private final ResolutionPlanner resolutionPlanner;
    private final PossibilityGenerator possibilityGenerator;
    private final MovementGenerator movementGenerator;

    public ChainBuilder(SlotHarmonyFactory harmonyFactory,
                        ResolutionPlanner resolutionPlanner,
                        PossibilityGenerator possibilityGenerator,
                        MovementGenerator movementGenerator) {
        this.harmonyFactory = Objects.requireNonNull(harmonyFactory);
        this.resolutionPlanner = Objects.requireNonNull(resolutionPlanner);
        this.possibilityGenerator = Objects.requireNonNull(possibilityGenerator);
        this.movementGenerator = Objects.requireNonNull(movementGenerator);
    }

    /** Builds with default options and a fresh cache. */
    public Chain build(List<BassNote> bassLine, Key key, VoiceEnsemble voices, Rules rules) {
        return build(bassLine, key, voices, rules, BuildOptions.defaults(), new RealizationCache());
    }

    /**
     * Builds and prunes a chain.
     *
     * @param bassLine bass notes with figures, in order
     * @param key      key used to read figures
     * @param voices   ordered voices, bass last
     * @param rules    rule snapshot for the whole request
     * @param options  cap, sampling strategy and executor
     * @param cache    request-scoped cache; not shared between requests
     * @return pruned, query-ready chain
     */
    public Chain build(List<BassNote> bassLine, Key key, VoiceEnsemble voices, Rules rules,
                       BuildOptions options, RealizationCache cache) {
        validate(bassLine, key, voices, rules);
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(cache, "cache");

        List<SlotHarmony> harmonies = new ArrayList<>(bassLine.size());
        for (int i = 0; i < bassLine.size(); i++) {
            BassNote note = bassLine.get(i);
            harmonies.add(harmonyFactory.create(i, note.pitch(), note.figure(), key));
        }

        List<ResolutionPlan> plans = new ArrayList<>(harmonies.size());
        boolean[] relaxed = new boolean[harmonies.size()];
        for (int i = 0; i + 1 < harmonies.size(); i++) {
            ResolutionPlan plan = resolutionPlanner.plan(harmonies.get(i), harmonies.get(i + 1), rules);
            plans.add(plan);
            relaxed[i + 1] = plan.relaxesTargetCompleteness();
        }

        Chain chain = new Chain(harmonies, voices, rules, options.samplingStrategy());
        LOG.info("Building chain: {} bass notes, {} voices, key={}, parallel={}",
                harmonies.size(), voices.size(), key, options.isParallel());

        List<List<Possibility>> realizations = runAll(harmonies.size(), options, i -> {
            boolean requireComplete = rules.forbidIncompletePossibilities() && !relaxed[i];
            return possibilityGenerator.generate(harmonies.get(i), voices, rules, requireComplete,
                    cache, options.maxRealizationsPerSlot());
        });
        chain.setRealizations(realizations);

        List<Map<Integer, BitSet>> movements = runAll(harmonies.size() - 1, options, i ->
                movementGenerator.generate(realizations.get(i), realizations.get(i + 1), plans.get(i),
                        voices, rules, cache));
        chain.setMovements(plans, movements);

        chain.prune();
        LOG.debug("Cache after build: size={}, hits={}, misses={}",
                cache.size(), cache.hitCount(), cache.missCount());
        return chain;
    }

    private static void validate(List<BassNote> bassLine, Key key, VoiceEnsemble voices, Rules rules) {
        if (bassLine == null || bassLine.isEmpty()) {
            throw new InvalidInputException("Bass line must not be empty");
        }
        if (voices == null) {
            throw new InvalidInputException("Voices must not be null");
        }
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(rules, "rules");
        for (int i = 0; i < bassLine.size(); i++) {
            if (bassLine.get(i) == null) {
                throw new InvalidInputException("Bass note " + i + " is null");
            }
        }
        for (String label : rules.partMovementLimits().keySet()) {
            if (voices.indexOf(label) < 0) {
                throw new InvalidInputException("Movement limit names unknown voice '" + label
                        + "'; voices are " + voices.labels());
            }
        }
    }

    /**
     * Runs {@code task} for 0..count-1, in parallel when an executor is configured; results in index order.
     * The first failure in index order cancels every other task and is rethrown.
     */
    private static <T> List<T> runAll(int count, BuildOptions options, IntFunction<T> task) {
        List<T> results = new ArrayList<>(count);
        if (!options.isParallel()) {
            for (int i = 0; i < count; i++) {
                results.add(task.apply(i));
            }
            return results;
        }
        List<CompletableFuture<T>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int index = i;
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(index), options.executor()));
        }
        for (CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                // tasks that have not started yet never run once cancelled
                futures.forEach(pending -> pending.cancel(true));
                LOG.warn("Parallel chain generation failed, cancelled {} tasks: {}", futures.size(), e.getCause().getMessage());
                if (e.getCause() instanceof FiguredBassException fbe) {
                    throw fbe;
                }
                throw new FiguredBassException("Parallel chain generation failed: " + e.getMessage(), e.getCause());
            }
        }
        return results;
    }
}
