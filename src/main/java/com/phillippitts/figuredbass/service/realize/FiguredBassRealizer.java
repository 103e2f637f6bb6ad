package com.phillippitts.figuredbass.service.realize;

import com.phillippitts.figuredbass.config.properties.EngineProperties;
import com.phillippitts.figuredbass.config.properties.RealizerProperties;
import com.phillippitts.figuredbass.domain.FiguredBassLine;
import com.phillippitts.figuredbass.domain.Progression;
import com.phillippitts.figuredbass.exception.ChainInfeasibleException;
import com.phillippitts.figuredbass.exception.FiguredBassException;
import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.exception.RealizationLimitExceededException;
import com.phillippitts.figuredbass.exception.SlotInfeasibleException;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.scale.Key;
import com.phillippitts.figuredbass.service.cache.RealizationCache;
import com.phillippitts.figuredbass.service.chain.BuildOptions;
import com.phillippitts.figuredbass.service.chain.Chain;
import com.phillippitts.figuredbass.service.chain.ChainBuilder;
import com.phillippitts.figuredbass.service.chain.ChordSlot;
import com.phillippitts.figuredbass.service.metrics.RealizationMetrics;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Entry point for realizing a figured bass line.
 *
 * <p>Takes a rule snapshot from {@link RealizerProperties} (unless the caller supplies one),
 * builds the chain with the configured cap, sampling strategy and executor, and records
 * metrics. Each request runs under its own {@code requestId} in the Log4j2 ThreadContext;
 * the realizer executor copies it to its workers.
 */
@Service
public class FiguredBassRealizer {
    private static final Logger LOG = LogManager.getLogger(FiguredBassRealizer.class);
    private static final String REQUEST_ID = "requestId";

    private final ChainBuilder chainBuilder;
    private final RealizerProperties realizerProperties;
    private final EngineProperties engineProperties;
    private final Executor realizerExecutor;
    private final RealizationMetrics metrics;

    public FiguredBassRealizer(ChainBuilder chainBuilder,
                               RealizerProperties realizerProperties,
                               EngineProperties engineProperties,
                               @Qualifier("realizerExecutor") Executor realizerExecutor,
                               RealizationMetrics metrics) {
        this.chainBuilder = Objects.requireNonNull(chainBuilder);
        this.realizerProperties = Objects.requireNonNull(realizerProperties);
        this.engineProperties = Objects.requireNonNull(engineProperties);
        this.realizerExecutor = Objects.requireNonNull(realizerExecutor);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /** Key used when a request names none. */
    public Key defaultKey() {
        return new Key(PitchName.parse(engineProperties.getDefaultKey()), engineProperties.getDefaultMode());
    }

    /** Current configured rules as an immutable snapshot. */
    public Rules configuredRules() {
        return realizerProperties.toRules();
    }

    public Chain realize(FiguredBassLine line, VoiceEnsemble voices) {
        return realize(line, defaultKey(), voices, configuredRules());
    }

    /**
     * Builds and prunes the chain for one bass line.
     *
     * @param line   bass notes with figures
     * @param key    key used to read the figures
     * @param voices ordered voices, bass last
     * @param rules  rule snapshot for this request
     * @return pruned chain, ready for count, enumeration and sampling
     * @throws FiguredBassException subclasses as documented on {@link ChainBuilder}
     */
    public Chain realize(FiguredBassLine line, Key key, VoiceEnsemble voices, Rules rules) {
        if (line == null) {
            throw new InvalidInputException("Bass line must not be null");
        }
        boolean ownsRequestId = !ThreadContext.containsKey(REQUEST_ID);
        if (ownsRequestId) {
            ThreadContext.put(REQUEST_ID, UUID.randomUUID().toString());
        }
        long start = System.nanoTime();
        try {
            LOG.info("Realizing {} bass notes in {}", line.size(), key);
            Chain chain = chainBuilder.build(line.notes(), key, voices, rules, buildOptions(), new RealizationCache());
            long duration = System.nanoTime() - start;
            metrics.recordLatency("build", duration);
            recordRealizations(chain);
            metrics.incrementSuccess();
            LOG.info("Realization completed: duration={}ms, progressions={}", duration / 1_000_000, chain.count());
            return chain;
        } catch (FiguredBassException e) {
            metrics.incrementFailure(reasonFor(e));
            LOG.warn("Realization failed after {}ms: {}", (System.nanoTime() - start) / 1_000_000, e.getMessage());
            throw e;
        } finally {
            if (ownsRequestId) {
                ThreadContext.remove(REQUEST_ID);
            }
        }
    }

    /**
     * Draws {@code samples} progressions from a pruned chain.
     *
     * @param chain   pruned chain
     * @param samples number of draws
     * @param random  source of randomness
     * @return sampled progressions in draw order
     */
    public List<Progression> sample(Chain chain, int samples, Random random) {
        Objects.requireNonNull(chain, "chain");
        if (samples < 0) {
            throw new InvalidInputException("Sample count must not be negative, got: " + samples);
        }
        long start = System.nanoTime();
        List<Progression> drawn = new ArrayList<>(samples);
        for (int i = 0; i < samples; i++) {
            drawn.add(chain.sampleOne(random));
        }
        metrics.recordLatency("sample", System.nanoTime() - start);
        return drawn;
    }

    private BuildOptions buildOptions() {
        return new BuildOptions(engineProperties.getMaxRealizationsPerSlot(),
                engineProperties.getSamplingStrategy(),
                engineProperties.isParallel() ? realizerExecutor : null);
    }

    private void recordRealizations(Chain chain) {
        long generated = 0;
        long surviving = 0;
        for (ChordSlot slot : chain.slots()) {
            generated += slot.realizations().size();
            surviving += slot.aliveCount();
        }
        metrics.recordRealizations(generated, surviving);
    }

    static String reasonFor(FiguredBassException e) {
        if (e instanceof InvalidInputException) {
            return "invalid_input";
        }
        if (e instanceof SlotInfeasibleException) {
            return "slot_infeasible";
        }
        if (e instanceof ChainInfeasibleException) {
            return "chain_infeasible";
        }
        if (e instanceof RealizationLimitExceededException) {
            return "limit_exceeded";
        }
        return "error";
    }
}
