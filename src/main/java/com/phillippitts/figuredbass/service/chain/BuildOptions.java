package com.phillippitts.figuredbass.service.chain;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Per-request knobs for {@link ChainBuilder}.
 *
 * @param maxRealizationsPerSlot cap on the realizations generated for one slot
 * @param samplingStrategy       default strategy of the built chain
 * @param executor               runs slot and movement generation in parallel; null runs them
 *                               on the calling thread
 */
public record BuildOptions(int maxRealizationsPerSlot, SamplingStrategy samplingStrategy, Executor executor) {

    public static final int DEFAULT_MAX_REALIZATIONS_PER_SLOT = 50_000;

    public BuildOptions {
        if (maxRealizationsPerSlot < 1) {
            throw new IllegalArgumentException("maxRealizationsPerSlot must be positive, got: "
                    + maxRealizationsPerSlot);
        }
        Objects.requireNonNull(samplingStrategy, "samplingStrategy");
    }

    /** Sequential build, default cap, local uniform sampling. */
    public static BuildOptions defaults() {
        return new BuildOptions(DEFAULT_MAX_REALIZATIONS_PER_SLOT, SamplingStrategy.LOCAL_UNIFORM, null);
    }

    public BuildOptions withExecutor(Executor newExecutor) {
        return new BuildOptions(maxRealizationsPerSlot, samplingStrategy, newExecutor);
    }

    public boolean isParallel() {
        return executor != null;
    }
}
