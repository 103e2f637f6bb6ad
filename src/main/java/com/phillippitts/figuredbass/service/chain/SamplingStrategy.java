package com.phillippitts.figuredbass.service.chain;

/**
 * How {@link Chain#sampleOne} walks the chain.
 */
public enum SamplingStrategy {

    /**
     * Uniform choice in the first slot, then a uniform choice among the current
     * realization's successors at each step. Progressions through sparse regions of the
     * chain are drawn more often than progressions through dense ones, so this is not
     * uniform over progressions.
     */
    LOCAL_UNIFORM,

    /**
     * Each choice is weighted by the number of complete progressions it leads to, which
     * makes every progression equally likely.
     */
    COUNT_WEIGHTED
}
