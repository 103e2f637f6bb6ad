package com.phillippitts.figuredbass.service.chain;

/**
 * Build lifecycle of a {@link Chain}. States only move forward.
 */
public enum ChainState {
    UNBUILT,
    REALIZATIONS_BUILT,
    MOVEMENTS_BUILT,
    /** Terminal; the chain is read-only and answers queries. */
    PRUNED
}
