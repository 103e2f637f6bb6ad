package com.phillippitts.figuredbass.service.movement.resolution;

/**
 * Harmonic-function resolution requirement carried by a slot into the next slot.
 */
public enum ResolutionKind {
    /** No resolution requirement; ordinary voice-leading rules apply. */
    NONE,
    DOMINANT_SEVENTH,
    DIMINISHED_SEVENTH,
    /** French, German or Swiss sixth. */
    AUGMENTED_SIXTH,
    /** Italian sixth; checked as a filter on top of the ordinary rules. */
    ITALIAN_AUGMENTED_SIXTH
}
