package com.phillippitts.figuredbass.music.chord;

/**
 * Chord types the realizer distinguishes. Anything else is {@link #OTHER}.
 */
public enum ChordQuality {
    MAJOR_TRIAD,
    MINOR_TRIAD,
    DIMINISHED_TRIAD,
    AUGMENTED_TRIAD,
    DOMINANT_SEVENTH,
    DIMINISHED_SEVENTH,
    HALF_DIMINISHED_SEVENTH,
    OTHER_SEVENTH,
    ITALIAN_AUGMENTED_SIXTH,
    FRENCH_AUGMENTED_SIXTH,
    GERMAN_AUGMENTED_SIXTH,
    SWISS_AUGMENTED_SIXTH,
    OTHER;

    public boolean isAugmentedSixth() {
        return this == ITALIAN_AUGMENTED_SIXTH || this == FRENCH_AUGMENTED_SIXTH
                || this == GERMAN_AUGMENTED_SIXTH || this == SWISS_AUGMENTED_SIXTH;
    }

    public boolean isTonicCandidate() {
        return this == MAJOR_TRIAD || this == MINOR_TRIAD;
    }
}
