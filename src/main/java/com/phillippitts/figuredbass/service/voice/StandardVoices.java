package com.phillippitts.figuredbass.service.voice;

import com.phillippitts.figuredbass.music.Interval;

/**
 * Common voice layouts.
 */
public final class StandardVoices {

    private StandardVoices() {
        // Utility class - prevent instantiation
    }

    /**
     * Four-part chorale voices with conventional ranges. Upper parts stay within an octave
     * of their neighbour; the tenor sounds an octave below its treble-clef notation.
     */
    public static VoiceEnsemble satb() {
        return VoiceEnsemble.of(
                new Voice("Soprano", Range.of("C4", "A5"), null, null, Clef.TREBLE),
                new Voice("Alto", Range.of("F3", "D5"), null, Voice.DEFAULT_MAX_SEPARATION, Clef.TREBLE),
                new Voice("Tenor", Range.of("C4", "A5"), Interval.parse("-P8"),
                        Voice.DEFAULT_MAX_SEPARATION, Clef.TREBLE_8VB),
                new Voice("Bass", Range.of("E2", "D4"), null, null, Clef.BASS)
        );
    }

    /** Keyboard-style layout: three right-hand parts over the bass. */
    public static VoiceEnsemble keyboard() {
        return VoiceEnsemble.of(
                new Voice("RH1", Range.of("C4", "B5"), null, null, Clef.TREBLE),
                new Voice("RH2", Range.of("G3", "B5"), null, Voice.DEFAULT_MAX_SEPARATION, Clef.TREBLE),
                new Voice("RH3", Range.of("E3", "B5"), null, Voice.DEFAULT_MAX_SEPARATION, Clef.TREBLE),
                new Voice("LH", Range.of("C2", "C4"), null, null, Clef.BASS)
        );
    }

    /** Three voices: two upper parts over the bass. */
    public static VoiceEnsemble threeVoice() {
        return VoiceEnsemble.of(
                new Voice("Upper", Range.of("C4", "A5"), null, null, Clef.TREBLE),
                new Voice("Middle", Range.of("F3", "D5"), null, Voice.DEFAULT_MAX_SEPARATION, Clef.TREBLE),
                new Voice("Bass", Range.of("E2", "D4"), null, null, Clef.BASS)
        );
    }
}
