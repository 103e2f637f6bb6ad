package com.phillippitts.figuredbass.service.voice;

/**
 * Default clef of a voice. Kept for downstream rendering only.
 */
public enum Clef {
    TREBLE,
    TREBLE_8VB,
    ALTO,
    TENOR,
    BASS
}
