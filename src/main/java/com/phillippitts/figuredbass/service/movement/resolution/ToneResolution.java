package com.phillippitts.figuredbass.service.movement.resolution;

import com.phillippitts.figuredbass.music.Interval;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;

import java.util.Objects;

/**
 * Moves every voice sounding {@code name} by {@code interval}.
 *
 * @param name          chord member this entry applies to
 * @param bassPitchOnly if set, applies only to a pitch identical to the bass pitch
 * @param interval      spelled motion into the next chord
 */
public record ToneResolution(PitchName name, boolean bassPitchOnly, Interval interval) {

    public ToneResolution {
        Objects.requireNonNull(name, "Name must not be null");
        Objects.requireNonNull(interval, "Interval must not be null");
    }

    public static ToneResolution of(PitchName name, String interval) {
        return new ToneResolution(name, false, Interval.parse(interval));
    }

    public static ToneResolution ofBassPitch(PitchName name, String interval) {
        return new ToneResolution(name, true, Interval.parse(interval));
    }

    public boolean matches(Pitch pitch, Pitch bass) {
        return pitch.pitchName().equals(name) && (!bassPitchOnly || pitch.equals(bass));
    }
}
