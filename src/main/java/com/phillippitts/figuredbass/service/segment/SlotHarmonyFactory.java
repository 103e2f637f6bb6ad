package com.phillippitts.figuredbass.service.segment;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.chord.ChordAnalyzer;
import com.phillippitts.figuredbass.music.notation.Figure;
import com.phillippitts.figuredbass.music.notation.Notation;
import com.phillippitts.figuredbass.music.notation.NotationService;
import com.phillippitts.figuredbass.music.scale.Key;
import com.phillippitts.figuredbass.music.scale.ScaleService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Builds {@link SlotHarmony} values from bass/figure pairs using the notation, scale and
 * chord collaborators.
 */
@Component
public class SlotHarmonyFactory {

    private final NotationService notationService;
    private final ScaleService scaleService;
    private final ChordAnalyzer chordAnalyzer;

    public SlotHarmonyFactory(NotationService notationService, ScaleService scaleService,
                              ChordAnalyzer chordAnalyzer) {
        this.notationService = Objects.requireNonNull(notationService);
        this.scaleService = Objects.requireNonNull(scaleService);
        this.chordAnalyzer = Objects.requireNonNull(chordAnalyzer);
    }

    /**
     * Describes one slot.
     *
     * @param index  slot position
     * @param bass   bass pitch
     * @param figure figure text, may be empty
     * @param key    key used to spell the figures
     * @return slot harmony
     * @throws com.phillippitts.figuredbass.exception.InvalidNotationException if the figure is malformed
     */
    public SlotHarmony create(int index, Pitch bass, String figure, Key key) {
        Notation notation = notationService.parseFigure(figure);
        List<PitchName> names = scaleService.pitchNamesFor(key, bass, notation);
        return new SlotHarmony(index, bass, notation, names, alteredNames(key, bass, notation),
                chordAnalyzer.analyze(names));
    }

    private Set<PitchName> alteredNames(Key key, Pitch bass, Notation notation) {
        int bassDegree = scaleService.degreeOf(key, bass.pitchName());
        Set<PitchName> altered = new LinkedHashSet<>();
        for (Figure figure : notation.figures()) {
            if (!figure.modifier().isExplicit()) {
                continue;
            }
            PitchName diatonic = scaleService.pitchNameForDegree(key, bassDegree + figure.number() - 1);
            PitchName name = figure.modifier().apply(diatonic);
            if (!name.equals(bass.pitchName())) {
                altered.add(name);
            }
        }
        return altered;
    }
}
