package com.phillippitts.figuredbass.music.scale;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.music.notation.FigureNotationParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiatonicScaleServiceTest {

    private final DiatonicScaleService scales = new DiatonicScaleService();
    private final FigureNotationParser parser = new FigureNotationParser();

    private List<String> names(String key, String bass, String figure) {
        return scales.pitchNamesFor(Key.parse(key), Pitch.parse(bass), parser.parseFigure(figure))
                .stream().map(PitchName::name).toList();
    }

    @Test
    void shouldSpellScaleDegreesFromKeySignature() {
        Key bFlatMajor = Key.major("B-");

        assertThat(scales.pitchNameForDegree(bFlatMajor, 3)).isEqualTo(PitchName.parse("E-"));
        assertThat(scales.pitchNameForDegree(Key.minor("A"), 6)).isEqualTo(PitchName.parse("G"));
        assertThat(scales.pitchNameForDegree(Key.major("E"), 6)).isEqualTo(PitchName.parse("D#"));
        assertThat(scales.pitchNameForDegree(Key.parse("E phrygian"), 1)).isEqualTo(PitchName.parse("F"));
    }

    @Test
    void shouldListBassFirstThenFiguresFromLowestNumber() {
        assertThat(names("C major", "C3", "")).containsExactly("C", "E", "G");
        assertThat(names("C major", "E3", "6")).containsExactly("E", "G", "C");
        assertThat(names("C major", "G2", "7")).containsExactly("G", "B", "D", "F");
        assertThat(names("C major", "D3", "4,3")).containsExactly("D", "F", "G", "B");
    }

    @Test
    void shouldApplyFigureAccidentals() {
        assertThat(names("C major", "D3", "6,-5")).containsExactly("D", "F", "A-", "B");
        assertThat(names("C major", "A2", "#")).containsExactly("A", "C#", "E");
        assertThat(names("C minor", "G2", "#")).containsExactly("G", "B", "D");
        assertThat(names("C minor", "A-2", "#6")).containsExactly("A-", "C", "F#");
    }

    @Test
    void shouldReadChromaticBassByItsLetter() {
        assertThat(names("C major", "F#2", "6")).containsExactly("F#", "A", "D");
    }

    @Test
    void shouldFindPitchesInsideRangeInAscendingOrder() {
        List<Pitch> pitches = scales.pitchesInRange(
                List.of(PitchName.parse("C"), PitchName.parse("E"), PitchName.parse("G")),
                Pitch.parse("E3"), Pitch.parse("C4"));

        assertThat(pitches).extracting(Pitch::nameWithOctave).containsExactly("E3", "G3", "C4");
    }

    @Test
    void shouldParseKeyText() {
        assertThat(Key.parse("g minor")).isEqualTo(Key.minor("G"));
        assertThat(Key.parse("C major").toString()).isEqualTo("C major");
        assertThatThrownBy(() -> Key.parse("C")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Key.parse("C lydian")).isInstanceOf(IllegalArgumentException.class);
    }
}
