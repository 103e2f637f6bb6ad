package com.phillippitts.figuredbass.music.chord;

import com.phillippitts.figuredbass.music.PitchName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChordAnalyzerTest {

    private final ChordAnalyzer analyzer = new ChordAnalyzer();

    private ChordAnalysis analyze(String... names) {
        List<PitchName> parsed = Arrays.stream(names).map(PitchName::parse).toList();
        return analyzer.analyze(parsed);
    }

    @Test
    void shouldRecogniseTriadsAndInversions() {
        ChordAnalysis tonic = analyze("C", "E", "G");
        assertThat(tonic.quality()).isEqualTo(ChordQuality.MAJOR_TRIAD);
        assertThat(tonic.root()).isEqualTo(PitchName.parse("C"));
        assertThat(tonic.inversion()).isZero();

        ChordAnalysis firstInversion = analyze("E", "G", "C");
        assertThat(firstInversion.root()).isEqualTo(PitchName.parse("C"));
        assertThat(firstInversion.inversion()).isEqualTo(1);

        assertThat(analyze("D", "F", "A").quality()).isEqualTo(ChordQuality.MINOR_TRIAD);
        assertThat(analyze("B", "D", "F").quality()).isEqualTo(ChordQuality.DIMINISHED_TRIAD);
        assertThat(analyze("C", "E", "G#").quality()).isEqualTo(ChordQuality.AUGMENTED_TRIAD);
    }

    @Test
    void shouldRecogniseSeventhChords() {
        ChordAnalysis dominant = analyze("G", "B", "D", "F");
        assertThat(dominant.isDominantSeventh()).isTrue();
        assertThat(dominant.seventh()).isEqualTo(PitchName.parse("F"));

        ChordAnalysis thirdInversion = analyze("F", "G", "B", "D");
        assertThat(thirdInversion.isDominantSeventh()).isTrue();
        assertThat(thirdInversion.inversion()).isEqualTo(3);

        assertThat(analyze("B", "D", "F", "A-").isDiminishedSeventh()).isTrue();
        assertThat(analyze("B", "D", "F", "A").quality()).isEqualTo(ChordQuality.HALF_DIMINISHED_SEVENTH);
        assertThat(analyze("C", "E", "G", "B").quality()).isEqualTo(ChordQuality.OTHER_SEVENTH);
    }

    @Test
    void shouldRecogniseAugmentedSixthsOverFlatSixth() {
        ChordAnalysis italian = analyze("A-", "C", "F#");
        assertThat(italian.quality()).isEqualTo(ChordQuality.ITALIAN_AUGMENTED_SIXTH);
        assertThat(italian.root()).isEqualTo(PitchName.parse("F#"));
        assertThat(italian.third()).isEqualTo(PitchName.parse("A-"));
        assertThat(italian.fifth()).isEqualTo(PitchName.parse("C"));

        assertThat(analyze("A-", "C", "D", "F#").quality()).isEqualTo(ChordQuality.FRENCH_AUGMENTED_SIXTH);
        assertThat(analyze("A-", "C", "E-", "F#").quality()).isEqualTo(ChordQuality.GERMAN_AUGMENTED_SIXTH);
        assertThat(analyze("A-", "C", "D#", "F#").quality()).isEqualTo(ChordQuality.SWISS_AUGMENTED_SIXTH);
        assertThat(ChordQuality.GERMAN_AUGMENTED_SIXTH.isAugmentedSixth()).isTrue();
    }

    @Test
    void shouldFallBackToBassWhenNoTertianRootExists() {
        ChordAnalysis cluster = analyze("C", "D", "E");

        assertThat(cluster.quality()).isEqualTo(ChordQuality.OTHER);
        assertThat(cluster.root()).isEqualTo(PitchName.parse("C"));
        assertThat(cluster.inversion()).isEqualTo(-1);
    }

    @Test
    void shouldRejectEmptyChord() {
        assertThatThrownBy(() -> analyzer.analyze(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
