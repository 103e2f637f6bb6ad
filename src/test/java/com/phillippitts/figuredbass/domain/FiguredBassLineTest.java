package com.phillippitts.figuredbass.domain;

import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.music.Pitch;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FiguredBassLineTest {

    @Test
    void shouldParseNotesAndFigures() {
        FiguredBassLine line = FiguredBassLine.parse("C3 | D3 6, -5 | E3 6 | G2 7 | C3");

        assertThat(line.size()).isEqualTo(5);
        assertThat(line.notes()).extracting(BassNote::figure).containsExactly("", "6,-5", "6", "7", "");
        assertThat(line.notes().get(1).pitch()).isEqualTo(Pitch.parse("D3"));
    }

    @Test
    void shouldRenderTextForm() {
        FiguredBassLine line = FiguredBassLine.of(BassNote.of("C3"), BassNote.of("B2", "6,5"));

        assertThat(line).hasToString("C3 | B2 6,5");
    }

    @Test
    void shouldRejectEmptyLines() {
        assertThatThrownBy(() -> FiguredBassLine.parse("  "))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> new FiguredBassLine(List.of()))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> FiguredBassLine.parse("C3 | | D3"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void shouldWrapUnreadablePitch() {
        assertThatThrownBy(() -> FiguredBassLine.parse("C3 | X3 6"))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("X3 6")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldNormaliseNullFigure() {
        assertThat(new BassNote(Pitch.parse("C3"), null).figure()).isEmpty();
        assertThat(BassNote.of("C3", " 6 ").figure()).isEqualTo("6");
    }
}
