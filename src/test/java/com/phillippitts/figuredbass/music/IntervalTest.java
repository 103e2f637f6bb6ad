package com.phillippitts.figuredbass.music;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntervalTest {

    @Test
    void shouldParseSimpleIntervals() {
        assertThat(Interval.parse("P4").semitones()).isEqualTo(5);
        assertThat(Interval.parse("m2").semitones()).isEqualTo(1);
        assertThat(Interval.parse("M6").semitones()).isEqualTo(9);
        assertThat(Interval.parse("A1").semitones()).isEqualTo(1);
        assertThat(Interval.parse("d1").semitones()).isEqualTo(-1);
        assertThat(Interval.parse("d2").semitones()).isZero();
    }

    @Test
    void shouldParseDescendingIntervals() {
        Interval down = Interval.parse("-M2");

        assertThat(down.generic()).isEqualTo(-2);
        assertThat(down.semitones()).isEqualTo(-2);
        assertThat(down.diatonicSteps()).isEqualTo(-1);
        assertThat(down.isDescending()).isTrue();
    }

    @Test
    void shouldParseCompoundIntervals() {
        assertThat(Interval.parse("M9").semitones()).isEqualTo(14);
        assertThat(Interval.parse("P8").diatonicSteps()).isEqualTo(7);
    }

    @Test
    void shouldRejectQualityThatDoesNotFitSize() {
        assertThatThrownBy(() -> Interval.parse("M5")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Interval.parse("P3")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Interval.parse("X2")).isInstanceOf(IllegalArgumentException.class);
    }
}
