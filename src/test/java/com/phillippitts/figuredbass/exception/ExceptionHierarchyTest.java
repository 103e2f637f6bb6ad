package com.phillippitts.figuredbass.exception;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void figuredBassExceptionShouldIncludeMessageAndCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        FiguredBassException ex = new FiguredBassException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void invalidInputExceptionShouldKeepReason() {
        InvalidInputException ex = new InvalidInputException("voice list is empty");

        assertThat(ex.getReason()).isEqualTo("voice list is empty");
        assertThat(ex.getMessage()).contains("voice list is empty");
        assertThat(ex).isInstanceOf(FiguredBassException.class);
    }

    @Test
    void invalidNotationExceptionShouldBeInvalidInput() {
        InvalidNotationException ex = new InvalidNotationException("6#5", "two numbers");

        assertThat(ex.getNotation()).isEqualTo("6#5");
        assertThat(ex.getMessage()).contains("6#5").contains("two numbers");
        assertThat(ex).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void slotInfeasibleExceptionShouldIncludeSlot() {
        SlotInfeasibleException ex = new SlotInfeasibleException(3, "D3", "6,-5");

        assertThat(ex.getSlotIndex()).isEqualTo(3);
        assertThat(ex.getBass()).isEqualTo("D3");
        assertThat(ex.getFigure()).isEqualTo("6,-5");
        assertThat(ex.getMessage()).contains("slot 3").contains("D3").contains("6,-5");
    }

    @Test
    void chainInfeasibleExceptionShouldIncludeEndpoints() {
        ChainInfeasibleException ex = new ChainInfeasibleException("no path", 1, "C3", "", "D3", "6");

        assertThat(ex.getEmptiedSlotIndex()).isEqualTo(1);
        assertThat(ex.getFirstBass()).isEqualTo("C3");
        assertThat(ex.getFirstFigure()).isEmpty();
        assertThat(ex.getLastBass()).isEqualTo("D3");
        assertThat(ex.getLastFigure()).isEqualTo("6");
    }

    @Test
    void chainNotReadyExceptionShouldNameState() {
        ChainNotReadyException ex = new ChainNotReadyException("count", "UNBUILT");

        assertThat(ex.getState()).isEqualTo("UNBUILT");
        assertThat(ex.getMessage()).isEqualTo("Cannot count while chain is UNBUILT");
    }

    @Test
    void limitExceededExceptionShouldIncludeLimit() {
        RealizationLimitExceededException ex = new RealizationLimitExceededException("too many", 2, 100);

        assertThat(ex.getSlotIndex()).isEqualTo(2);
        assertThat(ex.getLimit()).isEqualTo(100);
    }
}
