package com.phillippitts.figuredbass.service.rules;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RulesTest {

    @Test
    void shouldEnableEveryRuleByDefault() {
        Rules rules = Rules.defaults();

        assertThat(rules.forbidIncompletePossibilities()).isTrue();
        assertThat(rules.upperPartsMaxSemitoneSeparation()).isEqualTo(12);
        assertThat(rules.forbidVoiceCrossing()).isTrue();
        assertThat(rules.forbidParallelFifths()).isTrue();
        assertThat(rules.forbidHiddenOctaves()).isTrue();
        assertThat(rules.partMovementLimits()).isEmpty();
        assertThat(rules.resolveDominantSeventhProperly()).isTrue();
        assertThat(rules.allowIncompleteDominantResolution()).isTrue();
        assertThat(rules.restrictDoublingsInItalianA6Resolution()).isTrue();
        assertThat(rules.inferDim7DoublingFromResolution()).isTrue();
    }

    @Test
    void shouldLeaveDim7DoublingAndResolutionVoiceLeadingOff() {
        Rules rules = Rules.defaults();

        assertThat(rules.doubledRootInDim7()).isFalse();
        assertThat(rules.applyVoiceLeadingRulesToResolutions()).isFalse();
    }

    @Test
    void shouldCopyIntoBuilderUnchanged() {
        Rules rules = Rules.builder()
                .forbidParallelFifths(false)
                .upperPartsMaxSemitoneSeparation(null)
                .partMovementLimit("Soprano", 2)
                .inferDim7DoublingFromResolution(false)
                .build();

        Rules copy = rules.toBuilder().build();

        assertThat(copy).isEqualTo(rules);
        assertThat(copy.hashCode()).isEqualTo(rules.hashCode());
        assertThat(copy.upperPartsMaxSemitoneSeparation()).isNull();
        assertThat(copy.partMovementLimits()).containsEntry("Soprano", 2);
        assertThat(copy.inferDim7DoublingFromResolution()).isFalse();
    }

    @Test
    void shouldNotShareLimitsWithBuilder() {
        Rules.Builder builder = Rules.builder().partMovementLimit("Alto", 3);
        Rules rules = builder.build();

        builder.partMovementLimit("Tenor", 1);

        assertThat(rules.partMovementLimits()).containsOnlyKeys("Alto");
        assertThatThrownBy(() -> rules.partMovementLimits().put("Bass", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldReplaceLimitsFromMap() {
        Rules rules = Rules.builder()
                .partMovementLimit("Alto", 3)
                .partMovementLimits(Map.of("Soprano", 4))
                .build();

        assertThat(rules.partMovementLimits()).containsExactly(Map.entry("Soprano", 4));
    }

    @Test
    void shouldRejectNegativeLimits() {
        assertThatThrownBy(() -> Rules.builder().partMovementLimit("Soprano", -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Rules.builder().upperPartsMaxSemitoneSeparation(-2))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
