package com.phillippitts.figuredbass.config.properties;

import com.phillippitts.figuredbass.service.rules.Rules;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RealizerPropertiesTest {

    @Test
    void shouldMatchRuleDefaults() {
        assertThat(new RealizerProperties().toRules()).isEqualTo(Rules.defaults());
    }

    @Test
    void shouldSnapshotConfiguredValues() {
        RealizerProperties properties = new RealizerProperties();
        properties.setForbidParallelFifths(false);
        properties.setUpperPartsMaxSemitoneSeparation(null);
        properties.setDoubledRootInDim7(true);
        properties.setInferDim7DoublingFromResolution(false);
        Map<String, Integer> limits = new LinkedHashMap<>();
        limits.put("Soprano", 2);
        properties.setPartMovementLimits(limits);

        Rules rules = properties.toRules();

        assertThat(rules.forbidParallelFifths()).isFalse();
        assertThat(rules.upperPartsMaxSemitoneSeparation()).isNull();
        assertThat(rules.doubledRootInDim7()).isTrue();
        assertThat(rules.inferDim7DoublingFromResolution()).isFalse();
        assertThat(rules.partMovementLimits()).containsEntry("Soprano", 2);
    }

    @Test
    void shouldNotSeeLaterPropertyChanges() {
        RealizerProperties properties = new RealizerProperties();
        Map<String, Integer> limits = new LinkedHashMap<>();
        properties.setPartMovementLimits(limits);

        Rules snapshot = properties.toRules();
        limits.put("Alto", 1);
        properties.setForbidVoiceCrossing(false);

        assertThat(snapshot.partMovementLimits()).isEmpty();
        assertThat(snapshot.forbidVoiceCrossing()).isTrue();
    }
}
