package com.phillippitts.figuredbass.service.realize;

import com.phillippitts.figuredbass.config.properties.DemoProperties;
import com.phillippitts.figuredbass.config.properties.DemoProperties.VoicePreset;
import com.phillippitts.figuredbass.config.properties.EngineProperties;
import com.phillippitts.figuredbass.config.properties.RealizerProperties;
import com.phillippitts.figuredbass.service.metrics.RealizationMetrics;
import com.phillippitts.figuredbass.testutil.SyncExecutor;
import com.phillippitts.figuredbass.testutil.TestEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RealizationRunnerTest {

    private MeterRegistry registry;
    private FiguredBassRealizer realizer;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        realizer = new FiguredBassRealizer(TestEngine.chainBuilder(), new RealizerProperties(),
                new EngineProperties(), new SyncExecutor(), new RealizationMetrics(registry));
    }

    private void run(DemoProperties demo) {
        new RealizationRunner(realizer, new ProgressionFormatter(), demo).run(new DefaultApplicationArguments());
    }

    @Test
    void shouldSkipWhenNoLineConfigured() {
        run(new DemoProperties(null, null, null, null));

        assertThat(registry.find("figuredbass.realization.success").counter()).isNull();
    }

    @Test
    void shouldRealizeAndSampleConfiguredLine() {
        run(new DemoProperties("C3 | G2 | C3", "C major", VoicePreset.SATB, 2));

        assertThat(registry.find("figuredbass.realization.success").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("figuredbass.realization.latency").tag("phase", "sample").timer().count())
                .isEqualTo(1);
    }

    @Test
    void shouldUseDefaultKeyAndThreeVoicePreset() {
        run(new DemoProperties("C3 | G2", "", VoicePreset.THREE_VOICE, 1));

        assertThat(registry.find("figuredbass.realization.success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldLogInsteadOfFailingStartup() {
        assertThatCode(() -> run(new DemoProperties("C3 | ?? 6", null, VoicePreset.KEYBOARD, 1)))
                .doesNotThrowAnyException();
        assertThat(registry.find("figuredbass.realization.success").counter()).isNull();
    }
}
