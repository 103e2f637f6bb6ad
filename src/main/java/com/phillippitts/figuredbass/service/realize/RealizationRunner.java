package com.phillippitts.figuredbass.service.realize;

import com.phillippitts.figuredbass.config.properties.DemoProperties;
import com.phillippitts.figuredbass.domain.FiguredBassLine;
import com.phillippitts.figuredbass.domain.Progression;
import com.phillippitts.figuredbass.exception.FiguredBassException;
import com.phillippitts.figuredbass.music.scale.Key;
import com.phillippitts.figuredbass.service.chain.Chain;
import com.phillippitts.figuredbass.service.voice.StandardVoices;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Random;

/**
 * Realizes {@code figuredbass.demo.line} at startup and logs the count and a few samples.
 */
@Component
public class RealizationRunner implements ApplicationRunner {
    private static final Logger LOG = LogManager.getLogger(RealizationRunner.class);

    private final FiguredBassRealizer realizer;
    private final ProgressionFormatter formatter;
    private final DemoProperties demo;

    public RealizationRunner(FiguredBassRealizer realizer, ProgressionFormatter formatter, DemoProperties demo) {
        this.realizer = realizer;
        this.formatter = formatter;
        this.demo = demo;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!demo.isEnabled()) {
            LOG.debug("No demo bass line configured");
            return;
        }
        VoiceEnsemble voices = switch (demo.getVoices()) {
            case KEYBOARD -> StandardVoices.keyboard();
            case THREE_VOICE -> StandardVoices.threeVoice();
            default -> StandardVoices.satb();
        };
        Key key = demo.getKey().isBlank() ? realizer.defaultKey() : Key.parse(demo.getKey());
        try {
            FiguredBassLine line = FiguredBassLine.parse(demo.getLine());
            Chain chain = realizer.realize(line, key, voices, realizer.configuredRules());
            LOG.info("Demo line '{}' in {}: {} progressions", line, key, chain.count());
            for (Progression progression : realizer.sample(chain, demo.getSamples(), new Random())) {
                LOG.info("Sample {}:\n{}", progression.indices(), formatter.format(progression, voices));
            }
        } catch (FiguredBassException e) {
            LOG.error("Demo line '{}' could not be realized: {}", demo.getLine(), e.getMessage());
        }
    }
}
