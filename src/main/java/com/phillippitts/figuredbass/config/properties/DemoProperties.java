package com.phillippitts.figuredbass.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Properties for realizing a bass line at startup.
 *
 * <p>When {@code figuredbass.demo.line} is blank nothing runs.
 */
@Validated
@ConfigurationProperties(prefix = "figuredbass.demo")
public class DemoProperties {

    public enum VoicePreset { SATB, KEYBOARD, THREE_VOICE }

    /** Bass line such as {@code "C3 | D3 6,-5 | E3 6"}. */
    private final String line;

    /** Key such as {@code "C major"}; blank means the engine default. */
    private final String key;

    @NotNull
    private final VoicePreset voices;

    @Min(0)
    private final int samples;

    @ConstructorBinding
    public DemoProperties(String line, String key, VoicePreset voices, Integer samples) {
        this.line = line == null ? "" : line;
        this.key = key == null ? "" : key;
        this.voices = voices == null ? VoicePreset.SATB : voices;
        this.samples = samples == null ? 1 : samples;
    }

    public String getLine() {
        return line;
    }

    public String getKey() {
        return key;
    }

    public VoicePreset getVoices() {
        return voices;
    }

    public int getSamples() {
        return samples;
    }

    public boolean isEnabled() {
        return !line.isBlank();
    }
}
