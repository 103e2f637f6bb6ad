package com.phillippitts.figuredbass.config.properties;

import com.phillippitts.figuredbass.music.scale.ScaleMode;
import com.phillippitts.figuredbass.service.chain.BuildOptions;
import com.phillippitts.figuredbass.service.chain.SamplingStrategy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for the realization engine.
 */
@Validated
@ConfigurationProperties(prefix = "figuredbass.engine")
public class EngineProperties {

    /**
     * Upper bound on realizations generated for one slot. Exceeding it fails the request
     * instead of truncating the search.
     */
    @Min(1)
    private final int maxRealizationsPerSlot;

    /** Generate slots and movements on the realizer executor. */
    private final boolean parallel;

    @NotNull
    private final SamplingStrategy samplingStrategy;

    /** Tonic used to read figures when a request names no key. */
    @NotBlank
    private final String defaultKey;

    @NotNull
    private final ScaleMode defaultMode;

    @ConstructorBinding
    public EngineProperties(Integer maxRealizationsPerSlot, Boolean parallel, SamplingStrategy samplingStrategy,
                            String defaultKey, ScaleMode defaultMode) {
        this.maxRealizationsPerSlot = maxRealizationsPerSlot == null
                ? BuildOptions.DEFAULT_MAX_REALIZATIONS_PER_SLOT : maxRealizationsPerSlot;
        this.parallel = parallel != null && parallel;
        this.samplingStrategy = samplingStrategy == null ? SamplingStrategy.LOCAL_UNIFORM : samplingStrategy;
        this.defaultKey = defaultKey == null ? "C" : defaultKey;
        this.defaultMode = defaultMode == null ? ScaleMode.MAJOR : defaultMode;
    }

    /**
     * Defaults for tests: sequential, default cap, local uniform sampling, C major.
     */
    public EngineProperties() {
        this(null, null, null, null, null);
    }

    public int getMaxRealizationsPerSlot() {
        return maxRealizationsPerSlot;
    }

    public boolean isParallel() {
        return parallel;
    }

    public SamplingStrategy getSamplingStrategy() {
        return samplingStrategy;
    }

    public String getDefaultKey() {
        return defaultKey;
    }

    public ScaleMode getDefaultMode() {
        return defaultMode;
    }
}
