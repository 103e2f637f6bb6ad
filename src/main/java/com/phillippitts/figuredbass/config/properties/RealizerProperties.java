package com.phillippitts.figuredbass.config.properties;

import com.phillippitts.figuredbass.service.rules.Rules;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default voice-leading rules, bound from {@code figuredbass.rules.*}.
 *
 * <p>Every property defaults to the value in {@link Rules#defaults()}. A request takes an
 * immutable snapshot through {@link #toRules()}, so changing these beans later never affects
 * a realization in progress.
 */
@Validated
@ConfigurationProperties(prefix = "figuredbass.rules")
public class RealizerProperties {

    private boolean forbidIncompletePossibilities = true;

    /** Max span of the upper voices in semitones; unset means unlimited. */
    @Min(0)
    private Integer upperPartsMaxSemitoneSeparation = 12;

    private boolean forbidVoiceCrossing = true;
    private boolean forbidDoubledAlteredTones = true;

    private boolean forbidParallelUnisons = true;
    private boolean forbidParallelFifths = true;
    private boolean forbidParallelOctaves = true;
    private boolean forbidHiddenFifths = true;
    private boolean forbidHiddenOctaves = true;
    private boolean forbidVoiceOverlap = true;

    /** Max semitones a voice (by label) may move between consecutive slots. */
    @NotNull
    private Map<String, @Min(0) Integer> partMovementLimits = new LinkedHashMap<>();

    private boolean resolveDominantSeventhProperly = true;
    private boolean resolveDiminishedSeventhProperly = true;
    private boolean resolveAugmentedSixthProperly = true;
    private boolean doubledRootInDim7 = false;
    private boolean inferDim7DoublingFromResolution = true;
    private boolean allowIncompleteDominantResolution = true;
    private boolean applyVoiceLeadingRulesToResolutions = false;
    private boolean restrictDoublingsInItalianA6Resolution = true;

    /**
     * Immutable snapshot of the current values.
     */
    public Rules toRules() {
        return Rules.builder()
                .forbidIncompletePossibilities(forbidIncompletePossibilities)
                .upperPartsMaxSemitoneSeparation(upperPartsMaxSemitoneSeparation)
                .forbidVoiceCrossing(forbidVoiceCrossing)
                .forbidDoubledAlteredTones(forbidDoubledAlteredTones)
                .forbidParallelUnisons(forbidParallelUnisons)
                .forbidParallelFifths(forbidParallelFifths)
                .forbidParallelOctaves(forbidParallelOctaves)
                .forbidHiddenFifths(forbidHiddenFifths)
                .forbidHiddenOctaves(forbidHiddenOctaves)
                .forbidVoiceOverlap(forbidVoiceOverlap)
                .partMovementLimits(partMovementLimits)
                .resolveDominantSeventhProperly(resolveDominantSeventhProperly)
                .resolveDiminishedSeventhProperly(resolveDiminishedSeventhProperly)
                .resolveAugmentedSixthProperly(resolveAugmentedSixthProperly)
                .doubledRootInDim7(doubledRootInDim7)
                .inferDim7DoublingFromResolution(inferDim7DoublingFromResolution)
                .allowIncompleteDominantResolution(allowIncompleteDominantResolution)
                .applyVoiceLeadingRulesToResolutions(applyVoiceLeadingRulesToResolutions)
                .restrictDoublingsInItalianA6Resolution(restrictDoublingsInItalianA6Resolution)
                .build();
    }

    public boolean isForbidIncompletePossibilities() {
        return forbidIncompletePossibilities;
    }

    public void setForbidIncompletePossibilities(boolean forbidIncompletePossibilities) {
        this.forbidIncompletePossibilities = forbidIncompletePossibilities;
    }

    public Integer getUpperPartsMaxSemitoneSeparation() {
        return upperPartsMaxSemitoneSeparation;
    }

    public void setUpperPartsMaxSemitoneSeparation(Integer upperPartsMaxSemitoneSeparation) {
        this.upperPartsMaxSemitoneSeparation = upperPartsMaxSemitoneSeparation;
    }

    public boolean isForbidVoiceCrossing() {
        return forbidVoiceCrossing;
    }

    public void setForbidVoiceCrossing(boolean forbidVoiceCrossing) {
        this.forbidVoiceCrossing = forbidVoiceCrossing;
    }

    public boolean isForbidDoubledAlteredTones() {
        return forbidDoubledAlteredTones;
    }

    public void setForbidDoubledAlteredTones(boolean forbidDoubledAlteredTones) {
        this.forbidDoubledAlteredTones = forbidDoubledAlteredTones;
    }

    public boolean isForbidParallelUnisons() {
        return forbidParallelUnisons;
    }

    public void setForbidParallelUnisons(boolean forbidParallelUnisons) {
        this.forbidParallelUnisons = forbidParallelUnisons;
    }

    public boolean isForbidParallelFifths() {
        return forbidParallelFifths;
    }

    public void setForbidParallelFifths(boolean forbidParallelFifths) {
        this.forbidParallelFifths = forbidParallelFifths;
    }

    public boolean isForbidParallelOctaves() {
        return forbidParallelOctaves;
    }

    public void setForbidParallelOctaves(boolean forbidParallelOctaves) {
        this.forbidParallelOctaves = forbidParallelOctaves;
    }

    public boolean isForbidHiddenFifths() {
        return forbidHiddenFifths;
    }

    public void setForbidHiddenFifths(boolean forbidHiddenFifths) {
        this.forbidHiddenFifths = forbidHiddenFifths;
    }

    public boolean isForbidHiddenOctaves() {
        return forbidHiddenOctaves;
    }

    public void setForbidHiddenOctaves(boolean forbidHiddenOctaves) {
        this.forbidHiddenOctaves = forbidHiddenOctaves;
    }

    public boolean isForbidVoiceOverlap() {
        return forbidVoiceOverlap;
    }

    public void setForbidVoiceOverlap(boolean forbidVoiceOverlap) {
        this.forbidVoiceOverlap = forbidVoiceOverlap;
    }

    public Map<String, Integer> getPartMovementLimits() {
        return partMovementLimits;
    }

    public void setPartMovementLimits(Map<String, Integer> partMovementLimits) {
        this.partMovementLimits = partMovementLimits;
    }

    public boolean isResolveDominantSeventhProperly() {
        return resolveDominantSeventhProperly;
    }

    public void setResolveDominantSeventhProperly(boolean resolveDominantSeventhProperly) {
        this.resolveDominantSeventhProperly = resolveDominantSeventhProperly;
    }

    public boolean isResolveDiminishedSeventhProperly() {
        return resolveDiminishedSeventhProperly;
    }

    public void setResolveDiminishedSeventhProperly(boolean resolveDiminishedSeventhProperly) {
        this.resolveDiminishedSeventhProperly = resolveDiminishedSeventhProperly;
    }

    public boolean isResolveAugmentedSixthProperly() {
        return resolveAugmentedSixthProperly;
    }

    public void setResolveAugmentedSixthProperly(boolean resolveAugmentedSixthProperly) {
        this.resolveAugmentedSixthProperly = resolveAugmentedSixthProperly;
    }

    public boolean isDoubledRootInDim7() {
        return doubledRootInDim7;
    }

    public void setDoubledRootInDim7(boolean doubledRootInDim7) {
        this.doubledRootInDim7 = doubledRootInDim7;
    }

    public boolean isInferDim7DoublingFromResolution() {
        return inferDim7DoublingFromResolution;
    }

    public void setInferDim7DoublingFromResolution(boolean inferDim7DoublingFromResolution) {
        this.inferDim7DoublingFromResolution = inferDim7DoublingFromResolution;
    }

    public boolean isAllowIncompleteDominantResolution() {
        return allowIncompleteDominantResolution;
    }

    public void setAllowIncompleteDominantResolution(boolean allowIncompleteDominantResolution) {
        this.allowIncompleteDominantResolution = allowIncompleteDominantResolution;
    }

    public boolean isApplyVoiceLeadingRulesToResolutions() {
        return applyVoiceLeadingRulesToResolutions;
    }

    public void setApplyVoiceLeadingRulesToResolutions(boolean applyVoiceLeadingRulesToResolutions) {
        this.applyVoiceLeadingRulesToResolutions = applyVoiceLeadingRulesToResolutions;
    }

    public boolean isRestrictDoublingsInItalianA6Resolution() {
        return restrictDoublingsInItalianA6Resolution;
    }

    public void setRestrictDoublingsInItalianA6Resolution(boolean restrictDoublingsInItalianA6Resolution) {
        this.restrictDoublingsInItalianA6Resolution = restrictDoublingsInItalianA6Resolution;
    }
}
