package com.phillippitts.figuredbass.service.rules;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of the voice-leading rules for one realization request.
 *
 * <p>Three groups of rules exist:
 * <ul>
 *   <li><b>Single:</b> checked on each realization within a slot (completeness, spacing,
 *       crossing, doubling of altered tones)</li>
 *   <li><b>Consecutive:</b> checked on each movement between two slots (parallels, hidden
 *       perfects, overlap, leap limits)</li>
 *   <li><b>Resolution:</b> govern how dominant sevenths, diminished sevenths and augmented
 *       sixths must move into the following chord</li>
 * </ul>
 *
 * <p>Build with {@link #builder()}; {@link #defaults()} enables every rule.
 *
 * @since 1.0
 */
public final class Rules {

    private final boolean forbidIncompletePossibilities;
    private final Integer upperPartsMaxSemitoneSeparation;
    private final boolean forbidVoiceCrossing;
    private final boolean forbidDoubledAlteredTones;

    private final boolean forbidParallelUnisons;
    private final boolean forbidParallelFifths;
    private final boolean forbidParallelOctaves;
    private final boolean forbidHiddenFifths;
    private final boolean forbidHiddenOctaves;
    private final boolean forbidVoiceOverlap;
    private final Map<String, Integer> partMovementLimits;

    private final boolean resolveDominantSeventhProperly;
    private final boolean resolveDiminishedSeventhProperly;
    private final boolean resolveAugmentedSixthProperly;
    private final boolean doubledRootInDim7;
    private final boolean inferDim7DoublingFromResolution;
    private final boolean allowIncompleteDominantResolution;
    private final boolean applyVoiceLeadingRulesToResolutions;
    private final boolean restrictDoublingsInItalianA6Resolution;

    private Rules(Builder b) {
        this.forbidIncompletePossibilities = b.forbidIncompletePossibilities;
        this.upperPartsMaxSemitoneSeparation = b.upperPartsMaxSemitoneSeparation;
        this.forbidVoiceCrossing = b.forbidVoiceCrossing;
        this.forbidDoubledAlteredTones = b.forbidDoubledAlteredTones;
        this.forbidParallelUnisons = b.forbidParallelUnisons;
        this.forbidParallelFifths = b.forbidParallelFifths;
        this.forbidParallelOctaves = b.forbidParallelOctaves;
        this.forbidHiddenFifths = b.forbidHiddenFifths;
        this.forbidHiddenOctaves = b.forbidHiddenOctaves;
        this.forbidVoiceOverlap = b.forbidVoiceOverlap;
        this.partMovementLimits = Map.copyOf(b.partMovementLimits);
        this.resolveDominantSeventhProperly = b.resolveDominantSeventhProperly;
        this.resolveDiminishedSeventhProperly = b.resolveDiminishedSeventhProperly;
        this.resolveAugmentedSixthProperly = b.resolveAugmentedSixthProperly;
        this.doubledRootInDim7 = b.doubledRootInDim7;
        this.inferDim7DoublingFromResolution = b.inferDim7DoublingFromResolution;
        this.allowIncompleteDominantResolution = b.allowIncompleteDominantResolution;
        this.applyVoiceLeadingRulesToResolutions = b.applyVoiceLeadingRulesToResolutions;
        this.restrictDoublingsInItalianA6Resolution = b.restrictDoublingsInItalianA6Resolution;
    }

    public static Rules defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder pre-filled with this snapshot's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.forbidIncompletePossibilities = forbidIncompletePossibilities;
        b.upperPartsMaxSemitoneSeparation = upperPartsMaxSemitoneSeparation;
        b.forbidVoiceCrossing = forbidVoiceCrossing;
        b.forbidDoubledAlteredTones = forbidDoubledAlteredTones;
        b.forbidParallelUnisons = forbidParallelUnisons;
        b.forbidParallelFifths = forbidParallelFifths;
        b.forbidParallelOctaves = forbidParallelOctaves;
        b.forbidHiddenFifths = forbidHiddenFifths;
        b.forbidHiddenOctaves = forbidHiddenOctaves;
        b.forbidVoiceOverlap = forbidVoiceOverlap;
        b.partMovementLimits.putAll(partMovementLimits);
        b.resolveDominantSeventhProperly = resolveDominantSeventhProperly;
        b.resolveDiminishedSeventhProperly = resolveDiminishedSeventhProperly;
        b.resolveAugmentedSixthProperly = resolveAugmentedSixthProperly;
        b.doubledRootInDim7 = doubledRootInDim7;
        b.inferDim7DoublingFromResolution = inferDim7DoublingFromResolution;
        b.allowIncompleteDominantResolution = allowIncompleteDominantResolution;
        b.applyVoiceLeadingRulesToResolutions = applyVoiceLeadingRulesToResolutions;
        b.restrictDoublingsInItalianA6Resolution = restrictDoublingsInItalianA6Resolution;
        return b;
    }

    public boolean forbidIncompletePossibilities() {
        return forbidIncompletePossibilities;
    }

    /** Largest span in semitones between any two upper voices, or null for no limit. */
    public Integer upperPartsMaxSemitoneSeparation() {
        return upperPartsMaxSemitoneSeparation;
    }

    public boolean forbidVoiceCrossing() {
        return forbidVoiceCrossing;
    }

    public boolean forbidDoubledAlteredTones() {
        return forbidDoubledAlteredTones;
    }

    public boolean forbidParallelUnisons() {
        return forbidParallelUnisons;
    }

    public boolean forbidParallelFifths() {
        return forbidParallelFifths;
    }

    public boolean forbidParallelOctaves() {
        return forbidParallelOctaves;
    }

    public boolean forbidHiddenFifths() {
        return forbidHiddenFifths;
    }

    public boolean forbidHiddenOctaves() {
        return forbidHiddenOctaves;
    }

    public boolean forbidVoiceOverlap() {
        return forbidVoiceOverlap;
    }

    /** Largest melodic move in semitones per voice label; voices not listed are unrestricted. */
    public Map<String, Integer> partMovementLimits() {
        return partMovementLimits;
    }

    public boolean resolveDominantSeventhProperly() {
        return resolveDominantSeventhProperly;
    }

    public boolean resolveDiminishedSeventhProperly() {
        return resolveDiminishedSeventhProperly;
    }

    public boolean resolveAugmentedSixthProperly() {
        return resolveAugmentedSixthProperly;
    }

    /**
     * Whether a diminished seventh doubles the root of its resolution chord instead of the
     * third. Ignored for first-inversion diminished sevenths while
     * {@link #inferDim7DoublingFromResolution()} is on.
     */
    public boolean doubledRootInDim7() {
        return doubledRootInDim7;
    }

    /**
     * Whether a first-inversion diminished seventh takes its doubling from the bass of the
     * resolution chord: root for a root-position tonic, third for a first-inversion tonic.
     */
    public boolean inferDim7DoublingFromResolution() {
        return inferDim7DoublingFromResolution;
    }

    /** Whether a root-position dominant seventh may resolve to a tonic without its fifth. */
    public boolean allowIncompleteDominantResolution() {
        return allowIncompleteDominantResolution;
    }

    /** Whether consecutive rules also apply to movements fixed by a resolution. */
    public boolean applyVoiceLeadingRulesToResolutions() {
        return applyVoiceLeadingRulesToResolutions;
    }

    public boolean restrictDoublingsInItalianA6Resolution() {
        return restrictDoublingsInItalianA6Resolution;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rules r)) {
            return false;
        }
        return forbidIncompletePossibilities == r.forbidIncompletePossibilities
                && Objects.equals(upperPartsMaxSemitoneSeparation, r.upperPartsMaxSemitoneSeparation)
                && forbidVoiceCrossing == r.forbidVoiceCrossing
                && forbidDoubledAlteredTones == r.forbidDoubledAlteredTones
                && forbidParallelUnisons == r.forbidParallelUnisons
                && forbidParallelFifths == r.forbidParallelFifths
                && forbidParallelOctaves == r.forbidParallelOctaves
                && forbidHiddenFifths == r.forbidHiddenFifths
                && forbidHiddenOctaves == r.forbidHiddenOctaves
                && forbidVoiceOverlap == r.forbidVoiceOverlap
                && partMovementLimits.equals(r.partMovementLimits)
                && resolveDominantSeventhProperly == r.resolveDominantSeventhProperly
                && resolveDiminishedSeventhProperly == r.resolveDiminishedSeventhProperly
                && resolveAugmentedSixthProperly == r.resolveAugmentedSixthProperly
                && doubledRootInDim7 == r.doubledRootInDim7
                && inferDim7DoublingFromResolution == r.inferDim7DoublingFromResolution
                && allowIncompleteDominantResolution == r.allowIncompleteDominantResolution
                && applyVoiceLeadingRulesToResolutions == r.applyVoiceLeadingRulesToResolutions
                && restrictDoublingsInItalianA6Resolution == r.restrictDoublingsInItalianA6Resolution;
    }

    @Override
    public int hashCode() {
        return Objects.hash(forbidIncompletePossibilities, upperPartsMaxSemitoneSeparation, forbidVoiceCrossing,
                forbidDoubledAlteredTones, forbidParallelUnisons, forbidParallelFifths, forbidParallelOctaves,
                forbidHiddenFifths, forbidHiddenOctaves, forbidVoiceOverlap, partMovementLimits,
                resolveDominantSeventhProperly, resolveDiminishedSeventhProperly, resolveAugmentedSixthProperly,
                doubledRootInDim7, inferDim7DoublingFromResolution, allowIncompleteDominantResolution, applyVoiceLeadingRulesToResolutions,
                restrictDoublingsInItalianA6Resolution);
    }

    @Override
    public String toString() {
        return "Rules{incomplete=" + !forbidIncompletePossibilities
                + ", upperSpan=" + upperPartsMaxSemitoneSeparation
                + ", crossing=" + !forbidVoiceCrossing
                + ", parallels(1/5/8)=" + !forbidParallelUnisons + "/" + !forbidParallelFifths
                + "/" + !forbidParallelOctaves
                + ", hidden(5/8)=" + !forbidHiddenFifths + "/" + !forbidHiddenOctaves
                + ", overlap=" + !forbidVoiceOverlap
                + ", limits=" + partMovementLimits
                + ", doubledRootInDim7=" + doubledRootInDim7
                + ", inferDim7Doubling=" + inferDim7DoublingFromResolution + "}";
    }

    /**
     * Fluent builder; every rule starts enabled except {@code doubledRootInDim7} and
     * {@code applyVoiceLeadingRulesToResolutions}.
     */
    public static final class Builder {
        private boolean forbidIncompletePossibilities = true;
        private Integer upperPartsMaxSemitoneSeparation = 12;
        private boolean forbidVoiceCrossing = true;
        private boolean forbidDoubledAlteredTones = true;
        private boolean forbidParallelUnisons = true;
        private boolean forbidParallelFifths = true;
        private boolean forbidParallelOctaves = true;
        private boolean forbidHiddenFifths = true;
        private boolean forbidHiddenOctaves = true;
        private boolean forbidVoiceOverlap = true;
        private final Map<String, Integer> partMovementLimits = new LinkedHashMap<>();
        private boolean resolveDominantSeventhProperly = true;
        private boolean resolveDiminishedSeventhProperly = true;
        private boolean resolveAugmentedSixthProperly = true;
        private boolean doubledRootInDim7 = false;
        private boolean inferDim7DoublingFromResolution = true;
        private boolean allowIncompleteDominantResolution = true;
        private boolean applyVoiceLeadingRulesToResolutions = false;
        private boolean restrictDoublingsInItalianA6Resolution = true;

        private Builder() {
        }

        public Builder forbidIncompletePossibilities(boolean value) {
            this.forbidIncompletePossibilities = value;
            return this;
        }

        public Builder upperPartsMaxSemitoneSeparation(Integer semitones) {
            if (semitones != null && semitones < 0) {
                throw new IllegalArgumentException("Upper parts separation must not be negative, got: " + semitones);
            }
            this.upperPartsMaxSemitoneSeparation = semitones;
            return this;
        }

        public Builder forbidVoiceCrossing(boolean value) {
            this.forbidVoiceCrossing = value;
            return this;
        }

        public Builder forbidDoubledAlteredTones(boolean value) {
            this.forbidDoubledAlteredTones = value;
            return this;
        }

        public Builder forbidParallelUnisons(boolean value) {
            this.forbidParallelUnisons = value;
            return this;
        }

        public Builder forbidParallelFifths(boolean value) {
            this.forbidParallelFifths = value;
            return this;
        }

        public Builder forbidParallelOctaves(boolean value) {
            this.forbidParallelOctaves = value;
            return this;
        }

        public Builder forbidHiddenFifths(boolean value) {
            this.forbidHiddenFifths = value;
            return this;
        }

        public Builder forbidHiddenOctaves(boolean value) {
            this.forbidHiddenOctaves = value;
            return this;
        }

        public Builder forbidVoiceOverlap(boolean value) {
            this.forbidVoiceOverlap = value;
            return this;
        }

        /**
         * Limits the melodic move of one voice.
         *
         * @param voiceLabel label of the voice
         * @param maxSemitones largest allowed move, 0 to keep the voice stationary
         * @return this builder for chaining
         */
        public Builder partMovementLimit(String voiceLabel, int maxSemitones) {
            Objects.requireNonNull(voiceLabel, "Voice label must not be null");
            if (maxSemitones < 0) {
                throw new IllegalArgumentException("Movement limit must not be negative, got: " + maxSemitones);
            }
            this.partMovementLimits.put(voiceLabel, maxSemitones);
            return this;
        }

        public Builder partMovementLimits(Map<String, Integer> limits) {
            this.partMovementLimits.clear();
            if (limits != null) {
                limits.forEach(this::partMovementLimit);
            }
            return this;
        }

        public Builder resolveDominantSeventhProperly(boolean value) {
            this.resolveDominantSeventhProperly = value;
            return this;
        }

        public Builder resolveDiminishedSeventhProperly(boolean value) {
            this.resolveDiminishedSeventhProperly = value;
            return this;
        }

        public Builder resolveAugmentedSixthProperly(boolean value) {
            this.resolveAugmentedSixthProperly = value;
            return this;
        }

        public Builder doubledRootInDim7(boolean value) {
            this.doubledRootInDim7 = value;
            return this;
        }

        public Builder inferDim7DoublingFromResolution(boolean value) {
            this.inferDim7DoublingFromResolution = value;
            return this;
        }

        public Builder allowIncompleteDominantResolution(boolean value) {
            this.allowIncompleteDominantResolution = value;
            return this;
        }

        public Builder applyVoiceLeadingRulesToResolutions(boolean value) {
            this.applyVoiceLeadingRulesToResolutions = value;
            return this;
        }

        public Builder restrictDoublingsInItalianA6Resolution(boolean value) {
            this.restrictDoublingsInItalianA6Resolution = value;
            return this;
        }

        public Rules build() {
            return new Rules(this);
        }
    }
}
