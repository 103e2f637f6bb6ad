package com.phillippitts.figuredbass.service.movement.resolution;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.music.Pitch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * How realizations of one slot may move into realizations of the next.
 *
 * <p>A plan is one of:
 * <ul>
 *   <li><b>ordinary</b>: only the consecutive voice-leading rules apply</li>
 *   <li><b>mapped</b>: each realization has exactly one resolution, obtained by moving every
 *       voice with the first matching {@link ToneResolution} (unmatched voices hold)</li>
 *   <li><b>Italian sixth</b>: the ordinary rules plus an {@link ItalianSixthFilter}</li>
 * </ul>
 *
 * <p>Any plan may relax the completeness rule of the target slot.
 */
public final class ResolutionPlan {

    private static final ResolutionPlan ORDINARY = new ResolutionPlan(
            ResolutionKind.NONE, "ordinary", List.of(), null, false, true);

    private final ResolutionKind kind;
    private final String method;
    private final List<ToneResolution> tones;
    private final ItalianSixthFilter italianFilter;
    private final boolean relaxesTargetCompleteness;
    private final boolean appliesVoiceLeadingRules;

    private ResolutionPlan(ResolutionKind kind, String method, List<ToneResolution> tones,
                           ItalianSixthFilter italianFilter, boolean relaxesTargetCompleteness,
                           boolean appliesVoiceLeadingRules) {
        this.kind = Objects.requireNonNull(kind);
        this.method = Objects.requireNonNull(method);
        this.tones = List.copyOf(tones);
        this.italianFilter = italianFilter;
        this.relaxesTargetCompleteness = relaxesTargetCompleteness;
        this.appliesVoiceLeadingRules = appliesVoiceLeadingRules;
    }

    public static ResolutionPlan ordinary() {
        return ORDINARY;
    }

    /** Ordinary plan that still lets the target slot omit chord members. */
    public static ResolutionPlan ordinaryRelaxed() {
        return new ResolutionPlan(ResolutionKind.NONE, "ordinary", List.of(), null, true, true);
    }

    public static ResolutionPlan mapped(ResolutionKind kind, String method, List<ToneResolution> tones,
                                        boolean relaxesTargetCompleteness, boolean appliesVoiceLeadingRules) {
        if (tones == null || tones.isEmpty()) {
            throw new IllegalArgumentException("A mapped resolution needs at least one tone resolution");
        }
        return new ResolutionPlan(kind, method, tones, null, relaxesTargetCompleteness, appliesVoiceLeadingRules);
    }

    public static ResolutionPlan italianSixth(ItalianSixthFilter filter) {
        return new ResolutionPlan(ResolutionKind.ITALIAN_AUGMENTED_SIXTH, "italianSixth", List.of(),
                Objects.requireNonNull(filter, "filter"), false, true);
    }

    /** Same plan, with the target completeness rule relaxed or not. */
    public ResolutionPlan withRelaxedTarget(boolean relaxed) {
        if (relaxed == relaxesTargetCompleteness) {
            return this;
        }
        return new ResolutionPlan(kind, method, tones, italianFilter, relaxed, appliesVoiceLeadingRules);
    }

    public boolean isMapped() {
        return !tones.isEmpty();
    }

    public boolean isItalianSixth() {
        return italianFilter != null;
    }

    /**
     * Resolves one pitch of a realization.
     *
     * @param pitch pitch in the earlier slot
     * @param bass  bass pitch of the earlier slot
     * @return the pitch it must move to (itself if no entry matches)
     */
    public Pitch resolve(Pitch pitch, Pitch bass) {
        for (ToneResolution tone : tones) {
            if (tone.matches(pitch, bass)) {
                return pitch.transpose(tone.interval());
            }
        }
        return pitch;
    }

    /** The unique resolution of {@code possibility} under a mapped plan. */
    public Possibility resolve(Possibility possibility) {
        List<Pitch> resolved = new ArrayList<>(possibility.size());
        for (Pitch pitch : possibility.pitches()) {
            resolved.add(resolve(pitch, possibility.bass()));
        }
        return new Possibility(resolved);
    }

    public ResolutionKind kind() {
        return kind;
    }

    /** Short name of the resolution applied, for logs. */
    public String method() {
        return method;
    }

    public List<ToneResolution> tones() {
        return tones;
    }

    public ItalianSixthFilter italianFilter() {
        return italianFilter;
    }

    public boolean relaxesTargetCompleteness() {
        return relaxesTargetCompleteness;
    }

    /** Whether the ordinary consecutive rules are checked as well. */
    public boolean appliesVoiceLeadingRules() {
        return appliesVoiceLeadingRules;
    }

    @Override
    public String toString() {
        return "ResolutionPlan{" + kind + ", " + method
                + (relaxesTargetCompleteness ? ", relaxed target" : "") + '}';
    }
}
