package com.phillippitts.figuredbass.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for slot-level realization failures with contextual detail.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Voice cannot reach any chord tone
 * throw RealizationExceptionBuilder.create("No candidate pitches for voice")
 *         .slot(3, "D3", "6,-5")
 *         .metadata("voice", "Soprano")
 *         .infeasible();
 *
 * // Search aborted at the per-slot cap
 * throw RealizationExceptionBuilder.create("Too many realizations")
 *         .slot(0, "C3", "")
 *         .metadata("voices", 5)
 *         .limitExceeded(50_000);
 * </pre>
 */
public final class RealizationExceptionBuilder {

    private final String message;
    private int slotIndex = -1;
    private String bass = "?";
    private String figure = "";
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private RealizationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static RealizationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new RealizationExceptionBuilder(message);
    }

    /**
     * Sets the offending slot.
     *
     * @param slotIndex 0-based slot position in the bass line
     * @param bass bass pitch text
     * @param figure figure text
     * @return this builder for chaining
     */
    public RealizationExceptionBuilder slot(int slotIndex, String bass, String figure) {
        this.slotIndex = slotIndex;
        this.bass = bass;
        this.figure = figure == null ? "" : figure;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public RealizationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds a {@link SlotInfeasibleException}.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (slot={index}, bass={bass}, figure="{figure}", {key1}={val1}, ...)
     * </pre>
     */
    public SlotInfeasibleException infeasible() {
        return new SlotInfeasibleException(detailedMessage(), slotIndex, bass, figure);
    }

    /**
     * Builds a {@link RealizationLimitExceededException} for the given cap.
     */
    public RealizationLimitExceededException limitExceeded(int limit) {
        metadata.put("limit", String.valueOf(limit));
        return new RealizationLimitExceededException(detailedMessage(), slotIndex, limit);
    }

    private String detailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (slot=").append(slotIndex)
                .append(", bass=").append(bass)
                .append(", figure=\"").append(figure).append('"');
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        sb.append(')');
        return sb.toString();
    }
}
