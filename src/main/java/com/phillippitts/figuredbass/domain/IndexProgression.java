package com.phillippitts.figuredbass.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One realization index per slot, identifying an end-to-end path through a chain.
 *
 * @param indices realization index for each slot, first slot first
 */
public record IndexProgression(List<Integer> indices) {

    public IndexProgression {
        Objects.requireNonNull(indices, "Indices must not be null");
        indices = List.copyOf(indices);
        for (Integer index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("Realization indices must not be negative: " + indices);
            }
        }
    }

    public static IndexProgression of(int... indices) {
        return new IndexProgression(Arrays.stream(indices).boxed().toList());
    }

    public int length() {
        return indices.size();
    }

    public int get(int slot) {
        return indices.get(slot);
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
