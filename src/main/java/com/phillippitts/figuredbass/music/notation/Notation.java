package com.phillippitts.figuredbass.music.notation;

import java.util.List;
import java.util.Objects;

/**
 * Structured form of a figure string such as {@code "6,-5"}.
 *
 * @param source  original figure text (may be empty)
 * @param figures intervals above the bass in longhand, highest number first
 */
public record Notation(String source, List<Figure> figures) {

    public Notation {
        Objects.requireNonNull(source, "Notation source must not be null");
        Objects.requireNonNull(figures, "Figures must not be null");
        figures = List.copyOf(figures);
        if (figures.isEmpty()) {
            throw new IllegalArgumentException("Notation must contain at least one figure");
        }
    }

    public List<Integer> numbers() {
        return figures.stream().map(Figure::number).toList();
    }

    public boolean hasNumbers(Integer... expected) {
        return numbers().equals(List.of(expected));
    }

    @Override
    public String toString() {
        return source.isEmpty() ? "<5,3>" : source;
    }
}
