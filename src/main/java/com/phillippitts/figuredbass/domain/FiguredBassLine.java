package com.phillippitts.figuredbass.domain;

import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.music.Pitch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered bass notes of one realization request.
 *
 * <p>Text form separates notes with {@code |}; each note is a pitch followed by an optional
 * figure: {@code "C3 | D3 6,-5 | E3 6"}. Spaces inside a figure are ignored.
 *
 * @param notes bass notes in order; never empty
 */
public record FiguredBassLine(List<BassNote> notes) {

    public FiguredBassLine {
        Objects.requireNonNull(notes, "Notes must not be null");
        notes = List.copyOf(notes);
        if (notes.isEmpty()) {
            throw new InvalidInputException("Bass line must not be empty");
        }
    }

    public static FiguredBassLine of(BassNote... notes) {
        return new FiguredBassLine(List.of(notes));
    }

    /**
     * Parses the text form.
     *
     * @param text notes separated by {@code |}
     * @return parsed line
     * @throws InvalidInputException if the text is blank or a pitch cannot be read
     */
    public static FiguredBassLine parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Bass line must not be empty");
        }
        List<BassNote> notes = new ArrayList<>();
        for (String part : text.split("\\|")) {
            String trimmed = part.strip();
            if (trimmed.isEmpty()) {
                throw new InvalidInputException("Empty bass note in line: " + text);
            }
            String[] tokens = trimmed.split("\\s+", 2);
            try {
                Pitch pitch = Pitch.parse(tokens[0]);
                String figure = tokens.length > 1 ? tokens[1].replaceAll("\\s+", "") : "";
                notes.add(new BassNote(pitch, figure));
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Cannot read bass note '" + trimmed + "': " + e.getMessage(), e);
            }
        }
        return new FiguredBassLine(notes);
    }

    public int size() {
        return notes.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (BassNote note : notes) {
            if (sb.length() > 0) {
                sb.append(" | ");
            }
            sb.append(note);
        }
        return sb.toString();
    }
}
