package com.phillippitts.figuredbass.service.voice;

import com.phillippitts.figuredbass.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Voices of one realization request in their fixed high-to-low order.
 *
 * <p>The order is computed once at construction. The last voice is the bass; its range is
 * informational because the bass always sounds the given bass line.
 */
public final class VoiceEnsemble {

    private final List<Voice> voices;

    private VoiceEnsemble(List<Voice> voices) {
        this.voices = voices;
    }

    /**
     * Sorts and validates voices.
     *
     * @param voices at least two voices with distinct labels
     * @return ordered ensemble
     * @throws InvalidInputException if fewer than two voices are given or labels repeat
     */
    public static VoiceEnsemble of(Collection<Voice> voices) {
        if (voices == null || voices.isEmpty()) {
            throw new InvalidInputException("voice list is empty");
        }
        if (voices.size() < 2) {
            throw new InvalidInputException("at least one voice above the bass is required");
        }
        Set<String> labels = new HashSet<>();
        for (Voice voice : voices) {
            if (voice == null) {
                throw new InvalidInputException("voice list contains null");
            }
            if (!labels.add(voice.label())) {
                throw new InvalidInputException("duplicate voice label '" + voice.label() + "'");
            }
        }
        List<Voice> sorted = new ArrayList<>(voices);
        sorted.sort(null);
        return new VoiceEnsemble(List.copyOf(sorted));
    }

    public static VoiceEnsemble of(Voice... voices) {
        return of(List.of(voices));
    }

    /** All voices, highest first. */
    public List<Voice> voices() {
        return voices;
    }

    public Voice get(int index) {
        return voices.get(index);
    }

    public int size() {
        return voices.size();
    }

    public int bassIndex() {
        return voices.size() - 1;
    }

    public Voice bass() {
        return voices.get(bassIndex());
    }

    /** Index of the voice with the given label, or -1. */
    public int indexOf(String label) {
        for (int i = 0; i < voices.size(); i++) {
            if (voices.get(i).label().equals(label)) {
                return i;
            }
        }
        return -1;
    }

    public List<String> labels() {
        return voices.stream().map(Voice::label).toList();
    }

    @Override
    public String toString() {
        return "VoiceEnsemble" + voices;
    }
}
