package com.phillippitts.figuredbass.service.cache;

import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.music.PitchName;
import com.phillippitts.figuredbass.service.voice.Voice;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Memoization shared by the slots of a single realization request.
 *
 * <p>Holds candidate pitch lists per voice and chord, and voice-pair motion verdicts keyed by
 * the four pitches involved. A new instance is created for every request and discarded with
 * the chain builder; nothing is kept between requests. Safe for use from the parallel
 * generation workers.
 */
public final class RealizationCache {

    private final Map<CandidateKey, List<Pitch>> candidates = new ConcurrentHashMap<>();
    private final Map<MotionKey, Boolean> motions = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    /**
     * Returns the candidate pitches for a voice, computing them on first use.
     *
     * @param voice  voice whose range bounds the candidates
     * @param names  chord pitch names
     * @param floor  lowest allowed pitch (the bass)
     * @param loader computes the list on a miss
     * @return cached, unmodifiable candidate list
     */
    public List<Pitch> candidates(Voice voice, Set<PitchName> names, Pitch floor, Supplier<List<Pitch>> loader) {
        CandidateKey key = new CandidateKey(voice, Set.copyOf(names), floor.midi());
        List<Pitch> cached = candidates.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        return candidates.computeIfAbsent(key, k -> List.copyOf(loader.get()));
    }

    /**
     * Returns whether the motion of one voice pair is legal, computing it on first use.
     *
     * @param kind    which check the verdict belongs to
     * @param higherA higher voice before the move (MIDI)
     * @param lowerA  lower voice before the move (MIDI)
     * @param higherB higher voice after the move (MIDI)
     * @param lowerB  lower voice after the move (MIDI)
     * @param check   computes the verdict on a miss
     */
    public boolean motion(String kind, int higherA, int lowerA, int higherB, int lowerB, BooleanSupplier check) {
        MotionKey key = new MotionKey(kind, higherA, lowerA, higherB, lowerB);
        Boolean cached = motions.get(key);
        if (cached != null) {
            hits.incrementAndGet();
            return cached;
        }
        misses.incrementAndGet();
        boolean verdict = check.getAsBoolean();
        motions.putIfAbsent(key, verdict);
        return verdict;
    }

    public long hitCount() {
        return hits.get();
    }

    public long missCount() {
        return misses.get();
    }

    public int size() {
        return candidates.size() + motions.size();
    }

    private record CandidateKey(Voice voice, Set<PitchName> names, int floorMidi) {
    }

    private record MotionKey(String kind, int higherA, int lowerA, int higherB, int lowerB) {
    }
}
