package com.phillippitts.figuredbass.service.chain;

import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.music.Pitch;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.segment.SlotHarmony;

import java.util.BitSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One bass note of a chain: its realizations and its links to the next slot.
 *
 * <p>Realizations are stored once, in generation order, and never removed; an index stays
 * valid for the life of the slot. Pruning clears bits in the {@code alive} set and drops
 * adjacency entries instead of deleting realizations. Mutators are package-private and used
 * only by {@link Chain} while it is being built and pruned.
 */
public final class ChordSlot {

    private final SlotHarmony harmony;
    private List<Possibility> realizations = List.of();
    private final BitSet alive = new BitSet();
    private final Map<Integer, BitSet> next = new TreeMap<>();
    private ResolutionPlan plan;

    ChordSlot(SlotHarmony harmony) {
        this.harmony = Objects.requireNonNull(harmony, "harmony");
    }

    void setRealizations(List<Possibility> possibilities) {
        this.realizations = List.copyOf(possibilities);
        alive.clear();
        alive.set(0, realizations.size());
    }

    void setMovements(ResolutionPlan outgoingPlan, Map<Integer, BitSet> adjacency) {
        this.plan = Objects.requireNonNull(outgoingPlan, "outgoingPlan");
        next.clear();
        for (Map.Entry<Integer, BitSet> entry : adjacency.entrySet()) {
            next.put(entry.getKey(), (BitSet) entry.getValue().clone());
        }
    }

    /** Kills realization {@code index} and drops its outgoing entry. */
    void kill(int index) {
        alive.clear(index);
        next.remove(index);
    }

    /** Live successor set of {@code index}, or null. Callers in this package may mutate it. */
    BitSet successorsInternal(int index) {
        return next.get(index);
    }

    BitSet aliveInternal() {
        return alive;
    }

    public int index() {
        return harmony.index();
    }

    public SlotHarmony harmony() {
        return harmony;
    }

    public Pitch bass() {
        return harmony.bass();
    }

    public String figure() {
        return harmony.figure();
    }

    /** Every realization ever generated, including pruned ones. */
    public List<Possibility> realizations() {
        return realizations;
    }

    public Possibility realization(int index) {
        return realizations.get(index);
    }

    public boolean isAlive(int index) {
        return alive.get(index);
    }

    public int aliveCount() {
        return alive.cardinality();
    }

    /** Copy of the surviving realization indices. */
    public BitSet aliveIndices() {
        return (BitSet) alive.clone();
    }

    /** Copy of the successor indices of {@code index} in the next slot (empty if none). */
    public BitSet successors(int index) {
        BitSet targets = next.get(index);
        return targets == null ? new BitSet() : (BitSet) targets.clone();
    }

    /** Copy of the adjacency to the next slot. */
    public Map<Integer, BitSet> movements() {
        Map<Integer, BitSet> copy = new TreeMap<>();
        next.forEach((index, targets) -> copy.put(index, (BitSet) targets.clone()));
        return copy;
    }

    /** Plan used for the movements out of this slot; null for the last slot of a chain. */
    public ResolutionPlan plan() {
        return plan;
    }

    @Override
    public String toString() {
        return "ChordSlot{" + harmony + ", alive=" + aliveCount() + "/" + realizations.size() + '}';
    }
}
