package com.phillippitts.figuredbass.service.chain;

import com.phillippitts.figuredbass.domain.IndexProgression;
import com.phillippitts.figuredbass.domain.Possibility;
import com.phillippitts.figuredbass.domain.Progression;
import com.phillippitts.figuredbass.exception.ChainInfeasibleException;
import com.phillippitts.figuredbass.exception.ChainNotReadyException;
import com.phillippitts.figuredbass.exception.InvalidInputException;
import com.phillippitts.figuredbass.service.movement.resolution.ResolutionPlan;
import com.phillippitts.figuredbass.service.rules.Rules;
import com.phillippitts.figuredbass.service.segment.SlotHarmony;
import com.phillippitts.figuredbass.service.voice.VoiceEnsemble;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Ordered chain of {@link ChordSlot}s, one per bass note, linked by movements.
 *
 * <p>A chain is populated by {@link ChainBuilder} in the order realizations, movements,
 * pruning (see {@link ChainState}). Once pruned it is read-only: every surviving realization
 * of a non-final slot has at least one surviving successor, every surviving realization of a
 * non-first slot is reached from the first slot, and any number of threads may query it.
 *
 * <p>Queries:
 * <ul>
 *   <li>{@link #count()}: number of index progressions, by dynamic programming from the last
 *       slot backward</li>
 *   <li>{@link #enumerateAll()}: every progression, lazily, in lexicographic index order</li>
 *   <li>{@link #sampleOne(Random)}: one progression by a forward walk</li>
 * </ul>
 * Querying a chain that is not pruned throws {@link ChainNotReadyException}; querying a chain
 * whose pruning found no complete progression throws {@link ChainInfeasibleException}.
 */
public final class Chain {
    private static final Logger LOG = LogManager.getLogger(Chain.class);

    private final List<ChordSlot> slots;
    private final VoiceEnsemble voices;
    private final Rules rules;
    private final SamplingStrategy samplingStrategy;
    private volatile ChainState state = ChainState.UNBUILT;
    private ChainInfeasibleException infeasibility;
    private BigInteger[][] pathCounts;
    private BigInteger total;

    Chain(List<SlotHarmony> harmonies, VoiceEnsemble voices, Rules rules, SamplingStrategy samplingStrategy) {
        Objects.requireNonNull(harmonies, "harmonies");
        if (harmonies.isEmpty()) {
            throw new InvalidInputException("A chain needs at least one bass note");
        }
        this.voices = Objects.requireNonNull(voices, "voices");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.samplingStrategy = Objects.requireNonNull(samplingStrategy, "samplingStrategy");
        List<ChordSlot> built = new ArrayList<>(harmonies.size());
        for (SlotHarmony harmony : harmonies) {
            built.add(new ChordSlot(harmony));
        }
        this.slots = List.copyOf(built);
    }

    void setRealizations(List<List<Possibility>> realizations) {
        requireState("setRealizations", ChainState.UNBUILT);
        if (realizations.size() != slots.size()) {
            throw new IllegalArgumentException("Expected realizations for " + slots.size()
                    + " slots, got " + realizations.size());
        }
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).setRealizations(realizations.get(i));
        }
        state = ChainState.REALIZATIONS_BUILT;
    }

    void setMovements(List<ResolutionPlan> plans, List<Map<Integer, BitSet>> movements) {
        requireState("setMovements", ChainState.REALIZATIONS_BUILT);
        if (movements.size() != slots.size() - 1 || plans.size() != movements.size()) {
            throw new IllegalArgumentException("Expected movements for " + (slots.size() - 1)
                    + " slot pairs, got " + movements.size());
        }
        for (int i = 0; i < movements.size(); i++) {
            slots.get(i).setMovements(plans.get(i), movements.get(i));
        }
        state = ChainState.MOVEMENTS_BUILT;
    }

    /**
     * Removes every realization that cannot take part in a complete progression.
     *
     * <p>A single backward sweep keeps a realization only if it still has a surviving
     * successor, then a forward pass drops realizations no surviving predecessor moves to.
     * Running it again on a pruned chain changes nothing.
     *
     * @throws ChainNotReadyException   if movements have not been generated
     * @throws ChainInfeasibleException if no progression runs from the first slot to the last
     */
    public synchronized void prune() {
        if (state == ChainState.PRUNED) {
            if (infeasibility != null) {
                throw infeasibility;
            }
            sweep();
            return;
        }
        requireState("prune", ChainState.MOVEMENTS_BUILT);
        int before = totalAlive();
        try {
            sweep();
        } catch (ChainInfeasibleException e) {
            infeasibility = e;
            state = ChainState.PRUNED;
            throw e;
        }
        pathCounts = computePathCounts();
        total = BigInteger.ZERO;
        BitSet first = slots.get(0).aliveInternal();
        for (int a = first.nextSetBit(0); a >= 0; a = first.nextSetBit(a + 1)) {
            total = total.add(pathCounts[0][a]);
        }
        state = ChainState.PRUNED;
        LOG.info("Pruned chain of {} slots: {} of {} realizations survive, {} progressions",
                slots.size(), totalAlive(), before, total);
    }

    private void sweep() {
        int last = slots.size() - 1;
        if (slots.get(last).aliveCount() == 0) {
            throw infeasible(last);
        }
        for (int i = last - 1; i >= 0; i--) {
            ChordSlot slot = slots.get(i);
            BitSet nextAlive = slots.get(i + 1).aliveInternal();
            BitSet alive = slot.aliveInternal();
            for (int a = alive.nextSetBit(0); a >= 0; a = alive.nextSetBit(a + 1)) {
                BitSet targets = slot.successorsInternal(a);
                if (targets != null) {
                    targets.and(nextAlive);
                }
                if (targets == null || targets.isEmpty()) {
                    slot.kill(a);
                }
            }
            if (slot.aliveCount() == 0) {
                throw infeasible(i);
            }
        }
        for (int i = 1; i <= last; i++) {
            ChordSlot previous = slots.get(i - 1);
            BitSet reached = new BitSet();
            BitSet previousAlive = previous.aliveInternal();
            for (int a = previousAlive.nextSetBit(0); a >= 0; a = previousAlive.nextSetBit(a + 1)) {
                reached.or(previous.successorsInternal(a));
            }
            ChordSlot slot = slots.get(i);
            BitSet alive = slot.aliveInternal();
            for (int b = alive.nextSetBit(0); b >= 0; b = alive.nextSetBit(b + 1)) {
                if (!reached.get(b)) {
                    slot.kill(b);
                }
            }
        }
    }

    private ChainInfeasibleException infeasible(int emptiedSlot) {
        ChordSlot first = slots.get(0);
        ChordSlot lastSlot = slots.get(slots.size() - 1);
        ChordSlot emptied = slots.get(emptiedSlot);
        String message = String.format("No progression connects the bass line end to end; "
                        + "slot %d (%s \"%s\") has no realization that can continue",
                emptiedSlot, emptied.bass(), emptied.figure());
        LOG.warn(message);
        return new ChainInfeasibleException(message, emptiedSlot,
                first.bass().nameWithOctave(), first.figure(),
                lastSlot.bass().nameWithOctave(), lastSlot.figure());
    }

    private BigInteger[][] computePathCounts() {
        int last = slots.size() - 1;
        BigInteger[][] counts = new BigInteger[slots.size()][];
        for (int i = last; i >= 0; i--) {
            ChordSlot slot = slots.get(i);
            BigInteger[] row = new BigInteger[slot.realizations().size()];
            Arrays.fill(row, BigInteger.ZERO);
            BitSet alive = slot.aliveInternal();
            for (int a = alive.nextSetBit(0); a >= 0; a = alive.nextSetBit(a + 1)) {
                if (i == last) {
                    row[a] = BigInteger.ONE;
                    continue;
                }
                BitSet targets = slot.successorsInternal(a);
                BigInteger sum = BigInteger.ZERO;
                for (int b = targets.nextSetBit(0); b >= 0; b = targets.nextSetBit(b + 1)) {
                    sum = sum.add(counts[i + 1][b]);
                }
                row[a] = sum;
            }
            counts[i] = row;
        }
        return counts;
    }

    /**
     * Number of distinct index progressions through the pruned chain.
     *
     * @return exact count; positive
     */
    public BigInteger count() {
        requirePruned("count");
        return total;
    }

    /**
     * Number of progressions that start from one realization of one slot and run to the end.
     *
     * @param slot        slot index
     * @param realization realization index in that slot
     * @return count; zero for a pruned realization
     * @throws InvalidInputException if either index is out of range
     */
    public BigInteger countFrom(int slot, int realization) {
        requirePruned("countFrom");
        if (slot < 0 || slot >= pathCounts.length) {
            throw new InvalidInputException("Slot " + slot + " is outside the chain of "
                    + pathCounts.length + " slots");
        }
        if (realization < 0 || realization >= pathCounts[slot].length) {
            throw new InvalidInputException("Slot " + slot + " has no realization " + realization
                    + "; it has " + pathCounts[slot].length);
        }
        return pathCounts[slot][realization];
    }

    /**
     * Every index progression, in lexicographic order. Each call to {@code iterator()} starts
     * a fresh pass; nothing is materialized up front.
     */
    public Iterable<IndexProgression> enumerateIndices() {
        requirePruned("enumerateIndices");
        return PathIterator::new;
    }

    /** Every progression with its possibilities, in the order of {@link #enumerateIndices()}. */
    public Iterable<Progression> enumerateAll() {
        requirePruned("enumerateAll");
        return () -> {
            Iterator<IndexProgression> indices = new PathIterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return indices.hasNext();
                }

                @Override
                public Progression next() {
                    return toProgression(indices.next());
                }
            };
        };
    }

    /** Sequential lazy stream over {@link #enumerateAll()}. */
    public Stream<Progression> stream() {
        return StreamSupport.stream(enumerateAll().spliterator(), false);
    }

    /** Samples with the chain's configured strategy and a thread-local generator. */
    public Progression sampleOne() {
        return sampleOne(ThreadLocalRandom.current(), samplingStrategy);
    }

    /** Samples with the chain's configured strategy. */
    public Progression sampleOne(Random random) {
        return sampleOne(random, samplingStrategy);
    }

    /**
     * Walks forward from the first slot to produce one progression.
     *
     * @param random   source of randomness
     * @param strategy how to choose at each step; see {@link SamplingStrategy}
     * @return sampled progression
     */
    public Progression sampleOne(Random random, SamplingStrategy strategy) {
        requirePruned("sampleOne");
        Objects.requireNonNull(random, "random");
        Objects.requireNonNull(strategy, "strategy");
        int[] path = new int[slots.size()];
        BitSet options = slots.get(0).aliveInternal();
        for (int i = 0; i < slots.size(); i++) {
            path[i] = strategy == SamplingStrategy.COUNT_WEIGHTED
                    ? pickWeighted(options, pathCounts[i], random)
                    : pickUniform(options, random);
            if (i + 1 < slots.size()) {
                options = slots.get(i).successorsInternal(path[i]);
            }
        }
        return toProgression(IndexProgression.of(path));
    }

    private static int pickUniform(BitSet options, Random random) {
        int target = random.nextInt(options.cardinality());
        int index = options.nextSetBit(0);
        for (int k = 0; k < target; k++) {
            index = options.nextSetBit(index + 1);
        }
        return index;
    }

    private static int pickWeighted(BitSet options, BigInteger[] weights, Random random) {
        BigInteger sum = BigInteger.ZERO;
        for (int i = options.nextSetBit(0); i >= 0; i = options.nextSetBit(i + 1)) {
            sum = sum.add(weights[i]);
        }
        BigInteger target;
        do {
            target = new BigInteger(sum.bitLength(), random);
        } while (target.compareTo(sum) >= 0);
        int chosen = -1;
        for (int i = options.nextSetBit(0); i >= 0; i = options.nextSetBit(i + 1)) {
            chosen = i;
            target = target.subtract(weights[i]);
            if (target.signum() < 0) {
                break;
            }
        }
        return chosen;
    }

    /**
     * Resolves an index progression to its possibilities.
     *
     * @param progression one index per slot
     * @return possibilities in slot order
     * @throws InvalidInputException if the progression is not a path through the pruned chain
     */
    public List<Possibility> progressionToPossibilities(IndexProgression progression) {
        requirePruned("progressionToPossibilities");
        Objects.requireNonNull(progression, "progression");
        if (progression.length() != slots.size()) {
            throw new InvalidInputException("Progression has " + progression.length()
                    + " indices but the chain has " + slots.size() + " slots");
        }
        List<Possibility> possibilities = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            ChordSlot slot = slots.get(i);
            int index = progression.get(i);
            if (index >= slot.realizations().size() || !slot.isAlive(index)) {
                throw new InvalidInputException("Slot " + i + " has no surviving realization " + index);
            }
            if (i > 0 && !slots.get(i - 1).successors(progression.get(i - 1)).get(index)) {
                throw new InvalidInputException("Realization " + progression.get(i - 1) + " of slot " + (i - 1)
                        + " cannot move to realization " + index + " of slot " + i);
            }
            possibilities.add(slot.realization(index));
        }
        return possibilities;
    }

    private Progression toProgression(IndexProgression indices) {
        List<Possibility> possibilities = new ArrayList<>(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            possibilities.add(slots.get(i).realization(indices.get(i)));
        }
        return new Progression(indices, possibilities);
    }

    private void requireState(String operation, ChainState expected) {
        if (state != expected) {
            throw new ChainNotReadyException(operation, state.name());
        }
    }

    private void requirePruned(String operation) {
        requireState(operation, ChainState.PRUNED);
        if (infeasibility != null) {
            throw infeasibility;
        }
    }

    private int totalAlive() {
        int alive = 0;
        for (ChordSlot slot : slots) {
            alive += slot.aliveCount();
        }
        return alive;
    }

    public int size() {
        return slots.size();
    }

    public ChordSlot slot(int index) {
        return slots.get(index);
    }

    public List<ChordSlot> slots() {
        return slots;
    }

    public VoiceEnsemble voices() {
        return voices;
    }

    public Rules rules() {
        return rules;
    }

    public SamplingStrategy samplingStrategy() {
        return samplingStrategy;
    }

    public ChainState state() {
        return state;
    }

    @Override
    public String toString() {
        return "Chain{slots=" + slots.size() + ", state=" + state + '}';
    }

    /** Depth-first walk over the pruned adjacency, odometer style. */
    private final class PathIterator implements Iterator<IndexProgression> {
        private final int[] path = new int[slots.size()];
        private boolean started;
        private boolean ready;
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (!ready && !exhausted) {
                ready = advance();
                exhausted = !ready;
            }
            return ready;
        }

        @Override
        public IndexProgression next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            ready = false;
            return IndexProgression.of(path.clone());
        }

        private boolean advance() {
            if (!started) {
                started = true;
                int first = options(0).nextSetBit(0);
                if (first < 0) {
                    return false;
                }
                path[0] = first;
                fillFrom(1);
                return true;
            }
            for (int level = path.length - 1; level >= 0; level--) {
                int next = options(level).nextSetBit(path[level] + 1);
                if (next >= 0) {
                    path[level] = next;
                    fillFrom(level + 1);
                    return true;
                }
            }
            return false;
        }

        private void fillFrom(int level) {
            for (int l = level; l < path.length; l++) {
                path[l] = options(l).nextSetBit(0);
            }
        }

        private BitSet options(int level) {
            return level == 0
                    ? slots.get(0).aliveInternal()
                    : slots.get(level - 1).successorsInternal(path[level - 1]);
        }
    }
}
