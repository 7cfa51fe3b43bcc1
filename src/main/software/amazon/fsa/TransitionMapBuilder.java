package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.Objects;

/**
 * Computes epsilon closures and per-symbol transition maps over an {@link Nfa}. These are the primitives a subset
 * construction uses: starting from the closure of each start state, it repeatedly asks for the edge map of a closed
 * state set and materializes one deterministic state per distinct target set.
 *
 * Reads the automaton only; it must not be modified while a builder is in use.
 */
@NotThreadSafe
public class TransitionMapBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TransitionMapBuilder.class);

    private final Nfa nfa;
    private final TransitionMapConfiguration configuration;

    public TransitionMapBuilder(@Nonnull final Nfa nfa) {
        this(nfa, TransitionMapConfiguration.builder().build());
    }

    public TransitionMapBuilder(@Nonnull final Nfa nfa, @Nonnull final TransitionMapConfiguration configuration) {
        this.nfa = Objects.requireNonNull(nfa, "nfa");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public TransitionMapConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * Add a state and everything reachable from it over epsilon edges to a set. Uses an explicit work stack, so deep
     * and cyclic epsilon graphs are fine.
     *
     * @param seed The state to add.
     * @param stateSet The set to add to.
     * @return False if the seed was already in the set, in which case nothing is done. True otherwise.
     */
    public boolean closedAdd(final int seed, @Nonnull final IntSortedSet stateSet) {
        nfa.checkState(seed);
        if (!stateSet.add(seed)) {
            return false;
        }
        IntArrayList unchecked = new IntArrayList();
        unchecked.push(seed);
        while (!unchecked.isEmpty()) {
            IntArrayList targets = nfa.stateAt(unchecked.popInt()).epsilonTargets();
            for (int i = 0; i < targets.size(); i++) {
                int target = targets.getInt(i);
                if (stateSet.add(target)) {
                    unchecked.push(target);
                }
            }
        }
        return true;
    }

    /**
     * @return The epsilon closure of a single state.
     */
    public IntSortedSet closure(final int seed) {
        IntSortedSet stateSet = StateSets.newStateSet();
        closedAdd(seed, stateSet);
        return stateSet;
    }

    /**
     * @return The union of the epsilon closures of the given states.
     */
    public IntSortedSet closure(@Nonnull final IntSortedSet seeds) {
        IntSortedSet stateSet = StateSets.newStateSet();
        for (IntIterator i = seeds.iterator(); i.hasNext(); ) {
            closedAdd(i.nextInt(), stateSet);
        }
        return stateSet;
    }

    /**
     * Build the transition function of a set of states. For every ordinary edge leaving a member, the closure of its
     * target is merged into the target set of every symbol of the edge's range. For every sentinel edge leaving a
     * member, the closure of its target is merged into the target set of that sentinel. With implicit sentinel loops
     * configured, the given set itself is also merged into the target set of every sentinel.
     *
     * @param stateSet The source states, normally an epsilon-closed set.
     * @return The transition function.
     */
    public EdgeMap buildEdgeMap(@Nonnull final IntSortedSet stateSet) {
        EdgeMap edgeMap = new EdgeMap();
        for (IntIterator i = stateSet.iterator(); i.hasNext(); ) {
            NfaState state = nfa.stateAt(i.nextInt());
            for (EdgeRange edge : state.getEdgeRanges()) {
                int target = edge.getTargetState();
                edgeMap.rangeMap().update(edge.getRange().first(), edge.getRange().last(),
                        targets -> closedAdd(target, targets));
            }
            for (SentinelEdge edge : state.getSentinelEdges()) {
                closedAdd(edge.getTargetState(), edgeMap.sentinelAccumulator(edge.getSentinel()));
            }
        }

        if (configuration.isImplicitSentinelLoops()) {
            for (Sentinel sentinel : Sentinel.values()) {
                StateSets.union(stateSet, edgeMap.sentinelAccumulator(sentinel));
            }
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Edge map for {} states: {} symbol ranges, {} sentinels", stateSet.size(),
                    edgeMap.getRanges().size(), edgeMap.getSentinels().size());
        }
        return edgeMap;
    }
}
