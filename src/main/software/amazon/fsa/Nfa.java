package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.fsa.range.SymbolRange;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A nondeterministic finite state automaton. States live in an arena and are identified by their index; edges refer
 * to their targets by index too. The structure only grows: no operation removes a state or an edge, short of
 * {@link #clear()} which discards everything at once.
 *
 * As an extension to the conventional definition, an automaton may have any number of start states, recorded in a
 * start state registry. Two registry entries may resolve to the same state. Transformations of the automaton are
 * expected to keep the registry size and the meaning of each registry index, while the state each index resolves to
 * may change.
 *
 * Edges come in three kinds: ordinary edges over a range of symbols, sentinel edges over an anchor symbol, and epsilon
 * edges that consume nothing. Every state implicitly loops back to itself on every sentinel symbol; those loops are
 * never stored.
 *
 * Single threaded. One builder constructs the whole automaton before anything reads it.
 */
@NotThreadSafe
public class Nfa {

    private static final Logger logger = LoggerFactory.getLogger(Nfa.class);

    private final List<NfaState> states = new ArrayList<>();
    private final IntArrayList startStates = new IntArrayList();

    /**
     * Make an empty automaton. Having no start states, it accepts nothing.
     */
    public Nfa() {
    }

    /**
     * Add a new non-accepting state.
     *
     * @return The id of the new state.
     */
    public int addState() {
        return addState(Constants.NO_TOKEN);
    }

    /**
     * Add a new state.
     *
     * @param tokenId {@link Constants#NO_TOKEN} for a non-accepting state, {@link Constants#DEFAULT_TOKEN} if only one
     *                kind of accepting state is needed, or any other token id to tell matches apart.
     * @return The id of the new state.
     */
    public int addState(final int tokenId) {
        Constants.checkTokenId(tokenId);
        int id = states.size();
        states.add(new NfaState(id, tokenId));
        return id;
    }

    /**
     * Change the token id of an existing state.
     *
     * @param state The state to change.
     * @param tokenId The new token id.
     */
    public void setTokenId(final int state, final int tokenId) {
        Constants.checkTokenId(tokenId);
        stateAt(state).setTokenId(tokenId);
    }

    /**
     * Register an existing state as a new start state.
     *
     * @param state The state to register.
     * @return The registry index, which identifies this start condition across transformations of the automaton.
     */
    public int registerStartState(final int state) {
        checkState(state);
        startStates.add(state);
        return startStates.size() - 1;
    }

    /**
     * Add an ordinary edge on a single symbol.
     */
    public void addEdge(final int origin, final int target, final int symbol) {
        addEdgeRange(origin, target, SymbolRange.single(symbol));
    }

    /**
     * Add an ordinary edge on the symbols {@code [first, last]}.
     *
     * @throws IllegalArgumentException if {@code last < first}
     */
    public void addEdgeRange(final int origin, final int target, final int first, final int last) {
        addEdgeRange(origin, target, SymbolRange.of(first, last));
    }

    /**
     * Add an ordinary edge on a range of symbols. The edge is appended as is; it is not merged with existing edges even
     * when their ranges overlap.
     */
    public void addEdgeRange(final int origin, final int target, @Nonnull final SymbolRange range) {
        Objects.requireNonNull(range, "range");
        checkState(target);
        stateAt(origin).addEdgeRange(new EdgeRange(range, target));
    }

    /**
     * Add an edge on a sentinel symbol.
     */
    public void addSentinelEdge(final int origin, final int target, @Nonnull final Sentinel sentinel) {
        Objects.requireNonNull(sentinel, "sentinel");
        checkState(target);
        stateAt(origin).addSentinelEdge(new SentinelEdge(sentinel, target));
    }

    /**
     * Add an edge that may be followed without consuming any input.
     */
    public void addEpsilonEdge(final int origin, final int target) {
        checkState(target);
        stateAt(origin).addEpsilonEdge(target);
    }

    /**
     * Remove all states and clear the start state registry. Fragments and state ids obtained earlier become
     * meaningless.
     */
    public void clear() {
        logger.debug("Clearing automaton with {} states and {} start state registrations",
                states.size(), startStates.size());
        startStates.clear();
        states.clear();
    }

    public int getNumberOfStates() {
        return states.size();
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public int getStartStateRegistrySize() {
        return startStates.size();
    }

    /**
     * Resolve a start state registry index.
     *
     * @param index Registry index as returned by {@link #registerStartState(int)}.
     * @return The state the index resolves to.
     * @throws IndexOutOfBoundsException if there is no such registry entry
     */
    public int getStartState(final int index) {
        if (index < 0 || index >= startStates.size()) {
            throw new IndexOutOfBoundsException("No start state registry entry " + index + ", registry size is "
                    + startStates.size());
        }
        return startStates.getInt(index);
    }

    public IntList getStartStates() {
        return IntLists.unmodifiable(startStates);
    }

    /**
     * @throws IndexOutOfBoundsException if the state was not created by this automaton
     */
    public NfaState getState(final int state) {
        return stateAt(state);
    }

    public List<NfaState> getStates() {
        return Collections.unmodifiableList(states);
    }

    NfaState stateAt(final int state) {
        checkState(state);
        return states.get(state);
    }

    void checkState(final int state) {
        if (state < 0 || state >= states.size()) {
            throw new IndexOutOfBoundsException("No state " + state + " in automaton with " + states.size()
                    + " states");
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("NFA: start=").append(startStates);
        for (NfaState state : states) {
            sb.append(" // ").append(state);
        }
        return sb.toString();
    }
}
