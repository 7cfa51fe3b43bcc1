package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One state of an {@link Nfa}, with its token id and the three kinds of outgoing edges. Instances are owned by the
 * automaton; callers see them through the read-only accessors. Order and redundancy of edges are not significant:
 * duplicate and overlapping ranges are kept as added.
 */
@NotThreadSafe
public final class NfaState {

    private final int id;

    /* Constants.NO_TOKEN for any non-accepting state. */
    private int tokenId;

    private final List<EdgeRange> edgeRanges = new ArrayList<>(2);
    private final List<SentinelEdge> sentinelEdges = new ArrayList<>(0);
    private final IntArrayList epsilonEdges = new IntArrayList(2);

    NfaState(final int id, final int tokenId) {
        this.id = id;
        this.tokenId = tokenId;
    }

    public int getId() {
        return id;
    }

    public int getTokenId() {
        return tokenId;
    }

    public boolean isAccepting() {
        return tokenId != Constants.NO_TOKEN;
    }

    public List<EdgeRange> getEdgeRanges() {
        return Collections.unmodifiableList(edgeRanges);
    }

    public List<SentinelEdge> getSentinelEdges() {
        return Collections.unmodifiableList(sentinelEdges);
    }

    /**
     * Target states of the epsilon edges leaving this state.
     */
    public IntList getEpsilonEdges() {
        return IntLists.unmodifiable(epsilonEdges);
    }

    /**
     * Returns {@code true} if this state has no outgoing edges of any kind.
     */
    public boolean hasNoEdges() {
        return edgeRanges.isEmpty() && sentinelEdges.isEmpty() && epsilonEdges.isEmpty();
    }

    void setTokenId(final int tokenId) {
        this.tokenId = tokenId;
    }

    void addEdgeRange(final EdgeRange edge) {
        edgeRanges.add(edge);
    }

    void addSentinelEdge(final SentinelEdge edge) {
        sentinelEdges.add(edge);
    }

    void addEpsilonEdge(final int target) {
        epsilonEdges.add(target);
    }

    // Direct access for the closure computation.
    IntArrayList epsilonTargets() {
        return epsilonEdges;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("S").append(id);
        if (isAccepting()) {
            sb.append(" token=").append(tokenId);
        }
        if (!edgeRanges.isEmpty()) {
            sb.append(" ranges=").append(edgeRanges);
        }
        if (!sentinelEdges.isEmpty()) {
            sb.append(" sentinels=").append(sentinelEdges);
        }
        if (!epsilonEdges.isEmpty()) {
            sb.append(" epsilon=").append(epsilonEdges);
        }
        return sb.toString();
    }
}
