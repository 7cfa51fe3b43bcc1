package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import software.amazon.fsa.range.SymbolRangeMap;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The transition function of a set of states: for each input symbol, and for each sentinel symbol, the epsilon-closed
 * set of states reachable by consuming it. Symbols with no transition map to the empty set.
 */
@NotThreadSafe
public final class EdgeMap {

    private final SymbolRangeMap<IntSortedSet> ranges = new SymbolRangeMap<>(new IntAVLTreeSet(), IntAVLTreeSet::new);
    private final Map<Sentinel, IntSortedSet> sentinels = new EnumMap<>(Sentinel.class);

    EdgeMap() {
    }

    /**
     * Get the canonical list of symbol ranges with a non-empty target set. Adjacent ranges never share a target set.
     *
     * @return Ranges in ascending symbol order.
     */
    public List<SymbolRangeMap.Entry<IntSortedSet>> getRanges() {
        return ranges.getRanges(StateSets::unmodifiable);
    }

    /**
     * @return The states reached by consuming the symbol, possibly empty. Must not be modified.
     */
    public IntSortedSet getTargets(final int symbol) {
        return StateSets.unmodifiable(ranges.get(symbol));
    }

    /**
     * @return True if the sentinel has an entry, even if its target set is empty.
     */
    public boolean hasSentinel(@Nonnull final Sentinel sentinel) {
        return sentinels.containsKey(sentinel);
    }

    /**
     * @return The states reached by crossing the sentinel, possibly empty. Must not be modified.
     */
    public IntSortedSet getSentinelTargets(@Nonnull final Sentinel sentinel) {
        IntSortedSet targets = sentinels.get(sentinel);
        return targets == null ? StateSets.unmodifiable(ranges.getEmptyValue()) : StateSets.unmodifiable(targets);
    }

    /**
     * @return The target set of every sentinel that has an entry. Neither the map nor the sets may be modified.
     */
    public Map<Sentinel, IntSortedSet> getSentinels() {
        Map<Sentinel, IntSortedSet> view = new EnumMap<>(Sentinel.class);
        for (Map.Entry<Sentinel, IntSortedSet> entry : sentinels.entrySet()) {
            view.put(entry.getKey(), StateSets.unmodifiable(entry.getValue()));
        }
        return Collections.unmodifiableMap(view);
    }

    /**
     * @return True if neither a symbol nor a sentinel leads anywhere.
     */
    public boolean isEmpty() {
        return ranges.isEmpty() && sentinels.isEmpty();
    }

    SymbolRangeMap<IntSortedSet> rangeMap() {
        return ranges;
    }

    IntSortedSet sentinelAccumulator(final Sentinel sentinel) {
        return sentinels.computeIfAbsent(sentinel, s -> new IntAVLTreeSet());
    }

    @Override
    public String toString() {
        return "EdgeMap{ranges=" + ranges + ", sentinels=" + sentinels + "}";
    }
}
