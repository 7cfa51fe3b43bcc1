package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;

/**
 * Helpers for sets of state ids. State sets are sorted so that iteration order, equality and hash codes depend only
 * on the members, which lets a subset construction use them as keys.
 */
public final class StateSets {

    private StateSets() { }

    public static IntSortedSet newStateSet() {
        return new IntAVLTreeSet();
    }

    public static IntSortedSet of(final int... states) {
        return new IntAVLTreeSet(states);
    }

    public static IntSortedSet copyOf(final IntSortedSet states) {
        return new IntAVLTreeSet(states);
    }

    public static IntSortedSet unmodifiable(final IntSortedSet states) {
        return IntSortedSets.unmodifiable(states);
    }

    /**
     * Add every element of one set to another.
     *
     * @param from Elements to add.
     * @param addTo Set to add them to.
     * @return True if addTo changed.
     */
    public static boolean union(final IntSortedSet from, final IntSortedSet addTo) {
        return addTo.addAll(from);
    }
}
