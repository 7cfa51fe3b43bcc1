package software.amazon.fsa.range;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.BiPredicate;
import java.util.function.UnaryOperator;

/**
 * Maps ranges of symbols to values and keeps them in a canonical form. Ranges are disjoint and ordered, and two
 * ranges that are adjacent (no symbol in between) never carry equal values; they are merged into one wider range.
 * Symbols whose value equals the empty value are not stored at all.
 *
 * Stored values are never modified in place. {@link #update} hands the caller's operation a private copy and stores
 * it only if the operation reports a change, so a value instance may safely be shared by several ranges after a split.
 * Values returned by {@link #get} and {@link #getRanges} must not be modified by the caller.
 *
 * @param <V> The value type. Must implement equals.
 */
@NotThreadSafe
public class SymbolRangeMap<V> {

    /**
     * An operation on the value of a sub-range.
     *
     * @param <V> The value type.
     */
    @FunctionalInterface
    public interface Update<V> {

        /**
         * Modify the value in place.
         *
         * @param value A private copy of the current value of a sub-range.
         * @return True if and only if the value was changed.
         */
        boolean apply(V value);
    }

    /*
     * Keyed by the first symbol of each range. The value holds the last symbol and the associated value.
     */
    private final NavigableMap<Integer, Entry<V>> map = new TreeMap<>();
    private final V emptyValue;
    private final UnaryOperator<V> copyFunction;

    /**
     * @param emptyValue The value of every symbol that has never been updated. Must not be modified afterwards.
     * @param copyFunction Produces an independent copy of a value.
     */
    public SymbolRangeMap(@Nonnull final V emptyValue, @Nonnull final UnaryOperator<V> copyFunction) {
        this.emptyValue = Objects.requireNonNull(emptyValue, "emptyValue");
        this.copyFunction = Objects.requireNonNull(copyFunction, "copyFunction");
    }

    /**
     * Perform an operation on the value of every symbol in {@code [first, last]}. Existing ranges that straddle either
     * boundary are split first, the operation runs once per resulting sub-range (including uncovered gaps, which start
     * out with the empty value), and adjacent ranges that end up with equal values are merged.
     *
     * @param first The first symbol in the range to update.
     * @param last The last symbol (inclusive) in the range to update.
     * @param update The operation to carry out.
     * @throws IllegalArgumentException if {@code last < first}
     */
    public void update(final int first, final int last, @Nonnull final Update<V> update) {
        apply(first, last, value -> {
            V copy = copyFunction.apply(value);
            return update.apply(copy) ? copy : value;
        });
    }

    /**
     * Set the value of every symbol in {@code [first, last]}.
     *
     * @param first The first symbol in the range.
     * @param last The last symbol (inclusive) in the range.
     * @param value The value to associate with the range.
     * @throws IllegalArgumentException if {@code last < first}
     */
    public void assign(final int first, final int last, @Nonnull final V value) {
        Objects.requireNonNull(value, "value");
        apply(first, last, current -> current.equals(value) ? current : value);
    }

    /**
     * Core of update and assign. The transform returns its argument unchanged (same instance) to signal that nothing
     * changed, or a new value to store.
     */
    private void apply(final int first, final int last, final UnaryOperator<V> transform) {
        SymbolRange.ensureValidRange(first, last);

        splitAt(first);
        if (last != Integer.MAX_VALUE) {
            splitAt(last + 1);
        }

        long cursor = first;
        List<Entry<V>> covered = new ArrayList<>(map.subMap(first, true, last, true).values());
        for (Entry<V> entry : covered) {
            if (cursor < entry.first) {
                fillGap((int) cursor, entry.first - 1, transform);
            }
            entry.value = transform.apply(entry.value);
            cursor = (long) entry.last + 1;
        }
        if (cursor <= last) {
            fillGap((int) cursor, last, transform);
        }

        normalize(first, last);
    }

    /**
     * Make sure no stored range straddles the boundary between {@code symbol - 1} and {@code symbol}.
     */
    private void splitAt(final int symbol) {
        Map.Entry<Integer, Entry<V>> floor = map.floorEntry(symbol);
        if (floor == null) {
            return;
        }
        Entry<V> entry = floor.getValue();
        if (entry.first < symbol && symbol <= entry.last) {
            map.put(symbol, new Entry<>(symbol, entry.last, entry.value));
            entry.last = symbol - 1;
        }
    }

    private void fillGap(final int first, final int last, final UnaryOperator<V> transform) {
        V value = transform.apply(emptyValue);
        if (value != emptyValue && !value.equals(emptyValue)) {
            map.put(first, new Entry<>(first, last, value));
        }
    }

    /**
     * Restore the canonical form in and around {@code [first, last]}: drop ranges holding the empty value and merge
     * adjacent ranges holding equal values.
     */
    private void normalize(final int first, final int last) {
        Integer from = map.lowerKey(first);
        if (from == null) {
            from = map.ceilingKey(first);
            if (from == null) {
                return;
            }
        }

        Entry<V> previous = null;
        Iterator<Entry<V>> iterator = map.tailMap(from, true).values().iterator();
        while (iterator.hasNext()) {
            Entry<V> entry = iterator.next();
            if ((long) entry.first > (long) last + 1) {
                break;
            }
            if (entry.value.equals(emptyValue)) {
                iterator.remove();
                continue;
            }
            if (previous != null && (long) previous.last + 1 == entry.first && previous.value.equals(entry.value)) {
                previous.last = entry.last;
                iterator.remove();
                continue;
            }
            previous = entry;
        }
    }

    /**
     * Get the value associated with a symbol.
     *
     * @param symbol The symbol.
     * @return The associated value, or the empty value if the symbol lies in no stored range.
     */
    public V get(final int symbol) {
        Entry<V> entry = find(symbol);
        return entry == null ? emptyValue : entry.value;
    }

    private Entry<V> find(final int symbol) {
        Map.Entry<Integer, Entry<V>> floor = map.floorEntry(symbol);
        if (floor == null || floor.getValue().last < symbol) {
            return null;
        }
        return floor.getValue();
    }

    /**
     * Get the stored ranges in ascending order. The list is a snapshot; later updates are not reflected in it.
     *
     * @return The canonical range list.
     */
    public List<Entry<V>> getRanges() {
        return getRanges(UnaryOperator.identity());
    }

    /**
     * Get the stored ranges in ascending order, with each value passed through a view function, typically one that
     * wraps it in a read-only view.
     *
     * @param view Maps a stored value to the value to report. Must preserve equality.
     * @return The canonical range list.
     */
    public List<Entry<V>> getRanges(@Nonnull final UnaryOperator<V> view) {
        List<Entry<V>> ranges = new ArrayList<>(map.size());
        for (Entry<V> entry : map.values()) {
            ranges.add(new Entry<>(entry.first, entry.last, view.apply(entry.value)));
        }
        return Collections.unmodifiableList(ranges);
    }

    public V getEmptyValue() {
        return emptyValue;
    }

    public int size() {
        return map.size();
    }

    public boolean isEmpty() {
        return map.isEmpty();
    }

    public void clear() {
        map.clear();
    }

    /**
     * Compare this map to another one symbol by symbol. Wherever a symbol is stored in only one of the maps, the
     * default value stands in for the missing one. Symbols stored in neither map are not compared. The comparison
     * function is invoked once for each sub-range that is homogeneous in both maps.
     *
     * @param other The map to compare against.
     * @param defaultValue Stand-in for a symbol missing from one of the maps.
     * @param comparison Returns true if a value of this map and a value of the other map are to be considered equal.
     * @return True if the comparison held for every sub-range.
     */
    public boolean compare(@Nonnull final SymbolRangeMap<V> other, final V defaultValue,
                           @Nonnull final BiPredicate<? super V, ? super V> comparison) {
        TreeSet<Long> boundaries = new TreeSet<>();
        collectBoundaries(boundaries);
        other.collectBoundaries(boundaries);

        for (long boundary : boundaries) {
            if (boundary > Integer.MAX_VALUE) {
                break;
            }
            Entry<V> mine = find((int) boundary);
            Entry<V> theirs = other.find((int) boundary);
            if (mine == null && theirs == null) {
                continue;
            }
            V left = mine == null ? defaultValue : mine.value;
            V right = theirs == null ? defaultValue : theirs.value;
            if (!comparison.test(left, right)) {
                return false;
            }
        }
        return true;
    }

    private void collectBoundaries(final TreeSet<Long> boundaries) {
        for (Entry<V> entry : map.values()) {
            boundaries.add((long) entry.first);
            boundaries.add((long) entry.last + 1);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        SymbolRangeMap<?> other = (SymbolRangeMap<?>) o;
        return emptyValue.equals(other.emptyValue) && getRanges().equals(other.getRanges());
    }

    @Override
    public int hashCode() {
        return 31 * emptyValue.hashCode() + getRanges().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry<V> entry : map.values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(entry);
        }
        return sb.toString();
    }

    /**
     * One stored range and its value.
     *
     * @param <V> The value type.
     */
    public static final class Entry<V> {
        private final int first;
        private int last;
        private V value;

        private Entry(final int first, final int last, final V value) {
            this.first = first;
            this.last = last;
            this.value = value;
        }

        public int getFirst() {
            return first;
        }

        public int getLast() {
            return last;
        }

        public SymbolRange getRange() {
            return SymbolRange.of(first, last);
        }

        public V getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || !o.getClass().equals(getClass())) {
                return false;
            }
            Entry<?> entry = (Entry<?>) o;
            return first == entry.first && last == entry.last && value.equals(entry.value);
        }

        @Override
        public int hashCode() {
            int result = first;
            result = 31 * result + last;
            result = 31 * result + value.hashCode();
            return result;
        }

        @Override
        public String toString() {
            return "[" + first + "," + last + "]->" + value;
        }
    }
}
