package software.amazon.fsa.range;

import javax.annotation.concurrent.Immutable;

/**
 * An inclusive range of input symbols {@code [first, last]}. A symbol is any int value, so the same range type serves
 * bytes, UTF-16 code units and code points.
 */
@Immutable
public final class SymbolRange implements Comparable<SymbolRange> {

    private final int first;
    private final int last;

    private SymbolRange(final int first, final int last) {
        this.first = first;
        this.last = last;
    }

    /**
     * Create the range {@code [first, last]}.
     *
     * @param first The lowest symbol in the range.
     * @param last The highest symbol in the range.
     * @return The range.
     * @throws IllegalArgumentException if {@code last < first}
     */
    public static SymbolRange of(final int first, final int last) {
        ensureValidRange(first, last);
        return new SymbolRange(first, last);
    }

    public static SymbolRange single(final int symbol) {
        return new SymbolRange(symbol, symbol);
    }

    /**
     * Fail fast on an inverted range. The bounds are never swapped silently.
     *
     * @param first The lowest symbol in the range.
     * @param last The highest symbol in the range.
     * @throws IllegalArgumentException if {@code last < first}
     */
    public static void ensureValidRange(final int first, final int last) {
        if (last < first) {
            throw new IllegalArgumentException("Illegal symbol range [" + first + ", " + last + "]: last < first");
        }
    }

    public int first() {
        return first;
    }

    public int last() {
        return last;
    }

    public boolean contains(final int symbol) {
        return first <= symbol && symbol <= last;
    }

    /**
     * Number of symbols in this range, as a long since the full int domain holds 2^32 symbols.
     */
    public long size() {
        return (long) last - (long) first + 1;
    }

    @Override
    public int compareTo(final SymbolRange other) {
        int cmp = Integer.compare(first, other.first);
        return cmp != 0 ? cmp : Integer.compare(last, other.last);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        SymbolRange range = (SymbolRange) o;
        return first == range.first && last == range.last;
    }

    @Override
    public int hashCode() {
        return 31 * first + last;
    }

    @Override
    public String toString() {
        return "[" + first + "," + last + "]";
    }
}
