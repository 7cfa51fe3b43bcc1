package software.amazon.fsa;

import software.amazon.fsa.range.SymbolRange;
import software.amazon.fsa.range.SymbolRangeMap;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Thompson-style composition of automaton fragments. Each operation adds states and edges to the underlying automaton
 * and returns the resulting fragment, which the caller feeds to the next operation. The fragments passed in become
 * part of the returned one and must not be reused elsewhere.
 *
 * Nothing here checks that fragments are composed sensibly; building unreachable pieces is allowed.
 */
@NotThreadSafe
public class FragmentBuilder {

    private final Nfa nfa;

    public FragmentBuilder(@Nonnull final Nfa nfa) {
        this.nfa = Objects.requireNonNull(nfa, "nfa");
    }

    public Nfa getNfa() {
        return nfa;
    }

    /**
     * The union of the languages of two fragments.
     */
    public Fragment altern(final Fragment f1, final Fragment f2) {
        int t = nfa.addState();
        int u = nfa.addState();
        nfa.addEpsilonEdge(t, f1.getEntry());
        nfa.addEpsilonEdge(t, f2.getEntry());
        nfa.addEpsilonEdge(f1.getExit(), u);
        nfa.addEpsilonEdge(f2.getExit(), u);
        return new Fragment(t, u);
    }

    /**
     * The concatenation of the languages of two fragments. No states are added.
     */
    public Fragment concat(final Fragment f1, final Fragment f2) {
        nfa.addEpsilonEdge(f1.getExit(), f2.getEntry());
        return new Fragment(f1.getEntry(), f2.getExit());
    }

    /**
     * The positive closure {@code L+} of the language of a fragment. The endpoints stay the same.
     */
    public Fragment repeat(final Fragment f) {
        nfa.addEpsilonEdge(f.getExit(), f.getEntry());
        return f;
    }

    /**
     * The language of a fragment plus the empty string.
     */
    public Fragment optional(final Fragment f) {
        int t = nfa.addState();
        int u = nfa.addState();
        nfa.addEpsilonEdge(t, f.getEntry());
        nfa.addEpsilonEdge(f.getExit(), u);
        nfa.addEpsilonEdge(t, u);
        return new Fragment(t, u);
    }

    /**
     * The Kleene closure {@code L*} of the language of a fragment.
     */
    public Fragment kleene(final Fragment f) {
        return optional(repeat(f));
    }

    /**
     * Bounded repetition. The result recognizes {@code L^n} for every n in {@code [min, max]}, or for every
     * {@code n >= min} when max is zero.
     *
     * A fragment cannot be copied, so the operand is given as a factory that builds a fresh instance of it in this
     * builder's automaton each time it is called. It is called once per repetition needed.
     *
     * @param operand Builds one instance of the repeated fragment.
     * @param min Minimum number of repetitions.
     * @param max Maximum number of repetitions, or zero for no upper bound.
     * @throws IllegalArgumentException if a bound is negative, or max is nonzero and less than min
     */
    public Fragment repeat(@Nonnull final Supplier<Fragment> operand, final int min, final int max) {
        if (min < 0 || max < 0) {
            throw new IllegalArgumentException("Negative repetition bound {" + min + "," + max + "}");
        }
        if (max != 0 && max < min) {
            throw new IllegalArgumentException("Bad repetition range {" + min + "," + max + "}");
        }

        if (min == 0 && max == 0) {
            return kleene(operand.get());
        }

        // Required copies in order, then the tail: a positive closure on the last copy when unbounded, otherwise
        // max - min nested optional copies, {0,k} = optional(operand then {0,k-1}).
        Fragment chain = null;
        for (int i = 0; i < min; i++) {
            Fragment f = operand.get();
            if (max == 0 && i == min - 1) {
                f = repeat(f);
            }
            chain = chain == null ? f : concat(chain, f);
        }
        if (max == 0 || max == min) {
            return chain;
        }

        List<Fragment> optionals = new ArrayList<>(max - min);
        for (int i = min; i < max; i++) {
            optionals.add(operand.get());
        }
        Fragment tail = optional(optionals.get(optionals.size() - 1));
        for (int i = optionals.size() - 2; i >= 0; i--) {
            tail = optional(concat(optionals.get(i), tail));
        }
        return chain == null ? tail : concat(chain, tail);
    }

    /**
     * A fragment recognizing exactly the given symbol sequence. An empty sequence yields a single state that is both
     * entry and exit and recognizes only the empty string.
     */
    public Fragment string(@Nonnull final int... symbols) {
        int t = nfa.addState();
        int u = t;
        for (int symbol : symbols) {
            int v = nfa.addState();
            nfa.addEdge(u, v, symbol);
            u = v;
        }
        return new Fragment(t, u);
    }

    /**
     * A fragment recognizing exactly the given string, taking each UTF-16 code unit as one symbol.
     */
    public Fragment string(@Nonnull final CharSequence s) {
        int[] symbols = new int[s.length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = s.charAt(i);
        }
        return string(symbols);
    }

    /**
     * A fragment recognizing every one-symbol string whose symbol falls in one of the ranges. With no ranges it
     * recognizes nothing at all, not even the empty string.
     */
    public Fragment ranges(@Nonnull final Iterable<SymbolRange> ranges) {
        int t = nfa.addState();
        int u = nfa.addState();
        for (SymbolRange range : ranges) {
            nfa.addEdgeRange(t, u, range);
        }
        return new Fragment(t, u);
    }

    public Fragment ranges(@Nonnull final SymbolRange... ranges) {
        return ranges(Arrays.asList(ranges));
    }

    /**
     * A symbol class. The listed ranges may overlap and come in any order; they are normalized first, so the
     * resulting fragment has one edge per maximal range. When inverted, the class is every symbol of the alphabet
     * that is not listed.
     *
     * @param ranges The listed ranges.
     * @param inverted Whether to take the complement of the listed ranges.
     * @param alphabet The complete symbol range, used only when inverted.
     */
    public Fragment bracket(@Nonnull final Iterable<SymbolRange> ranges, final boolean inverted,
                            @Nonnull final SymbolRange alphabet) {
        SymbolRangeMap<Boolean> classMap = new SymbolRangeMap<>(Boolean.FALSE, b -> b);
        if (inverted) {
            classMap.assign(alphabet.first(), alphabet.last(), Boolean.TRUE);
        }
        Boolean value = !inverted;
        for (SymbolRange range : ranges) {
            classMap.assign(range.first(), range.last(), value);
        }

        List<SymbolRange> canonical = new ArrayList<>();
        for (SymbolRangeMap.Entry<Boolean> entry : classMap.getRanges()) {
            if (entry.getValue()) {
                canonical.add(entry.getRange());
            }
        }
        return ranges(canonical);
    }

    /**
     * A fragment recognizing the empty string, but only where the anchor condition of the sentinel holds.
     */
    public Fragment sentinel(@Nonnull final Sentinel sentinel) {
        int t = nfa.addState();
        int u = nfa.addState();
        nfa.addSentinelEdge(t, u, sentinel);
        return new Fragment(t, u);
    }

    /**
     * Make the exit state of a fragment accepting and register its entry as a new start state. This completes a
     * stand-alone automaton for one pattern.
     *
     * @return The start state registry index.
     */
    public int accept(final Fragment f, final int tokenId) {
        nfa.setTokenId(f.getExit(), tokenId);
        return nfa.registerStartState(f.getEntry());
    }
}
