package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.EnumSet;
import java.util.Objects;

/**
 * Runs an {@link Nfa} directly against an input by walking sets of states, the way a subset construction would but
 * without materializing a deterministic automaton. Each UTF-16 code unit of the input is one symbol, so a character
 * outside the BMP is two symbols. Word anchors are judged on whole code points, though.
 *
 * At every position the satisfied anchors are crossed before the next symbol is consumed, repeatedly until the state
 * set stops growing. Because every state implicitly loops on every sentinel, crossing an anchor never loses a state.
 */
@NotThreadSafe
public class NfaSimulator {

    private static final Logger logger = LoggerFactory.getLogger(NfaSimulator.class);

    private final Nfa nfa;
    private final TransitionMapBuilder builder;

    public NfaSimulator(@Nonnull final Nfa nfa) {
        this.nfa = Objects.requireNonNull(nfa, "nfa");
        this.builder = new TransitionMapBuilder(nfa,
                TransitionMapConfiguration.builder().withImplicitSentinelLoops(true).build());
    }

    /**
     * Match the whole input from the first registered start state.
     *
     * @return The token id chosen among the states reached at the end of the input, or {@link Constants#NO_TOKEN} if
     * the input is rejected or the automaton has no start state.
     */
    public int match(@Nonnull final CharSequence input) {
        return match(input, Constants.NO_STATE);
    }

    /**
     * Match the whole input from the given state.
     *
     * @param input The input.
     * @param startState The state to start from, or {@link Constants#NO_STATE} for the first registered start state.
     * @return The token id chosen among the states reached at the end of the input, or {@link Constants#NO_TOKEN} if
     * the input is rejected.
     */
    public int match(@Nonnull final CharSequence input, final int startState) {
        int start = resolveStartState(startState);
        if (start == Constants.NO_STATE) {
            return Constants.NO_TOKEN;
        }

        IntSortedSet current = builder.closure(start);
        for (int i = 0; ; i++) {
            current = crossAnchors(current, input, i);
            if (i == input.length()) {
                break;
            }
            current = step(current, input.charAt(i));
            if (current.isEmpty()) {
                logger.debug("Input rejected at offset {}", i);
                return Constants.NO_TOKEN;
            }
        }
        return TokenResolver.chooseTokenId(nfa, current);
    }

    /**
     * Create a matcher that tokenizes the input by repeated longest-prefix matches.
     */
    public Matcher matcher(@Nonnull final CharSequence input) {
        return new Matcher(Objects.requireNonNull(input, "input"));
    }

    private int resolveStartState(final int startState) {
        if (startState != Constants.NO_STATE) {
            nfa.checkState(startState);
            return startState;
        }
        if (nfa.getStartStateRegistrySize() == 0) {
            return Constants.NO_STATE;
        }
        return nfa.getStartState(0);
    }

    private IntSortedSet crossAnchors(IntSortedSet current, final CharSequence input, final int position) {
        EnumSet<Sentinel> satisfied = Anchors.satisfiedAt(input, position);
        if (satisfied.isEmpty()) {
            return current;
        }
        while (true) {
            EdgeMap edgeMap = builder.buildEdgeMap(current);
            IntSortedSet next = StateSets.copyOf(current);
            for (Sentinel sentinel : satisfied) {
                StateSets.union(edgeMap.getSentinelTargets(sentinel), next);
            }
            if (next.size() == current.size()) {
                return current;
            }
            current = next;
        }
    }

    private IntSortedSet step(final IntSortedSet current, final int symbol) {
        return StateSets.copyOf(builder.buildEdgeMap(current).getTargets(symbol));
    }

    /**
     * Tokenizes one input. Anchor conditions are judged against the whole input, so the beginning-of-line anchor
     * holds only at offset zero and after newlines, wherever the previous match ended.
     */
    @NotThreadSafe
    public final class Matcher {

        private final CharSequence input;
        private int position = 0;

        private Matcher(final CharSequence input) {
            this.input = input;
        }

        /**
         * Match the longest prefix of the remaining input from the first registered start state.
         *
         * @see #match(int)
         */
        public int match() {
            return match(Constants.NO_STATE);
        }

        /**
         * Match the longest prefix of the remaining input and move past it. An accepted empty prefix is a match that
         * does not advance the position.
         *
         * @param startState The state to start from, or {@link Constants#NO_STATE} for the first registered start
         *                   state.
         * @return The token id of the longest accepted prefix, or {@link Constants#NO_TOKEN} if no prefix is accepted,
         * in which case the position is left unchanged.
         */
        public int match(final int startState) {
            int start = resolveStartState(startState);
            if (start == Constants.NO_STATE) {
                return Constants.NO_TOKEN;
            }

            int bestToken = Constants.NO_TOKEN;
            int bestEnd = -1;
            IntSortedSet current = builder.closure(start);
            for (int i = position; ; i++) {
                current = crossAnchors(current, input, i);
                int token = TokenResolver.chooseTokenId(nfa, current);
                if (token != Constants.NO_TOKEN) {
                    bestToken = token;
                    bestEnd = i;
                }
                if (i == input.length()) {
                    break;
                }
                current = step(current, input.charAt(i));
                if (current.isEmpty()) {
                    break;
                }
            }

            if (bestEnd >= 0) {
                position = bestEnd;
            }
            return bestToken;
        }

        public int position() {
            return position;
        }

        public boolean atEnd() {
            return position == input.length();
        }
    }
}
