package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntIterator;

import javax.annotation.Nonnull;

/**
 * Picks the token to report for a set of simultaneously reachable states. When several accepting states are reachable,
 * the numerically highest token id wins, so callers give higher ids to rules with higher priority.
 */
public final class TokenResolver {

    private TokenResolver() { }

    /**
     * @param nfa The automaton the states belong to.
     * @param stateSet The states to consider.
     * @return The highest token id among the accepting states of the set, or {@link Constants#NO_TOKEN} if none of
     * them accepts.
     */
    public static int chooseTokenId(@Nonnull final Nfa nfa, @Nonnull final IntCollection stateSet) {
        int token = Constants.NO_TOKEN;
        for (IntIterator i = stateSet.iterator(); i.hasNext(); ) {
            int candidate = nfa.stateAt(i.nextInt()).getTokenId();
            if (candidate != Constants.NO_TOKEN && (token == Constants.NO_TOKEN || token < candidate)) {
                token = candidate;
            }
        }
        return token;
    }
}
