package software.amazon.fsa;

/**
 * Reserved token and state ids.
 */
public final class Constants {

    private Constants() {
        throw new UnsupportedOperationException("You can't create instance of utility class.");
    }

    /**
     * Token id of every non-accepting state. Greater than any token id a caller can assign.
     */
    public static final int NO_TOKEN = Integer.MAX_VALUE;

    /**
     * Conventional token id of a state that simply accepts, for automata that need only one kind of match.
     */
    public static final int DEFAULT_TOKEN = 0;

    /**
     * Stands for the absence of a state. Where a start state is expected it selects the first registered one.
     */
    public static final int NO_STATE = -1;

    static int checkTokenId(final int tokenId) {
        if (tokenId < 0) {
            throw new IllegalArgumentException("Token id must not be negative: " + tokenId);
        }
        return tokenId;
    }
}
