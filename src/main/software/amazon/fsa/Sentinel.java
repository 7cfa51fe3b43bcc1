package software.amazon.fsa;

/**
 * Sentinel symbols model zero-width regular expression anchors. They never occur in the input; a matcher injects them
 * where the corresponding anchor condition holds. Declaration order is the order in which satisfied anchors are
 * applied.
 */
public enum Sentinel {
    BEGINNING_OF_LINE,  // at input start or right after a newline
    END_OF_LINE,        // at input end or right before a newline
    BEGINNING_OF_WORD,  // next symbol is a word symbol, previous is not
    END_OF_WORD,        // previous symbol is a word symbol, next is not
}
