package software.amazon.fsa;

import java.util.EnumSet;

/**
 * Decides which anchor conditions hold at a position in an input, taking the input as a complete text.
 */
final class Anchors {

    private Anchors() { }

    /**
     * @param input The complete input.
     * @param position Offset between two symbols, from 0 to {@code input.length()} inclusive.
     * @return The sentinels whose anchor condition holds at the position.
     */
    static EnumSet<Sentinel> satisfiedAt(final CharSequence input, final int position) {
        EnumSet<Sentinel> satisfied = EnumSet.noneOf(Sentinel.class);
        boolean atStart = position == 0;
        boolean atEnd = position == input.length();

        if (atStart || input.charAt(position - 1) == '\n') {
            satisfied.add(Sentinel.BEGINNING_OF_LINE);
        }
        if (atEnd || input.charAt(position) == '\n') {
            satisfied.add(Sentinel.END_OF_LINE);
        }

        // Code points, so that a letter outside the BMP counts as a word symbol. Between the two halves of a
        // surrogate pair neither side is a word symbol.
        boolean wordBefore = !atStart && isWordSymbol(Character.codePointBefore(input, position));
        boolean wordAfter = !atEnd && isWordSymbol(Character.codePointAt(input, position));
        if (wordAfter && !wordBefore) {
            satisfied.add(Sentinel.BEGINNING_OF_WORD);
        }
        if (wordBefore && !wordAfter) {
            satisfied.add(Sentinel.END_OF_WORD);
        }
        return satisfied;
    }

    static boolean isWordSymbol(final int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }
}
