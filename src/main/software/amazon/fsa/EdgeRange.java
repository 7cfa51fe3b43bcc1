package software.amazon.fsa;

import software.amazon.fsa.range.SymbolRange;

import javax.annotation.concurrent.Immutable;

/**
 * An ordinary edge: consuming any symbol in the range leads to the target state.
 */
@Immutable
public final class EdgeRange {

    private final SymbolRange range;
    private final int targetState;

    EdgeRange(final SymbolRange range, final int targetState) {
        this.range = range;
        this.targetState = targetState;
    }

    public SymbolRange getRange() {
        return range;
    }

    public int getTargetState() {
        return targetState;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || !o.getClass().equals(getClass())) {
            return false;
        }
        EdgeRange edge = (EdgeRange) o;
        return targetState == edge.targetState && range.equals(edge.range);
    }

    @Override
    public int hashCode() {
        return 31 * range.hashCode() + targetState;
    }

    @Override
    public String toString() {
        return range + "->" + targetState;
    }
}
