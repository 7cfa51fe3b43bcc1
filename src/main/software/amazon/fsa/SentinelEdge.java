package software.amazon.fsa;

import javax.annotation.concurrent.Immutable;

/**
 * A transition on a sentinel symbol.
 */
@Immutable
public final class SentinelEdge {

    private final Sentinel sentinel;
    private final int targetState;

    SentinelEdge(final Sentinel sentinel, final int targetState) {
        this.sentinel = sentinel;
        this.targetState = targetState;
    }

    public Sentinel getSentinel() {
        return sentinel;
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
        SentinelEdge edge = (SentinelEdge) o;
        return targetState == edge.targetState && sentinel == edge.sentinel;
    }

    @Override
    public int hashCode() {
        return 31 * sentinel.hashCode() + targetState;
    }

    @Override
    public String toString() {
        return sentinel + "->" + targetState;
    }
}
