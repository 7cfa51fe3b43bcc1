package software.amazon.fsa;

/**
 * Configuration for a TransitionMapBuilder.
 */
public class TransitionMapConfiguration {

    /**
     * Every state has an implicit edge to itself on every sentinel symbol: an anchor that is not acted upon leaves the
     * state unchanged. Those edges are never stored, so by default the sentinel part of an edge map holds only what is
     * reachable over explicit sentinel edges, and only for sentinels that have such an edge. By setting this flag to
     * true, the source state set is also added to the target set of every sentinel, which yields the complete
     * sentinel transition function a subset construction needs. Every sentinel then has an entry in the edge map.
     */
    private final boolean implicitSentinelLoops;

    private TransitionMapConfiguration(boolean implicitSentinelLoops) {
        this.implicitSentinelLoops = implicitSentinelLoops;
    }

    public boolean isImplicitSentinelLoops() {
        return implicitSentinelLoops;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TransitionMapConfiguration{implicitSentinelLoops=" + implicitSentinelLoops + "}";
    }

    public static class Builder {

        private boolean implicitSentinelLoops = false;

        public Builder withImplicitSentinelLoops(boolean implicitSentinelLoops) {
            this.implicitSentinelLoops = implicitSentinelLoops;
            return this;
        }

        public TransitionMapConfiguration build() {
            return new TransitionMapConfiguration(implicitSentinelLoops);
        }
    }
}
