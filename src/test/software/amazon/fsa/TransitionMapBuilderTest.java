package software.amazon.fsa;

import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import org.junit.Before;
import org.junit.Test;
import software.amazon.fsa.range.SymbolRangeMap;

import java.util.EnumSet;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static software.amazon.fsa.StateSets.of;

public class TransitionMapBuilderTest {

    private Nfa nfa;
    private TransitionMapBuilder builder;

    @Before
    public void setUp() {
        nfa = new Nfa();
        builder = new TransitionMapBuilder(nfa);
    }

    @Test
    public void testDefaultConfigurationLeavesOutImplicitSentinelLoops() {
        assertFalse(builder.getConfiguration().isImplicitSentinelLoops());
    }

    @Test
    public void testClosedAddFollowsEpsilonEdges() {
        addStates(5);
        nfa.addEpsilonEdge(0, 1);
        nfa.addEpsilonEdge(1, 2);
        nfa.addEpsilonEdge(0, 3);
        nfa.addEdge(3, 4, 'a');

        IntSortedSet set = StateSets.newStateSet();
        assertTrue(builder.closedAdd(0, set));
        assertEquals(of(0, 1, 2, 3), set);
    }

    @Test
    public void testClosedAddOfPresentSeedIsNoOp() {
        addStates(3);
        nfa.addEpsilonEdge(0, 1);

        IntSortedSet set = of(0);
        assertFalse(builder.closedAdd(0, set));
        // not expanded, since the seed was already there
        assertEquals(of(0), set);
    }

    @Test
    public void testClosureIsIdempotent() {
        addStates(6);
        nfa.addEpsilonEdge(0, 1);
        nfa.addEpsilonEdge(1, 2);
        nfa.addEpsilonEdge(2, 0);
        nfa.addEpsilonEdge(2, 3);
        nfa.addEpsilonEdge(4, 5);

        IntSortedSet closure = builder.closure(0);
        assertEquals(of(0, 1, 2, 3), closure);
        for (IntIterator i = StateSets.copyOf(closure).iterator(); i.hasNext(); ) {
            assertFalse(builder.closedAdd(i.nextInt(), closure));
        }
        assertEquals(of(0, 1, 2, 3), closure);
    }

    @Test
    public void testDeepEpsilonChain() {
        int length = 200_000;
        addStates(length);
        for (int i = 0; i + 1 < length; i++) {
            nfa.addEpsilonEdge(i, i + 1);
        }
        nfa.addEpsilonEdge(length - 1, 0);

        assertEquals(length, builder.closure(0).size());
    }

    @Test
    public void testClosureOfSeveralSeeds() {
        addStates(4);
        nfa.addEpsilonEdge(0, 1);
        nfa.addEpsilonEdge(2, 3);
        assertEquals(of(0, 1, 2, 3), builder.closure(of(0, 2)));
    }

    @Test
    public void testUnknownSeedIsDetected() {
        addStates(1);
        try {
            builder.closedAdd(1, StateSets.newStateSet());
            fail("Expected IndexOutOfBoundsException");
        } catch (IndexOutOfBoundsException e) {
            // expected
        }
    }

    @Test
    public void testEdgeMapMergesOverlappingRanges() {
        addStates(4);
        nfa.addEdgeRange(0, 1, 'a', 'm');
        nfa.addEdgeRange(0, 2, 'h', 'z');
        nfa.addEpsilonEdge(2, 3);

        EdgeMap edgeMap = builder.buildEdgeMap(of(0));

        List<SymbolRangeMap.Entry<IntSortedSet>> ranges = edgeMap.getRanges();
        assertEquals(3, ranges.size());
        verifyEntry(ranges.get(0), 'a', 'g', 1);
        verifyEntry(ranges.get(1), 'h', 'm', 1, 2, 3);
        verifyEntry(ranges.get(2), 'n', 'z', 2, 3);
        assertEquals(of(1, 2, 3), edgeMap.getTargets('k'));
        assertTrue(edgeMap.getTargets('A').isEmpty());
        assertTrue(edgeMap.getSentinels().isEmpty());
    }

    @Test
    public void testEdgeMapCombinesEdgesOfAllMembers() {
        addStates(4);
        nfa.addEdge(0, 2, 'a');
        nfa.addEdge(1, 3, 'a');
        nfa.addEdge(1, 3, 'b');
        nfa.addEdge(1, 3, 'c');

        EdgeMap edgeMap = builder.buildEdgeMap(of(0, 1));

        List<SymbolRangeMap.Entry<IntSortedSet>> ranges = edgeMap.getRanges();
        assertEquals(2, ranges.size());
        verifyEntry(ranges.get(0), 'a', 'a', 2, 3);
        verifyEntry(ranges.get(1), 'b', 'c', 3);
    }

    @Test
    public void testDuplicateEdgesChangeNothing() {
        addStates(2);
        nfa.addEdgeRange(0, 1, 'a', 'c');
        EdgeMap once = builder.buildEdgeMap(of(0));
        nfa.addEdgeRange(0, 1, 'a', 'c');
        nfa.addEdge(0, 1, 'b');
        EdgeMap twice = builder.buildEdgeMap(of(0));

        assertEquals(once.getRanges(), twice.getRanges());
    }

    @Test
    public void testEdgeMapOfStateWithoutEdgesIsEmpty() {
        addStates(1);
        assertTrue(builder.buildEdgeMap(of(0)).isEmpty());
        assertTrue(builder.buildEdgeMap(StateSets.newStateSet()).isEmpty());
    }

    @Test
    public void testSentinelsRecordOnlyExplicitEdgesByDefault() {
        addStates(3);
        nfa.addSentinelEdge(0, 1, Sentinel.BEGINNING_OF_LINE);
        nfa.addEpsilonEdge(1, 2);

        EdgeMap edgeMap = builder.buildEdgeMap(of(0));

        assertTrue(edgeMap.hasSentinel(Sentinel.BEGINNING_OF_LINE));
        assertEquals(of(1, 2), edgeMap.getSentinelTargets(Sentinel.BEGINNING_OF_LINE));
        assertFalse(edgeMap.hasSentinel(Sentinel.END_OF_LINE));
        assertTrue(edgeMap.getSentinelTargets(Sentinel.END_OF_LINE).isEmpty());
        assertEquals(EnumSet.of(Sentinel.BEGINNING_OF_LINE), edgeMap.getSentinels().keySet());
    }

    @Test
    public void testImplicitSentinelLoopsAddTheSourceSet() {
        addStates(3);
        nfa.addSentinelEdge(0, 1, Sentinel.BEGINNING_OF_LINE);
        nfa.addEpsilonEdge(1, 2);
        TransitionMapBuilder withLoops = new TransitionMapBuilder(nfa,
                TransitionMapConfiguration.builder().withImplicitSentinelLoops(true).build());

        EdgeMap edgeMap = withLoops.buildEdgeMap(of(0));

        assertEquals(EnumSet.allOf(Sentinel.class), edgeMap.getSentinels().keySet());
        assertEquals(of(0, 1, 2), edgeMap.getSentinelTargets(Sentinel.BEGINNING_OF_LINE));
        assertEquals(of(0), edgeMap.getSentinelTargets(Sentinel.END_OF_LINE));
        assertEquals(of(0), edgeMap.getSentinelTargets(Sentinel.BEGINNING_OF_WORD));
        assertEquals(of(0), edgeMap.getSentinelTargets(Sentinel.END_OF_WORD));
    }

    @Test
    public void testEdgeMapViewsAreReadOnly() {
        addStates(2);
        nfa.addEdge(0, 1, 'a');
        nfa.addSentinelEdge(0, 1, Sentinel.BEGINNING_OF_LINE);
        EdgeMap edgeMap = builder.buildEdgeMap(of(0));
        try {
            edgeMap.getTargets('a').add(0);
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            edgeMap.getRanges().get(0).getValue().add(99);
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            edgeMap.getSentinels().get(Sentinel.BEGINNING_OF_LINE).add(99);
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            edgeMap.getSentinels().remove(Sentinel.BEGINNING_OF_LINE);
            fail("Expected UnsupportedOperationException");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        assertEquals(of(1), edgeMap.getTargets('a'));
        assertEquals(of(1), edgeMap.getSentinelTargets(Sentinel.BEGINNING_OF_LINE));
        assertTrue(edgeMap.hasSentinel(Sentinel.BEGINNING_OF_LINE));
    }

    private void addStates(int count) {
        for (int i = 0; i < count; i++) {
            nfa.addState();
        }
    }

    private static void verifyEntry(SymbolRangeMap.Entry<IntSortedSet> entry, int first, int last, int... states) {
        assertEquals(first, entry.getFirst());
        assertEquals(last, entry.getLast());
        assertEquals(of(states), entry.getValue());
    }
}
