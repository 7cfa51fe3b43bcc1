package software.amazon.fsa;

import org.junit.Test;
import software.amazon.fsa.range.SymbolRange;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class NfaJsonTest {

    @Test
    public void testWriteTinyAutomaton() {
        Nfa nfa = new Nfa();
        nfa.addState();
        nfa.addState(Constants.DEFAULT_TOKEN);
        nfa.addEdge(0, 1, 'a');
        nfa.registerStartState(0);

        assertEquals("{\"startStates\":[0],\"states\":[{\"id\":0,\"ranges\":[[97,97,1]]},{\"id\":1,\"token\":0}]}",
                NfaJson.toJson(nfa));
    }

    @Test
    public void testReadBackPreservesStructureAndLanguage() {
        Nfa nfa = new Nfa();
        FragmentBuilder builder = new FragmentBuilder(nfa);
        builder.accept(builder.concat(builder.sentinel(Sentinel.BEGINNING_OF_WORD),
                builder.repeat(builder.ranges(SymbolRange.of('a', 'z'), SymbolRange.of('0', '9')))), 1);
        builder.accept(builder.optional(builder.string("if")), 2);

        String json = NfaJson.toJson(nfa);
        Nfa copy = NfaJson.fromJson(json);

        assertEquals(json, NfaJson.toJson(copy));
        assertEquals(nfa.toString(), copy.toString());
        assertEquals(nfa.getStartStates(), copy.getStartStates());

        NfaSimulator simulator = new NfaSimulator(copy);
        assertEquals(1, simulator.match("abc1"));
        assertEquals(2, simulator.match("if", copy.getStartState(1)));
    }

    @Test
    public void testReadEmptyAutomaton() {
        Nfa nfa = NfaJson.fromJson("{\"startStates\":[],\"states\":[]}");
        assertEquals(0, nfa.getNumberOfStates());
        assertEquals(0, nfa.getStartStateRegistrySize());
    }

    @Test
    public void testMalformedSnapshots() {
        verifyRejected("not json");
        verifyRejected("{}");
        verifyRejected("{\"states\":[]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":1}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":\"zero\"}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":0,\"token\":-2}]}");
        verifyRejected("{\"startStates\":[0],\"states\":[{\"id\":0,\"epsilon\":[3]}]}");
        verifyRejected("{\"startStates\":[2],\"states\":[{\"id\":0}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":0,\"sentinels\":[[\"NOWHERE\",0]]}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":0,\"ranges\":[[98,97,0]]}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":0,\"ranges\":[[97,0]]}]}");
        verifyRejected("{\"startStates\":[],\"states\":[{\"id\":0,\"epsilon\":0}]}");
    }

    private static void verifyRejected(String json) {
        try {
            NfaJson.fromJson(json);
            fail("Expected IllegalArgumentException for " + json);
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
