package software.amazon.fsa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import it.unimi.dsi.fastutil.ints.IntList;

import javax.annotation.Nonnull;

/**
 * Writes an automaton as a JSON snapshot and reads one back, for debugging and for tests. This is not a stable
 * interchange format.
 *
 * <pre>
 * {
 *   "startStates": [ 0 ],
 *   "states": [
 *     { "id": 0, "ranges": [ [ 97, 122, 1 ] ], "sentinels": [ [ "BEGINNING_OF_LINE", 2 ] ], "epsilon": [ 3 ] },
 *     { "id": 1, "token": 7 }
 *   ]
 * }
 * </pre>
 *
 * A state without "token" is non-accepting. Empty edge lists are left out.
 */
public final class NfaJson {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final String START_STATES = "startStates";
    private static final String STATES = "states";
    private static final String ID = "id";
    private static final String TOKEN = "token";
    private static final String RANGES = "ranges";
    private static final String SENTINELS = "sentinels";
    private static final String EPSILON = "epsilon";

    private NfaJson() { }

    public static String toJson(@Nonnull final Nfa nfa) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toTree(nfa));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write automaton snapshot", e);
        }
    }

    public static ObjectNode toTree(@Nonnull final Nfa nfa) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        ArrayNode starts = root.putArray(START_STATES);
        IntList startStates = nfa.getStartStates();
        for (int i = 0; i < startStates.size(); i++) {
            starts.add(startStates.getInt(i));
        }

        ArrayNode states = root.putArray(STATES);
        for (NfaState state : nfa.getStates()) {
            ObjectNode node = states.addObject();
            node.put(ID, state.getId());
            if (state.isAccepting()) {
                node.put(TOKEN, state.getTokenId());
            }
            if (!state.getEdgeRanges().isEmpty()) {
                ArrayNode ranges = node.putArray(RANGES);
                for (EdgeRange edge : state.getEdgeRanges()) {
                    ranges.addArray()
                            .add(edge.getRange().first())
                            .add(edge.getRange().last())
                            .add(edge.getTargetState());
                }
            }
            if (!state.getSentinelEdges().isEmpty()) {
                ArrayNode sentinels = node.putArray(SENTINELS);
                for (SentinelEdge edge : state.getSentinelEdges()) {
                    sentinels.addArray().add(edge.getSentinel().name()).add(edge.getTargetState());
                }
            }
            IntList epsilon = state.getEpsilonEdges();
            if (!epsilon.isEmpty()) {
                ArrayNode targets = node.putArray(EPSILON);
                for (int i = 0; i < epsilon.size(); i++) {
                    targets.add(epsilon.getInt(i));
                }
            }
        }
        return root;
    }

    /**
     * Rebuild an automaton from a snapshot. State ids are preserved.
     *
     * @param json A snapshot as written by {@link #toJson(Nfa)}.
     * @return A new automaton.
     * @throws IllegalArgumentException if the snapshot is malformed
     */
    public static Nfa fromJson(@Nonnull final String json) {
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Automaton snapshot is not valid JSON", e);
        }
        return fromTree(root);
    }

    public static Nfa fromTree(@Nonnull final JsonNode root) {
        JsonNode states = requireArray(root, STATES);
        Nfa nfa = new Nfa();

        // All states first, since edges may point forward.
        for (int i = 0; i < states.size(); i++) {
            JsonNode state = states.get(i);
            int id = requireInt(state, ID);
            if (id != i) {
                throw new IllegalArgumentException("State at position " + i + " has id " + id);
            }
            JsonNode token = state.get(TOKEN);
            nfa.addState(token == null ? Constants.NO_TOKEN : requireInt(state, TOKEN));
        }

        try {
            for (int i = 0; i < states.size(); i++) {
                JsonNode state = states.get(i);
                for (JsonNode range : optionalArray(state, RANGES)) {
                    requireSize(range, 3);
                    nfa.addEdgeRange(i, asInt(range.get(2)), asInt(range.get(0)), asInt(range.get(1)));
                }
                for (JsonNode sentinel : optionalArray(state, SENTINELS)) {
                    requireSize(sentinel, 2);
                    nfa.addSentinelEdge(i, asInt(sentinel.get(1)), Sentinel.valueOf(sentinel.get(0).asText()));
                }
                for (JsonNode target : optionalArray(state, EPSILON)) {
                    nfa.addEpsilonEdge(i, asInt(target));
                }
            }
            for (JsonNode start : requireArray(root, START_STATES)) {
                nfa.registerStartState(asInt(start));
            }
        } catch (IndexOutOfBoundsException e) {
            throw new IllegalArgumentException("Automaton snapshot refers to a missing state", e);
        }
        return nfa;
    }

    private static JsonNode requireArray(final JsonNode node, final String field) {
        JsonNode array = node.get(field);
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException("Expected array field \"" + field + "\"");
        }
        return array;
    }

    private static JsonNode optionalArray(final JsonNode node, final String field) {
        JsonNode array = node.get(field);
        if (array == null) {
            return OBJECT_MAPPER.createArrayNode();
        }
        if (!array.isArray()) {
            throw new IllegalArgumentException("Expected array field \"" + field + "\"");
        }
        return array;
    }

    private static int requireInt(final JsonNode node, final String field) {
        JsonNode value = node.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Missing field \"" + field + "\"");
        }
        return asInt(value);
    }

    private static int asInt(final JsonNode value) {
        if (value == null || !value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("Expected an int, got " + value);
        }
        return value.intValue();
    }

    private static void requireSize(final JsonNode array, final int size) {
        if (!array.isArray() || array.size() != size) {
            throw new IllegalArgumentException("Expected an array of " + size + " elements, got " + array);
        }
    }
}
