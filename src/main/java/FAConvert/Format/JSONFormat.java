package FAConvert.Format;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import net.automatalib.exception.FormatException;

/**
 * JSON interchange form:
 * <pre>
 * {
 *   "alfabeto": ["a","b"],
 *   "estados": ["Q1","Q2","QF"],
 *   "estadosI": ["Q1"],
 *   "estadosF": ["QF"],
 *   "transicoes": [["Q1","Q2","a"], {"origem":"Q2","destino":"QF","simbolo":"b"}]
 * }
 * </pre>
 * Transition arrays are ordered (origin, destination, symbol). English key names
 * ({@code alphabet, states, initial, final, transitions; from, to, symbol}) are accepted as well,
 * and any list may be given as a string such as {@code "{a, b}"}.
 */
public class JSONFormat {
    static final String[] ALPHABET_KEYS = {"alfabeto", "alfabet0", "alphabet"};
    static final String[] STATES_KEYS = {"estados", "states"};
    static final String[] INITIAL_KEYS = {"estadosI", "initials", "initial"};
    static final String[] FINAL_KEYS = {"estadosF", "finals", "final"};
    static final String[] TRANSITIONS_KEYS = {"transicoes", "transitions"};

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private JSONFormat() {}

    public static Automaton read(InputStream is) throws IOException, FormatException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(is);
        } catch (JsonProcessingException e) {
            throw new FormatException("Malformed JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new FormatException("Expected a JSON object describing the automaton");
        }

        List<String> missing = new ArrayList<>();
        JsonNode alphabet = field(root, ALPHABET_KEYS, missing);
        JsonNode states = field(root, STATES_KEYS, missing);
        JsonNode finals = field(root, FINAL_KEYS, missing);
        JsonNode initials = field(root, INITIAL_KEYS, missing);
        JsonNode transitions = field(root, TRANSITIONS_KEYS, missing);
        if (!missing.isEmpty()) {
            throw new FormatException("Missing keys in JSON: " + String.join(", ", missing));
        }

        Automaton.Builder builder = Automaton.builder()
            .addSymbols(asList(alphabet, ALPHABET_KEYS[0]))
            .addStates(asList(states, STATES_KEYS[0]))
            .addInitialStates(asList(initials, INITIAL_KEYS[0]))
            .addFinalStates(asList(finals, FINAL_KEYS[0]));

        if (!transitions.isArray()) {
            throw new FormatException("'" + TRANSITIONS_KEYS[0] + "' must be a list");
        }
        for (JsonNode item : transitions) {
            final String origin;
            final String destination;
            final String symbol;
            if (item.isArray() && item.size() == 3) {
                origin = item.get(0).asText();
                destination = item.get(1).asText();
                symbol = item.get(2).asText();
            } else if (item.isObject()) {
                origin = text(item, "origem", "from");
                destination = text(item, "destino", "to");
                symbol = text(item, "simbolo", "symbol");
            } else {
                throw new FormatException(
                    "Invalid transition " + item + ". Use [origin, destination, symbol] or {origem, destino, simbolo}");
            }
            builder.addTransition(origin, symbol, destination);
        }
        return builder.build();
    }

    private static JsonNode field(JsonNode root, String[] keys, List<String> missing) {
        for (String k : keys) {
            if (root.has(k)) {
                return root.get(k);
            }
        }
        missing.add(keys[0]);
        return null;
    }

    private static String text(JsonNode item, String key, String alternative) throws FormatException {
        JsonNode node = item.has(key) ? item.get(key) : item.get(alternative);
        if (node == null || node.isNull()) {
            throw new FormatException("Transition " + item + " lacks '" + key + "'");
        }
        return node.asText();
    }

    /**
     * Accepts a JSON array, or a string such as {@code "a,b"}, {@code "{a, b}"} or {@code "['a', 'b']"}.
     */
    static List<String> asList(JsonNode node, String field) throws FormatException {
        if (node.isArray()) {
            List<String> result = new ArrayList<>(node.size());
            for (JsonNode e : node) {
                result.add(e.asText());
            }
            return result;
        }
        if (node.isTextual()) {
            return splitList(node.asText());
        }
        throw new FormatException("Field '" + field + "' must be a list or a string");
    }

    static List<String> splitList(String value) {
        String s = stripChars(value.strip(), "{}[]()");
        if (s.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String part : s.split(",")) {
            String p = stripChars(part.strip(), "'\"");
            if (!p.isEmpty()) {
                result.add(p);
            }
        }
        return result;
    }

    private static String stripChars(String s, String chars) {
        int begin = 0;
        int end = s.length();
        while (begin < end && chars.indexOf(s.charAt(begin)) >= 0) {
            begin++;
        }
        while (end > begin && chars.indexOf(s.charAt(end - 1)) >= 0) {
            end--;
        }
        return s.substring(begin, end);
    }

    public static void write(OutputStream os, Automaton automaton) throws IOException {
        os.write(MAPPER.writeValueAsBytes(toJson(automaton)));
        os.flush();
    }

    public static void write(OutputStream os, DeterministicAutomaton dfa) throws IOException {
        write(os, dfa.toAutomaton());
    }

    static ObjectNode toJson(Automaton automaton) {
        ObjectNode root = MAPPER.createObjectNode();
        addAll(root.putArray(ALPHABET_KEYS[0]), automaton.getAlphabet());
        addAll(root.putArray(STATES_KEYS[0]), automaton.getStates());
        addAll(root.putArray(INITIAL_KEYS[0]), automaton.getInitialStates());
        addAll(root.putArray(FINAL_KEYS[0]), automaton.getFinalStates());
        ArrayNode transitions = root.putArray(TRANSITIONS_KEYS[0]);
        for (String origin : automaton.getStates()) {
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(origin).entrySet()) {
                for (String destination : e.getValue()) {
                    transitions.addArray().add(origin).add(destination).add(e.getKey());
                }
            }
        }
        return root;
    }

    private static void addAll(ArrayNode array, Iterable<String> values) {
        for (String v : values) {
            array.add(v);
        }
    }
}
