package FAConvert.Format;

import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;

/**
 * Human-readable rendering, one {@code origin --symbol--> destination} line per transition.
 */
public class AutomatonRenderer {
    private static final String RULE = "=========================";

    private AutomatonRenderer() {}

    public static String render(String title, Automaton automaton) {
        StringBuilder sb = new StringBuilder();
        header(sb, title);
        sb.append("Alphabet: ").append(automaton.getAlphabet()).append('\n');
        sb.append("States: ").append(automaton.getStates()).append('\n');
        sb.append("Initial states: ").append(automaton.getInitialStates()).append('\n');
        sb.append("Final states: ").append(automaton.getFinalStates()).append('\n');
        sb.append("Transitions:\n");
        for (String origin : automaton.getStates()) {
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(origin).entrySet()) {
                sb.append("  ").append(origin).append(" --").append(e.getKey()).append("--> ")
                    .append(String.join(", ", e.getValue())).append('\n');
            }
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    public static String render(String title, DeterministicAutomaton dfa) {
        StringBuilder sb = new StringBuilder();
        header(sb, title);
        sb.append("Alphabet: ").append(dfa.getAlphabet()).append('\n');
        sb.append("States: ").append(dfa.getStates()).append('\n');
        sb.append("Initial state: ").append(dfa.getInitialState()).append('\n');
        sb.append("Final states: ").append(dfa.getFinalStates()).append('\n');
        sb.append("Transitions:\n");
        for (String origin : dfa.getStates()) {
            SortedMap<String, String> row = dfa.getTransitions().get(origin);
            if (row == null) {
                continue;
            }
            for (String sym : dfa.getAlphabet()) {
                String dest = row.get(sym);
                if (dest != null) {
                    sb.append("  ").append(origin).append(" --").append(sym).append("--> ").append(dest).append('\n');
                }
            }
        }
        sb.append(RULE).append('\n');
        return sb.toString();
    }

    private static void header(StringBuilder sb, String title) {
        sb.append(RULE).append('\n').append(title).append('\n').append(RULE).append('\n');
    }
}
