package FAConvert;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;

/**
 * Removal of states that are not reachable from an initial state.
 */
public class AutomatonTrim {

    private AutomatonTrim() {}

    public static Automaton trim(Automaton automaton) {
        final SortedSet<String> states = accessibleStates(automaton);
        if (states.size() == automaton.size()) {
            return automaton;
        }

        Automaton.Builder out = Automaton.builder()
            .addStates(states)
            .addSymbols(automaton.getAlphabet())
            .addInitialStates(automaton.getInitialStates());
        for (String s : states) {
            if (automaton.isFinal(s)) {
                out.addFinal(s);
            }
            // all successors of an accessible state are accessible
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(s).entrySet()) {
                out.addTransitions(s, e.getKey(), e.getValue());
            }
        }
        return out.build();
    }

    /**
     * @return states reachable from the initial states, following every transition including epsilon
     */
    public static SortedSet<String> accessibleStates(Automaton automaton) {
        TreeSet<String> result = new TreeSet<>(automaton.getInitialStates());
        Deque<String> queue = new ArrayDeque<>(automaton.getInitialStates());
        while (!queue.isEmpty()) {
            String curr = queue.poll();
            for (SortedSet<String> dest : automaton.getTransitions(curr).values()) {
                enqueueAll(dest, result, queue);
            }
        }
        return result;
    }

    /**
     * @param dfa - DFA with an initial state
     * @return {@code dfa} restricted to the states reachable from its initial state
     */
    public static DeterministicAutomaton trim(DeterministicAutomaton dfa) {
        final SortedSet<String> states = accessibleStates(dfa);
        if (states.size() == dfa.size()) {
            return dfa;
        }

        TreeSet<String> finals = new TreeSet<>();
        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        for (String s : states) {
            if (dfa.isFinal(s)) {
                finals.add(s);
            }
            SortedMap<String, String> row = dfa.getTransitions().get(s);
            table.put(s, row == null ? new TreeMap<>() : row);
        }
        return new DeterministicAutomaton(dfa.getAlphabet(), states, dfa.getInitialState(), finals, table);
    }

    public static SortedSet<String> accessibleStates(DeterministicAutomaton dfa) {
        TreeSet<String> result = new TreeSet<>();
        if (dfa.getInitialState() == null) {
            return result;
        }
        Deque<String> queue = new ArrayDeque<>();
        result.add(dfa.getInitialState());
        queue.add(dfa.getInitialState());
        while (!queue.isEmpty()) {
            SortedMap<String, String> row = dfa.getTransitions().get(queue.poll());
            if (row != null) {
                enqueueAll(row.values(), result, queue);
            }
        }
        return result;
    }

    private static void enqueueAll(Collection<String> states, TreeSet<String> seen, Deque<String> queue) {
        for (String t : states) {
            if (seen.add(t)) {
                queue.add(t);
            }
        }
    }
}
