package FAConvert.Model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * DFA-shaped result: (alphabet, states, initial, finals, transitions).
 * Lists are sorted by name; the transition table maps state -> symbol -> state and may be partial.
 * <p>
 * The constructor only normalizes; membership checks are left to the operations consuming the tuple,
 * so that e.g. the minimizer can report an initial state outside the state set as a precondition error.
 */
public final class DeterministicAutomaton {
    private final List<String> alphabet;
    private final List<String> states;
    private final String initialState;
    private final List<String> finalStates;
    private final SortedMap<String, SortedMap<String, String>> transitions;

    public DeterministicAutomaton(Collection<String> alphabet,
                                 Collection<String> states,
                                 String initialState,
                                 Collection<String> finalStates,
                                 Map<String, ? extends Map<String, String>> transitions) {
        this.alphabet = sortedCopy(alphabet);
        this.states = sortedCopy(states);
        this.initialState = initialState;
        this.finalStates = sortedCopy(finalStates);
        SortedMap<String, SortedMap<String, String>> copy = new TreeMap<>();
        for (Map.Entry<String, ? extends Map<String, String>> e : transitions.entrySet()) {
            copy.put(e.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(e.getValue())));
        }
        this.transitions = Collections.unmodifiableSortedMap(copy);
    }

    private static List<String> sortedCopy(Collection<String> c) {
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(c)));
    }

    /**
     * Reads a deterministic {@link Automaton} as a DFA tuple.
     * @throws PreconditionException if the automaton is not deterministic
     */
    public static DeterministicAutomaton fromAutomaton(Automaton automaton) {
        if (!automaton.isDeterministic()) {
            throw new PreconditionException(
                "Automaton is not deterministic (epsilon transitions, several initial states or several destinations)");
        }
        SortedMap<String, SortedMap<String, String>> table = new TreeMap<>();
        for (String q : automaton.getStates()) {
            SortedMap<String, String> row = new TreeMap<>();
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(q).entrySet()) {
                row.put(e.getKey(), e.getValue().first());
            }
            table.put(q, row);
        }
        String initial = automaton.getInitialStates().isEmpty() ? null : automaton.getInitialStates().first();
        return new DeterministicAutomaton(automaton.getAlphabet(), automaton.getStates(), initial,
            automaton.getFinalStates(), table);
    }

    public Automaton toAutomaton() {
        Automaton.Builder b = Automaton.builder()
            .addSymbols(alphabet)
            .addStates(states)
            .addFinalStates(finalStates);
        if (initialState != null) {
            b.addInitial(initialState);
        }
        for (Map.Entry<String, SortedMap<String, String>> row : transitions.entrySet()) {
            for (Map.Entry<String, String> e : row.getValue().entrySet()) {
                b.addTransition(row.getKey(), e.getKey(), e.getValue());
            }
        }
        return b.build();
    }

    public List<String> getAlphabet() {
        return alphabet;
    }

    public List<String> getStates() {
        return states;
    }

    /**
     * @return the initial state, or null if there is none
     */
    public String getInitialState() {
        return initialState;
    }

    public List<String> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(String state) {
        return Collections.binarySearch(finalStates, state) >= 0;
    }

    public SortedMap<String, SortedMap<String, String>> getTransitions() {
        return transitions;
    }

    /**
     * @return the successor, or null if undefined
     */
    public String getSuccessor(String state, String symbol) {
        SortedMap<String, String> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    public int size() {
        return states.size();
    }

    /**
     * @return true iff every state has a successor for every symbol
     */
    public boolean isComplete() {
        for (String q : states) {
            for (String a : alphabet) {
                if (getSuccessor(q, a) == null) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DeterministicAutomaton)) {
            return false;
        }
        DeterministicAutomaton other = (DeterministicAutomaton) o;
        return alphabet.equals(other.alphabet) && states.equals(other.states)
            && Objects.equals(initialState, other.initialState)
            && finalStates.equals(other.finalStates) && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(alphabet, states, initialState, finalStates, transitions);
    }

    @Override
    public String toString() {
        return "DeterministicAutomaton{alphabet=" + alphabet + ", states=" + states + ", initial=" + initialState
            + ", finals=" + finalStates + ", transitions=" + transitions + "}";
    }
}
