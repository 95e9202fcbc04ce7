package FAConvert.Model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

/**
 * Immutable finite automaton over named states and string symbols.
 * May contain epsilon transitions (labeled {@link #EPSILON}) and several initial states.
 * <p>
 * All views are sorted by name, so iterating over an automaton never depends on hashing.
 * Instances are created with {@link Builder}, which checks that every referenced state and symbol is declared.
 */
public final class Automaton {
    public static final String EPSILON = "ε";

    private final SortedSet<String> states;
    private final SortedSet<String> alphabet;
    private final SortedSet<String> initialStates;
    private final SortedSet<String> finalStates;
    // origin -> symbol -> destinations; only non-empty destination sets are stored
    private final SortedMap<String, SortedMap<String, SortedSet<String>>> transitions;

    private final Alphabet<String> inputAlphabet;

    private Automaton(Builder builder) {
        this.states = Collections.unmodifiableSortedSet(new TreeSet<>(builder.states));
        this.alphabet = Collections.unmodifiableSortedSet(new TreeSet<>(builder.alphabet));
        this.initialStates = Collections.unmodifiableSortedSet(new TreeSet<>(builder.initialStates));
        this.finalStates = Collections.unmodifiableSortedSet(new TreeSet<>(builder.finalStates));
        this.inputAlphabet = Alphabets.fromCollection(alphabet);

        SortedMap<String, SortedMap<String, SortedSet<String>>> copy = new TreeMap<>();
        for (Map.Entry<String, TreeMap<String, TreeSet<String>>> byOrigin : builder.transitions.entrySet()) {
            SortedMap<String, SortedSet<String>> bySymbol = new TreeMap<>();
            for (Map.Entry<String, TreeSet<String>> e : byOrigin.getValue().entrySet()) {
                if (!e.getValue().isEmpty()) {
                    bySymbol.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
                }
            }
            if (!bySymbol.isEmpty()) {
                copy.put(byOrigin.getKey(), Collections.unmodifiableSortedMap(bySymbol));
            }
        }
        this.transitions = Collections.unmodifiableSortedMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SortedSet<String> getStates() {
        return states;
    }

    /**
     * @return the real symbols; never contains {@link #EPSILON}
     */
    public SortedSet<String> getAlphabet() {
        return alphabet;
    }

    public Alphabet<String> getInputAlphabet() {
        return inputAlphabet;
    }

    public SortedSet<String> getInitialStates() {
        return initialStates;
    }

    public SortedSet<String> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public int size() {
        return states.size();
    }

    /**
     * @param state origin state
     * @param symbol a symbol of the alphabet, or {@link #EPSILON}
     * @return the destinations; empty if the transition is undefined
     */
    public SortedSet<String> getTransitions(String state, String symbol) {
        SortedMap<String, SortedSet<String>> bySymbol = transitions.get(state);
        if (bySymbol == null) {
            return Collections.emptySortedSet();
        }
        SortedSet<String> dest = bySymbol.get(symbol);
        return dest == null ? Collections.emptySortedSet() : dest;
    }

    /**
     * @return symbol -> destinations for the given origin; symbols without destinations are absent
     */
    public SortedMap<String, SortedSet<String>> getTransitions(String state) {
        SortedMap<String, SortedSet<String>> bySymbol = transitions.get(state);
        return bySymbol == null ? Collections.emptySortedMap() : bySymbol;
    }

    public boolean hasEpsilonTransitions() {
        for (SortedMap<String, SortedSet<String>> bySymbol : transitions.values()) {
            if (bySymbol.containsKey(EPSILON)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Deterministic: at most one initial state, no epsilon transitions,
     * and at most one destination per (state, symbol). Missing transitions are allowed.
     */
    public boolean isDeterministic() {
        if (initialStates.size() > 1 || hasEpsilonTransitions()) {
            return false;
        }
        for (SortedMap<String, SortedSet<String>> bySymbol : transitions.values()) {
            for (SortedSet<String> dest : bySymbol.values()) {
                if (dest.size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    public int transitionCount() {
        int count = 0;
        for (SortedMap<String, SortedSet<String>> bySymbol : transitions.values()) {
            for (SortedSet<String> dest : bySymbol.values()) {
                count += dest.size();
            }
        }
        return count;
    }

    /**
     * @return a builder pre-filled with this automaton's contents
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.addStates(states).addSymbols(alphabet).addInitialStates(initialStates).addFinalStates(finalStates);
        for (Map.Entry<String, SortedMap<String, SortedSet<String>>> byOrigin : transitions.entrySet()) {
            for (Map.Entry<String, SortedSet<String>> e : byOrigin.getValue().entrySet()) {
                b.addTransitions(byOrigin.getKey(), e.getKey(), e.getValue());
            }
        }
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) o;
        return states.equals(other.states) && alphabet.equals(other.alphabet)
            && initialStates.equals(other.initialStates) && finalStates.equals(other.finalStates)
            && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, initialStates, finalStates, transitions);
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", initial=" + initialStates
            + ", final=" + finalStates + ", transitions=" + transitions + "}";
    }

    public static final class Builder {
        private final TreeSet<String> states = new TreeSet<>();
        private final TreeSet<String> alphabet = new TreeSet<>();
        private final TreeSet<String> initialStates = new TreeSet<>();
        private final TreeSet<String> finalStates = new TreeSet<>();
        private final TreeMap<String, TreeMap<String, TreeSet<String>>> transitions = new TreeMap<>();

        private Builder() {}

        public Builder addState(String state) {
            states.add(Objects.requireNonNull(state, "state"));
            return this;
        }

        public Builder addStates(Collection<String> names) {
            for (String s : names) {
                addState(s);
            }
            return this;
        }

        public Builder addSymbol(String symbol) {
            alphabet.add(Objects.requireNonNull(symbol, "symbol"));
            return this;
        }

        public Builder addSymbols(Collection<String> symbols) {
            for (String a : symbols) {
                addSymbol(a);
            }
            return this;
        }

        public Builder addInitial(String state) {
            initialStates.add(Objects.requireNonNull(state, "initial state"));
            return this;
        }

        public Builder addInitialStates(Collection<String> names) {
            for (String s : names) {
                addInitial(s);
            }
            return this;
        }

        public Builder addFinal(String state) {
            finalStates.add(Objects.requireNonNull(state, "final state"));
            return this;
        }

        public Builder addFinalStates(Collection<String> names) {
            for (String s : names) {
                addFinal(s);
            }
            return this;
        }

        public Builder addTransition(String origin, String symbol, String destination) {
            Objects.requireNonNull(origin, "origin");
            Objects.requireNonNull(symbol, "symbol");
            Objects.requireNonNull(destination, "destination");
            transitions.computeIfAbsent(origin, k -> new TreeMap<>())
                .computeIfAbsent(symbol, k -> new TreeSet<>())
                .add(destination);
            return this;
        }

        public Builder addTransitions(String origin, String symbol, Collection<String> destinations) {
            for (String d : destinations) {
                addTransition(origin, symbol, d);
            }
            return this;
        }

        /**
         * @throws SchemaException if a referenced state or symbol is undeclared, or epsilon is declared as a symbol
         */
        public Automaton build() {
            if (alphabet.contains(EPSILON)) {
                throw new SchemaException("Alphabet must not contain the epsilon symbol " + EPSILON);
            }
            for (String s : initialStates) {
                if (!states.contains(s)) {
                    throw new SchemaException("Initial state is not a declared state: " + s);
                }
            }
            for (String s : finalStates) {
                if (!states.contains(s)) {
                    throw new SchemaException("Final state is not a declared state: " + s);
                }
            }
            for (Map.Entry<String, TreeMap<String, TreeSet<String>>> byOrigin : transitions.entrySet()) {
                if (!states.contains(byOrigin.getKey())) {
                    throw new SchemaException("Transition origin is not a declared state: " + byOrigin.getKey());
                }
                for (Map.Entry<String, TreeSet<String>> e : byOrigin.getValue().entrySet()) {
                    String symbol = e.getKey();
                    if (!EPSILON.equals(symbol) && !alphabet.contains(symbol)) {
                        throw new SchemaException("Transition symbol is not in the alphabet: " + symbol);
                    }
                    for (String d : e.getValue()) {
                        if (!states.contains(d)) {
                            throw new SchemaException("Transition destination is not a declared state: " + d);
                        }
                    }
                }
            }
            return new Automaton(this);
        }
    }
}
