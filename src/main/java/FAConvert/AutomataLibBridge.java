package FAConvert;

import java.util.Collection;
import java.util.Map;
import java.util.SortedSet;

import FAConvert.Model.Automaton;
import FAConvert.Model.DeterministicAutomaton;
import FAConvert.Model.PreconditionException;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.concept.StateIDs;
import net.automatalib.automaton.fsa.NFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;

/**
 * Conversions between the named-state model and AutomataLib's compact automata.
 * Compact state ids follow the sorted order of the state names.
 */
public class AutomataLibBridge {

    private AutomataLibBridge() {}

    /**
     * @param automaton - epsilon-free automaton
     * @throws PreconditionException if {@code automaton} has epsilon transitions
     */
    public static CompactNFA<String> toNFA(Automaton automaton) {
        if (automaton.hasEpsilonTransitions()) {
            throw new PreconditionException("AutomataLib NFAs cannot represent epsilon transitions");
        }
        final Alphabet<String> alphabet = automaton.getInputAlphabet();
        CompactNFA<String> nfa = new CompactNFA<>(alphabet, automaton.size());
        Object2IntMap<String> ids = stateIds(automaton.getStates());
        for (String s : automaton.getStates()) {
            int id = nfa.addState(automaton.isFinal(s));
            nfa.setInitial(id, automaton.getInitialStates().contains(s));
        }
        for (String s : automaton.getStates()) {
            for (Map.Entry<String, SortedSet<String>> e : automaton.getTransitions(s).entrySet()) {
                for (String d : e.getValue()) {
                    nfa.addTransition(ids.getInt(s), e.getKey(), ids.getInt(d));
                }
            }
        }
        return nfa;
    }

    public static CompactDFA<String> toDFA(DeterministicAutomaton dfa) {
        final Alphabet<String> alphabet = Alphabets.fromCollection(dfa.getAlphabet());
        CompactDFA<String> out = new CompactDFA<>(alphabet, dfa.size());
        Object2IntMap<String> ids = stateIds(dfa.getStates());
        for (String s : dfa.getStates()) {
            out.addState(dfa.isFinal(s));
        }
        if (dfa.getInitialState() != null) {
            out.setInitialState(ids.getInt(dfa.getInitialState()));
        }
        for (Map.Entry<String, ? extends Map<String, String>> row : dfa.getTransitions().entrySet()) {
            for (Map.Entry<String, String> e : row.getValue().entrySet()) {
                Integer dst = ids.getInt(e.getValue());
                out.setTransition(ids.getInt(row.getKey()), e.getKey(), dst);
            }
        }
        return out;
    }

    /**
     * Reads an AutomataLib NFA; states are named by their AutomataLib state id.
     */
    public static <S> Automaton fromNFA(NFA<S, String> nfa, Collection<String> inputs) {
        final StateIDs<S> stateIDs = nfa.stateIDs();
        Automaton.Builder out = Automaton.builder().addSymbols(inputs);
        for (S s : nfa.getStates()) {
            String name = String.valueOf(stateIDs.getStateId(s));
            out.addState(name);
            if (nfa.isAccepting(s)) {
                out.addFinal(name);
            }
        }
        for (S s : nfa.getInitialStates()) {
            out.addInitial(String.valueOf(stateIDs.getStateId(s)));
        }
        for (S s : nfa.getStates()) {
            String name = String.valueOf(stateIDs.getStateId(s));
            for (String a : inputs) {
                for (S t : nfa.getTransitions(s, a)) {
                    out.addTransition(name, a, String.valueOf(stateIDs.getStateId(t)));
                }
            }
        }
        return out.build();
    }

    private static Object2IntMap<String> stateIds(Collection<String> sortedNames) {
        Object2IntMap<String> ids = new Object2IntOpenHashMap<>(sortedNames.size());
        ids.defaultReturnValue(-1);
        int i = 0;
        for (String s : sortedNames) {
            ids.put(s, i++);
        }
        return ids;
    }
}
